package pl.marcinmilkowski.string_analyzer.store;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyAnalyzer;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LuceneStringStore.
 */
class LuceneStringStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00.123456789Z");

    @TempDir
    Path tempDir;

    private final PropertyAnalyzer analyzer = new PropertyAnalyzer();

    private StringRecord record(String value, int secondsAfterStart) {
        return StringRecord.of(value, analyzer.analyze(value), T0.plusSeconds(secondsAfterStart));
    }

    private LuceneStringStore open() throws IOException {
        return new LuceneStringStore(tempDir.resolve("index").toString());
    }

    private List<String> values(List<StringRecord> records) {
        return records.stream().map(StringRecord::value).toList();
    }

    @Test
    @DisplayName("Lookup by id returns the inserted record unchanged")
    void testRoundTrip() throws IOException {
        try (LuceneStringStore store = open()) {
            StringRecord original = record("Zażółć gęślą jaźń 😀", 0);
            store.insert(original);

            StringRecord loaded = store.findById(original.id()).orElseThrow();
            assertEquals(original, loaded);
            assertEquals(original.toJson(), loaded.toJson());
        }
    }

    @Test
    void testDuplicateInsertIsRejected() throws IOException {
        try (LuceneStringStore store = open()) {
            store.insert(record("madam", 0));
            StringAnalyzerException e = assertThrows(StringAnalyzerException.class,
                () -> store.insert(record("madam", 1)));
            assertEquals(ErrorKind.DUPLICATE_KEY, e.getKind());
            assertEquals(1, store.count());
        }
    }

    @Test
    @DisplayName("A read after delete does not see the record")
    void testDelete() throws IOException {
        try (LuceneStringStore store = open()) {
            StringRecord hello = record("hello", 0);
            store.insert(hello);

            assertTrue(store.delete(hello.id()));
            assertTrue(store.findById(hello.id()).isEmpty());
            assertFalse(store.delete(hello.id()));
            assertEquals(0, store.count());

            // the same value can be stored again after deletion
            store.insert(record("hello", 3));
            assertEquals(1, store.count());
        }
    }

    @Test
    void testFindWithIndexedFilters() throws IOException {
        try (LuceneStringStore store = open()) {
            store.insert(record("madam", 0));
            store.insert(record("hello world", 1));
            store.insert(record("racecar", 2));
            store.insert(record("a", 3));
            store.insert(record("never odd or even", 4));

            assertEquals(List.of("madam", "racecar", "a"),
                values(store.find(FilterSet.builder().isPalindrome(true).build())));
            assertEquals(List.of("madam", "racecar"),
                values(store.find(FilterSet.builder().minLength(5).maxLength(7).build())));
            assertEquals(List.of("hello world"),
                values(store.find(FilterSet.builder().wordCount(2).build())));
            assertEquals(List.of("hello world", "never odd or even"),
                values(store.find(FilterSet.builder().isPalindrome(false).build())));
            assertEquals(5, store.find(FilterSet.empty()).size());
        }
    }

    @Test
    @DisplayName("contains_character is checked case-insensitively on loaded records")
    void testFindWithCharacterFilter() throws IOException {
        try (LuceneStringStore store = open()) {
            store.insert(record("madam", 0));
            store.insert(record("Hello World", 1));

            assertEquals(List.of("Hello World"),
                values(store.find(FilterSet.builder().containsCharacter("w").build())));
            assertEquals(List.of("madam"),
                values(store.find(FilterSet.builder().containsCharacter("M").isPalindrome(true).build())));
            assertTrue(store.find(FilterSet.builder().containsCharacter("z").build()).isEmpty());
        }
    }

    @Test
    void testFindOnEmptyIndex() throws IOException {
        try (LuceneStringStore store = open()) {
            assertTrue(store.find(FilterSet.empty()).isEmpty());
            assertEquals(0, store.count());
        }
    }

    @Test
    @DisplayName("Records survive closing and reopening the index")
    void testPersistence() throws IOException {
        StringRecord madam = record("madam", 0);
        try (LuceneStringStore store = open()) {
            store.insert(madam);
        }

        try (LuceneStringStore store = open()) {
            assertEquals(1, store.count());
            assertEquals(madam, store.findById(madam.id()).orElseThrow());
            assertThrows(StringAnalyzerException.class, () -> store.insert(madam));
        }
    }

    @Test
    @DisplayName("Concurrent inserts of the same value store exactly one record")
    void testConcurrentDuplicateInsert() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try (LuceneStringStore store = open()) {
            Callable<Boolean> attempt = () -> {
                start.await();
                try {
                    store.insert(record("same value", 0));
                    return true;
                } catch (StringAnalyzerException e) {
                    return false;
                }
            };
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(30, TimeUnit.SECONDS)) successes++;
            }
            assertEquals(1, successes);
            assertEquals(1, store.count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testFactoryCreatesStores() throws IOException {
        try (StringStore memory = StringStoreFactory.create(StringStoreFactory.StoreType.MEMORY, null)) {
            assertEquals("memory", memory.getName());
        }
        try (StringStore lucene = StringStoreFactory.create(StringStoreFactory.StoreType.LUCENE,
                tempDir.resolve("factory").toString())) {
            assertEquals("lucene", lucene.getName());
        }
        assertThrows(IllegalArgumentException.class,
            () -> StringStoreFactory.create(StringStoreFactory.StoreType.LUCENE, " "));
        assertEquals(StringStoreFactory.StoreType.LUCENE, StringStoreFactory.StoreType.fromName("Lucene"));
        assertThrows(IllegalArgumentException.class, () -> StringStoreFactory.StoreType.fromName("redis"));
    }
}
