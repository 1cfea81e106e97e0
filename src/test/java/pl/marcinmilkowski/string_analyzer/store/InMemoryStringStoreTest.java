package pl.marcinmilkowski.string_analyzer.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyAnalyzer;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryStringStore.
 */
class InMemoryStringStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final PropertyAnalyzer analyzer = new PropertyAnalyzer();
    private final InMemoryStringStore store = new InMemoryStringStore();

    private StringRecord record(String value, int secondsAfterStart) {
        return StringRecord.of(value, analyzer.analyze(value), T0.plusSeconds(secondsAfterStart));
    }

    @Test
    void testInsertAndFindById() {
        StringRecord madam = record("madam", 0);
        store.insert(madam);

        assertEquals(madam, store.findById(madam.id()).orElseThrow());
        assertTrue(store.findById("0".repeat(64)).isEmpty());
        assertEquals(1, store.count());
    }

    @Test
    void testDuplicateInsertIsRejected() {
        store.insert(record("madam", 0));
        StringAnalyzerException e = assertThrows(StringAnalyzerException.class,
            () -> store.insert(record("madam", 5)));
        assertEquals(ErrorKind.DUPLICATE_KEY, e.getKind());
        assertEquals(T0, store.findById(record("madam", 0).id()).orElseThrow().createdAt());
    }

    @Test
    void testDelete() {
        StringRecord hello = record("hello", 0);
        store.insert(hello);

        assertTrue(store.delete(hello.id()));
        assertFalse(store.delete(hello.id()));
        assertTrue(store.findById(hello.id()).isEmpty());
    }

    @Test
    @DisplayName("find applies filters and returns records oldest first")
    void testFindOrdersByCreation() {
        store.insert(record("racecar", 2));
        store.insert(record("hello world", 1));
        store.insert(record("madam", 0));

        List<String> palindromes = store.find(FilterSet.builder().isPalindrome(true).build())
            .stream().map(StringRecord::value).toList();
        assertEquals(List.of("madam", "racecar"), palindromes);

        List<String> all = store.find(FilterSet.empty()).stream().map(StringRecord::value).toList();
        assertEquals(List.of("madam", "hello world", "racecar"), all);
    }

    @Test
    @DisplayName("Concurrent inserts of the same value store exactly one record")
    void testConcurrentDuplicateInsert() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<Boolean> attempt = () -> {
                start.await();
                try {
                    store.insert(record("same value", 0));
                    return true;
                } catch (StringAnalyzerException e) {
                    return false;
                }
            };
            List<Future<Boolean>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(10, TimeUnit.SECONDS)) successes++;
            }
            assertEquals(1, successes);
            assertEquals(1, store.count());
        } finally {
            pool.shutdownNow();
        }
    }
}
