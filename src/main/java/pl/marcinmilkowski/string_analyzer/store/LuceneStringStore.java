package pl.marcinmilkowski.string_analyzer.store;

import com.alibaba.fastjson2.JSON;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyBundle;
import pl.marcinmilkowski.string_analyzer.query.FilterMatcher;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store: one Lucene document per record.
 *
 * <p>Writes are serialized, committed and followed by a blocking searcher refresh,
 * so a read issued after a write returns always sees it. Reads go through a
 * {@link SearcherManager} and may run concurrently.</p>
 */
public class LuceneStringStore implements StringStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneStringStore.class);

    static final String FIELD_ID = "id";
    static final String FIELD_VALUE = "value";
    static final String FIELD_PROPERTIES = "properties";
    static final String FIELD_CREATED_AT = "created_at";
    static final String FIELD_LENGTH = "length";
    static final String FIELD_WORD_COUNT = "word_count";
    static final String FIELD_PALINDROME = "is_palindrome";

    private final Path indexPath;
    private final Directory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final FilterQueryCompiler compiler = new FilterQueryCompiler();
    private final FilterMatcher matcher;
    private final Object writeLock = new Object();

    public LuceneStringStore(String indexPath) throws IOException {
        this(indexPath, new FilterMatcher());
    }

    public LuceneStringStore(String indexPath, FilterMatcher matcher) throws IOException {
        this.indexPath = Paths.get(indexPath);
        this.matcher = matcher;

        Files.createDirectories(this.indexPath);
        this.directory = FSDirectory.open(this.indexPath);

        IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.writer = new IndexWriter(directory, config);
        this.searcherManager = new SearcherManager(writer, null);

        logger.info("Lucene string store opened at {} ({} records)", this.indexPath, writer.getDocStats().numDocs);
    }

    @Override
    public void insert(StringRecord record) throws IOException {
        synchronized (writeLock) {
            if (countById(record.id()) > 0) {
                throw new StringAnalyzerException(ErrorKind.DUPLICATE_KEY,
                    "String already exists in the system (id " + record.id() + ")");
            }
            writer.addDocument(createDocument(record));
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        }
    }

    @Override
    public Optional<StringRecord> findById(String id) throws IOException {
        IndexSearcher searcher = searcherManager.acquire();
        try {
            TopDocs hits = searcher.search(new TermQuery(new Term(FIELD_ID, id)), 1);
            if (hits.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(toRecord(searcher.storedFields().document(hits.scoreDocs[0].doc)));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public boolean delete(String id) throws IOException {
        synchronized (writeLock) {
            if (countById(id) == 0) {
                return false;
            }
            writer.deleteDocuments(new Term(FIELD_ID, id));
            writer.commit();
            searcherManager.maybeRefreshBlocking();
            return true;
        }
    }

    @Override
    public List<StringRecord> find(FilterSet filters) throws IOException {
        Query query = compiler.compile(filters);
        IndexSearcher searcher = searcherManager.acquire();
        try {
            int limit = Math.max(1, searcher.getIndexReader().maxDoc());
            TopDocs hits = searcher.search(query, limit);
            StoredFields storedFields = searcher.storedFields();

            List<StringRecord> results = new ArrayList<>(hits.scoreDocs.length);
            for (ScoreDoc hit : hits.scoreDocs) {
                StringRecord record = toRecord(storedFields.document(hit.doc));
                // re-check: contains_character is not indexed
                if (matcher.matches(record.value(), record.properties(), filters)) {
                    results.add(record);
                }
            }
            results.sort(InMemoryStringStore.CREATION_ORDER);
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public long count() throws IOException {
        IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public String getName() {
        return "lucene";
    }

    private int countById(String id) throws IOException {
        IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.count(new TermQuery(new Term(FIELD_ID, id)));
        } finally {
            searcherManager.release(searcher);
        }
    }

    private Document createDocument(StringRecord record) {
        PropertyBundle properties = record.properties();
        Document doc = new Document();

        // Stored fields for reconstruction
        doc.add(new StringField(FIELD_ID, record.id(), Field.Store.YES));
        doc.add(new StoredField(FIELD_VALUE, record.value()));
        doc.add(new StoredField(FIELD_PROPERTIES, JSON.toJSONString(properties.toJson())));
        doc.add(new StoredField(FIELD_CREATED_AT, record.createdAt().toString()));

        // Indexed fields for filter push-down
        doc.add(new IntPoint(FIELD_LENGTH, properties.length()));
        doc.add(new IntPoint(FIELD_WORD_COUNT, properties.wordCount()));
        doc.add(new StringField(FIELD_PALINDROME, Boolean.toString(properties.isPalindrome()), Field.Store.NO));

        return doc;
    }

    private StringRecord toRecord(Document doc) {
        PropertyBundle properties = PropertyBundle.fromJson(JSON.parseObject(doc.get(FIELD_PROPERTIES)));
        return new StringRecord(
            doc.get(FIELD_ID),
            doc.get(FIELD_VALUE),
            properties,
            Instant.parse(doc.get(FIELD_CREATED_AT))
        );
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
        logger.info("Lucene string store at {} closed", indexPath);
    }
}
