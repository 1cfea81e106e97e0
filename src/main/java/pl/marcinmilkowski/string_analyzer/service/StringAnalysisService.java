package pl.marcinmilkowski.string_analyzer.service;

import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.analysis.ContentHasher;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyAnalyzer;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyBundle;
import pl.marcinmilkowski.string_analyzer.query.FilterMatcher;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;
import pl.marcinmilkowski.string_analyzer.query.InterpretedQuery;
import pl.marcinmilkowski.string_analyzer.query.NaturalLanguageTranslator;
import pl.marcinmilkowski.string_analyzer.store.StringRecord;
import pl.marcinmilkowski.string_analyzer.store.StringStore;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Use cases behind the HTTP endpoints: analyze and store, look up, list, filter, delete.
 *
 * <p>The store is owned by the caller and injected; this class never closes it.</p>
 */
public class StringAnalysisService {

    private final StringStore store;
    private final int maxValueLength;
    private final PropertyAnalyzer analyzer;
    private final NaturalLanguageTranslator translator;
    private final FilterMatcher matcher;
    private final Clock clock;

    public StringAnalysisService(StringStore store, int maxValueLength) {
        this(store, maxValueLength, new PropertyAnalyzer(), new NaturalLanguageTranslator(),
            new FilterMatcher(), Clock.systemUTC());
    }

    public StringAnalysisService(StringStore store, int maxValueLength, PropertyAnalyzer analyzer,
                                 NaturalLanguageTranslator translator, FilterMatcher matcher, Clock clock) {
        this.store = store;
        this.maxValueLength = maxValueLength;
        this.analyzer = analyzer;
        this.translator = translator;
        this.matcher = matcher;
        this.clock = clock;
    }

    /**
     * Analyze a value and store it.
     *
     * @throws StringAnalyzerException INVALID_INPUT for null, PAYLOAD_TOO_LARGE above the limit,
     *         DUPLICATE_KEY if the value is already stored
     */
    public StringRecord create(String value) throws IOException {
        if (value == null) {
            throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Missing \"value\" field");
        }
        int length = value.codePointCount(0, value.length());
        if (length > maxValueLength) {
            throw new StringAnalyzerException(ErrorKind.PAYLOAD_TOO_LARGE,
                "Value is " + length + " characters long; the maximum is " + maxValueLength);
        }

        PropertyBundle properties = analyzer.analyze(value);
        StringRecord record = StringRecord.of(value, properties, Instant.now(clock));
        store.insert(record);
        return record;
    }

    /**
     * Look up a record by id, or by raw value when no record has that id.
     *
     * @throws StringAnalyzerException NOT_FOUND if neither matches
     */
    public StringRecord get(String key) throws IOException {
        return resolve(key).orElseThrow(() -> notFound(key));
    }

    /**
     * Delete a record by id or raw value.
     *
     * @throws StringAnalyzerException NOT_FOUND if neither matches
     */
    public void delete(String key) throws IOException {
        StringRecord record = resolve(key).orElseThrow(() -> notFound(key));
        if (!store.delete(record.id())) {
            // removed concurrently between lookup and delete
            throw notFound(key);
        }
    }

    /**
     * Records matching structured filters.
     *
     * @throws StringAnalyzerException FILTER_CONFLICT for contradictory bounds
     */
    public List<StringRecord> list(FilterSet filters) throws IOException {
        matcher.validate(filters);
        return store.find(filters);
    }

    /**
     * Translate a natural-language query and list the matching records.
     *
     * @throws StringAnalyzerException UNPARSEABLE_QUERY if no rule applies; FILTER_CONFLICT
     *         with the interpretation attached as "interpreted_query" detail
     */
    public NaturalLanguageResult filterByNaturalLanguage(String query) throws IOException {
        InterpretedQuery interpreted = translator.translate(query);
        try {
            matcher.validate(interpreted.parsedFilters());
        } catch (StringAnalyzerException e) {
            throw e.withDetail("interpreted_query", interpreted.toJson());
        }
        return new NaturalLanguageResult(interpreted, store.find(interpreted.parsedFilters()));
    }

    public long count() throws IOException {
        return store.count();
    }

    public String getStoreName() {
        return store.getName();
    }

    public int getMaxValueLength() {
        return maxValueLength;
    }

    private Optional<StringRecord> resolve(String key) throws IOException {
        Optional<StringRecord> byId = store.findById(key);
        if (byId.isPresent()) {
            return byId;
        }
        return store.findById(ContentHasher.sha256Hex(key));
    }

    private static StringAnalyzerException notFound(String key) {
        return new StringAnalyzerException(ErrorKind.NOT_FOUND, "String does not exist in the system: " + key);
    }
}
