package pl.marcinmilkowski.string_analyzer.store;

import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.query.FilterMatcher;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Transient store backed by a concurrent map. Contents are lost when the process exits.
 */
public class InMemoryStringStore implements StringStore {

    static final Comparator<StringRecord> CREATION_ORDER =
        Comparator.comparing(StringRecord::createdAt).thenComparing(StringRecord::id);

    private final ConcurrentMap<String, StringRecord> records = new ConcurrentHashMap<>();
    private final FilterMatcher matcher;

    public InMemoryStringStore() {
        this(new FilterMatcher());
    }

    public InMemoryStringStore(FilterMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public void insert(StringRecord record) {
        if (records.putIfAbsent(record.id(), record) != null) {
            throw new StringAnalyzerException(ErrorKind.DUPLICATE_KEY,
                "String already exists in the system (id " + record.id() + ")");
        }
    }

    @Override
    public Optional<StringRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public boolean delete(String id) {
        return records.remove(id) != null;
    }

    @Override
    public List<StringRecord> find(FilterSet filters) {
        return records.values().stream()
            .filter(r -> matcher.matches(r.value(), r.properties(), filters))
            .sorted(CREATION_ORDER)
            .toList();
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public void close() {
        records.clear();
    }
}
