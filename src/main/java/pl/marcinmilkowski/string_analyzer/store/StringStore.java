package pl.marcinmilkowski.string_analyzer.store;

import pl.marcinmilkowski.string_analyzer.query.FilterSet;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Record store keyed by content hash.
 * Implementations are interchangeable and selected through {@link StringStoreFactory}.
 */
public interface StringStore extends Closeable {

    /**
     * Insert a record. The uniqueness check and the insert happen as one atomic step.
     *
     * @throws pl.marcinmilkowski.string_analyzer.StringAnalyzerException with
     *         {@link pl.marcinmilkowski.string_analyzer.ErrorKind#DUPLICATE_KEY} if the id is already stored
     * @throws IOException if the backing storage fails
     */
    void insert(StringRecord record) throws IOException;

    /**
     * Look up a record by id.
     */
    Optional<StringRecord> findById(String id) throws IOException;

    /**
     * Delete a record by id.
     *
     * @return true if a record was removed
     */
    boolean delete(String id) throws IOException;

    /**
     * Records matching every present filter, oldest first.
     * The caller validates the filters before calling.
     */
    List<StringRecord> find(FilterSet filters) throws IOException;

    /**
     * Number of stored records.
     */
    long count() throws IOException;

    /**
     * Short name reported by the health endpoint.
     */
    String getName();
}
