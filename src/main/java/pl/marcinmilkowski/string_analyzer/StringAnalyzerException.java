package pl.marcinmilkowski.string_analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-request failure with a typed {@link ErrorKind}.
 *
 * <p>Thrown by the analysis core, the stores and the service; the API layer is
 * the only place that turns it into a response. Optional details are merged
 * into the JSON error body.</p>
 */
public class StringAnalyzerException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public StringAnalyzerException(ErrorKind kind, String message) {
        this(kind, message, Map.of());
    }

    public StringAnalyzerException(ErrorKind kind, String message, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Copy of this exception with one more detail entry.
     */
    public StringAnalyzerException withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        StringAnalyzerException copy = new StringAnalyzerException(kind, getMessage(), merged);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
