package pl.marcinmilkowski.string_analyzer;

/**
 * Failure categories raised while analyzing, storing and filtering strings.
 * Each kind carries the HTTP status the API layer answers with.
 */
public enum ErrorKind {
    /** Missing field, malformed filter parameter or body that is not a JSON object */
    INVALID_INPUT(400),

    /** "value" present but not a JSON string */
    INVALID_TYPE(422),

    /** Value longer than the configured maximum */
    PAYLOAD_TOO_LARGE(413),

    /** A record with the same content hash is already stored */
    DUPLICATE_KEY(409),

    /** Lookup or delete of an unknown value or hash */
    NOT_FOUND(404),

    /** Filters that are valid on their own but contradict each other */
    FILTER_CONFLICT(422),

    /** Natural-language query that none of the translation rules recognized */
    UNPARSEABLE_QUERY(400);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
