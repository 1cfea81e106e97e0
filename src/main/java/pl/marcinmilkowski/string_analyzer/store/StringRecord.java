package pl.marcinmilkowski.string_analyzer.store;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyBundle;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored string. The id is the content hash of the value, so equal values share an id.
 */
public record StringRecord(String id, String value, PropertyBundle properties, Instant createdAt) {

    public StringRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(createdAt, "createdAt");
        if (!id.equals(properties.sha256Hash())) {
            throw new IllegalArgumentException("Record id must equal the content hash of its value");
        }
    }

    /**
     * Create a record keyed by the bundle's content hash.
     */
    public static StringRecord of(String value, PropertyBundle properties, Instant createdAt) {
        return new StringRecord(properties.sha256Hash(), value, properties, createdAt);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("id", id);
        obj.put("value", value);
        obj.put("properties", properties.toJson());
        obj.put("created_at", createdAt.toString());
        return obj;
    }
}
