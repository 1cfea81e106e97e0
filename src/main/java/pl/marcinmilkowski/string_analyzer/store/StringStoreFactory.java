package pl.marcinmilkowski.string_analyzer.store;

import java.io.IOException;
import java.util.Locale;

/**
 * Factory for creating StringStore instances.
 *
 * Supports:
 * - MEMORY: transient map, lost on restart
 * - LUCENE: persistent index on disk
 */
public class StringStoreFactory {

    /**
     * Store type enumeration.
     */
    public enum StoreType {
        MEMORY,
        LUCENE;

        /**
         * Parse a config value such as "memory" or "lucene".
         *
         * @throws IllegalArgumentException for unknown names
         */
        public static StoreType fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown store type: " + name + " (expected memory or lucene)", e);
            }
        }

        public String configName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private StringStoreFactory() {}

    /**
     * Create a store of the given type.
     *
     * @param indexPath index directory, required for LUCENE and ignored for MEMORY
     * @throws IOException if the index cannot be opened
     */
    public static StringStore create(StoreType type, String indexPath) throws IOException {
        return switch (type) {
            case MEMORY -> new InMemoryStringStore();
            case LUCENE -> {
                if (indexPath == null || indexPath.isBlank()) {
                    throw new IllegalArgumentException("Lucene store requires an index path");
                }
                yield new LuceneStringStore(indexPath);
            }
        };
    }
}
