package pl.marcinmilkowski.string_analyzer.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.string_analyzer.store.StringStoreFactory.StoreType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Service configuration loaded from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "port": 8080,
 *   "threads": 8,
 *   "max_value_length": 10000,
 *   "store": "memory",
 *   "index_path": "data/strings-index"
 * }
 *
 * Only "version" is mandatory; "index_path" is required when "store" is "lucene".
 */
public class ServiceConfig {
    private static final Logger logger = LoggerFactory.getLogger(ServiceConfig.class);

    public static final String DEFAULT_RESOURCE = "string-analyzer.json";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_THREADS = 8;
    public static final int DEFAULT_MAX_VALUE_LENGTH = 10_000;

    private final String version;
    private final int port;
    private final int threads;
    private final int maxValueLength;
    private final StoreType storeType;
    private final String indexPath;
    private final String source;

    private ServiceConfig(String version, int port, int threads, int maxValueLength,
                          StoreType storeType, String indexPath, String source) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid 'port' in " + source + ": " + port);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("'threads' must be positive in " + source + ": " + threads);
        }
        if (maxValueLength < 1) {
            throw new IllegalArgumentException("'max_value_length' must be positive in " + source + ": " + maxValueLength);
        }
        if (storeType == StoreType.LUCENE && (indexPath == null || indexPath.isBlank())) {
            throw new IllegalArgumentException("'index_path' is required for the lucene store in " + source);
        }
        this.version = version;
        this.port = port;
        this.threads = threads;
        this.maxValueLength = maxValueLength;
        this.storeType = storeType;
        this.indexPath = indexPath;
        this.source = source;
    }

    /**
     * Load configuration from a JSON file.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static ServiceConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Config file not found: " + configPath);
        }
        return parse(Files.readString(configPath), configPath.toString());
    }

    /**
     * Load the configuration bundled on the classpath.
     */
    public static ServiceConfig loadDefault() {
        try (InputStream in = ServiceConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default config resource not found: " + DEFAULT_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default config: " + DEFAULT_RESOURCE, e);
        }
    }

    static ServiceConfig parse(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed JSON in " + source + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty config: " + source);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in " + source);
        }

        ServiceConfig config = new ServiceConfig(
            parsedVersion,
            root.getIntValue("port", DEFAULT_PORT),
            root.getIntValue("threads", DEFAULT_THREADS),
            root.getIntValue("max_value_length", DEFAULT_MAX_VALUE_LENGTH),
            StoreType.fromName(root.getString("store") != null ? root.getString("store") : "memory"),
            root.getString("index_path"),
            source
        );

        logger.info("Loaded service config version {} from {}: store={}, port={}, max_value_length={}",
            config.version, source, config.storeType.configName(), config.port, config.maxValueLength);
        return config;
    }

    /**
     * Copy with command-line overrides applied; {@code null} keeps the current value.
     */
    public ServiceConfig withOverrides(Integer port, StoreType storeType, String indexPath) {
        return new ServiceConfig(
            version,
            port != null ? port : this.port,
            threads,
            maxValueLength,
            storeType != null ? storeType : this.storeType,
            indexPath != null ? indexPath : this.indexPath,
            source + " (with overrides)"
        );
    }

    public String getVersion() {
        return version;
    }

    public int getPort() {
        return port;
    }

    public int getThreads() {
        return threads;
    }

    public int getMaxValueLength() {
        return maxValueLength;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public String getIndexPath() {
        return indexPath;
    }

    /**
     * Export the active config, logged by the server command at startup.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        root.put("port", port);
        root.put("threads", threads);
        root.put("max_value_length", maxValueLength);
        root.put("store", storeType.configName());
        if (indexPath != null) root.put("index_path", indexPath);
        return root;
    }
}
