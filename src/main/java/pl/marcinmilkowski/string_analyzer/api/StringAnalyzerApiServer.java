package pl.marcinmilkowski.string_analyzer.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.string_analyzer.ErrorKind;
import pl.marcinmilkowski.string_analyzer.StringAnalyzerException;
import pl.marcinmilkowski.string_analyzer.query.FilterSet;
import pl.marcinmilkowski.string_analyzer.service.NaturalLanguageResult;
import pl.marcinmilkowski.string_analyzer.service.StringAnalysisService;
import pl.marcinmilkowski.string_analyzer.store.StringRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * REST API server for string analysis.
 *
 * Endpoints:
 * - GET    /health - Health check
 * - POST   /strings - Analyze and store {"value": "..."}
 * - GET    /strings?is_palindrome=&min_length=&max_length=&word_count=&contains_character= - Filtered list
 * - GET    /strings/filter-by-natural-language?query=... - List by natural-language query
 * - GET    /strings/{id or value} - Single record
 * - DELETE /strings/{id or value} - Remove record
 */
public class StringAnalyzerApiServer {

    private static final Logger logger = LoggerFactory.getLogger(StringAnalyzerApiServer.class);

    private static final String STRINGS_PATH = "/strings";
    private static final String NATURAL_LANGUAGE_PATH = "/strings/filter-by-natural-language";

    private final StringAnalysisService service;
    private final int port;
    private final int threads;
    private HttpServer server;
    private ExecutorService executor;

    public StringAnalyzerApiServer(StringAnalysisService service, int port, int threads) {
        this.service = service;
        this.port = port;
        this.threads = threads;
    }

    /**
     * Start the API server. Port 0 binds an ephemeral port, see {@link #getPort()}.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext(NATURAL_LANGUAGE_PATH, wrapHandler(this::handleNaturalLanguage));
        server.createContext(STRINGS_PATH, wrapHandler(this::handleStrings));

        executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);
        server.start();
        logger.info("API server started on http://localhost:{} ({} store)", getPort(), service.getStoreName());
        logger.info("Endpoints:");
        logger.info("  GET    /health                             - Health check");
        logger.info("  POST   /strings                            - Analyze and store a string");
        logger.info("  GET    /strings                            - List strings with filters");
        logger.info("  GET    /strings/filter-by-natural-language - List strings by natural-language query");
        logger.info("  GET    /strings/{{id|value}}                 - Get one string");
        logger.info("  DELETE /strings/{{id|value}}                 - Delete one string");
    }

    /**
     * Stop the API server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("API server stopped");
        }
    }

    /**
     * Actual bound port, useful when started with port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to map typed failures to their status code and everything else to 500.
     */
    private HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                addStandardHeaders(exchange);
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            try {
                addStandardHeaders(exchange);
                handler.handle(exchange);
            } catch (StringAnalyzerException e) {
                logger.debug("{} {} -> {}: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(), e.getKind(), e.getMessage());
                sendError(exchange, e.getKind().httpStatus(), e.getMessage(), e.getDetails());
            } catch (Exception e) {
                if (isClientConnectionIssue(e)) {
                    logger.debug("Client disconnected: {}", e.getMessage());
                    exchange.close();
                    return;
                }
                logger.error("Unhandled exception for {} {}", exchange.getRequestMethod(),
                    exchange.getRequestURI(), e);
                if (exchange.getResponseCode() != -1) {
                    logger.warn("Cannot send error response: headers already sent");
                    exchange.close();
                    return;
                }
                sendError(exchange, 500, "Internal server error", Map.of());
            }
        };
    }

    private boolean isClientConnectionIssue(Throwable t) {
        Throwable current = t;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("broken pipe")
                    || lower.contains("connection reset")
                    || lower.contains("forcibly closed")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * CORS, caching and security headers sent with every response.
     */
    private void addStandardHeaders(HttpExchange exchange) {
        var headers = exchange.getResponseHeaders();
        headers.set("Access-Control-Allow-Origin", "*");
        headers.set("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
        headers.set("Access-Control-Allow-Headers", "Content-Type");
        headers.set("Cache-Control", "no-store, no-cache, must-revalidate, max-age=0");
        headers.set("X-Content-Type-Options", "nosniff");
        headers.set("X-Frame-Options", "DENY");
        headers.set("Referrer-Policy", "no-referrer");
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed", Map.of());
            return;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "string-analyzer-lucene");
        response.put("store", service.getStoreName());
        response.put("records", service.count());
        response.put("max_value_length", service.getMaxValueLength());

        sendJson(exchange, 200, response);
    }

    /**
     * Dispatch /strings and /strings/{key}.
     */
    private void handleStrings(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        if (!path.equals(STRINGS_PATH) && !path.startsWith(STRINGS_PATH + "/")) {
            sendError(exchange, 404, "Not found", Map.of());
            return;
        }
        String key = path.length() > STRINGS_PATH.length() + 1 ? path.substring(STRINGS_PATH.length() + 1) : null;

        if (key == null) {
            if ("POST".equalsIgnoreCase(method)) {
                handleCreate(exchange);
            } else if ("GET".equalsIgnoreCase(method)) {
                handleList(exchange);
            } else {
                sendError(exchange, 405, "Method not allowed", Map.of());
            }
            return;
        }

        if ("GET".equalsIgnoreCase(method)) {
            sendJson(exchange, 200, service.get(key).toJson());
        } else if ("DELETE".equalsIgnoreCase(method)) {
            service.delete(key);
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        } else {
            sendError(exchange, 405, "Method not allowed", Map.of());
        }
    }

    /**
     * POST /strings
     * Body: {"value": "some text"}
     */
    private void handleCreate(HttpExchange exchange) throws IOException {
        String body = readBody(exchange, maxBodyBytes());
        if (body.isBlank()) {
            throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Invalid request body or missing \"value\" field");
        }

        Object parsed;
        try {
            parsed = JSON.parse(body);
        } catch (JSONException e) {
            throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Request body is not valid JSON");
        }
        if (!(parsed instanceof JSONObject)) {
            throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Request body must be a JSON object");
        }
        JSONObject request = (JSONObject) parsed;
        if (!request.containsKey("value")) {
            throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Invalid request body or missing \"value\" field");
        }

        Object value = request.get("value");
        if (!(value instanceof String)) {
            throw new StringAnalyzerException(ErrorKind.INVALID_TYPE, "Invalid data type for \"value\" (must be string)");
        }

        StringRecord record = service.create((String) value);
        logger.debug("Stored string {}", record.id());
        sendJson(exchange, 201, record.toJson());
    }

    /**
     * Upper bound for a create request: every character escaped as a surrogate pair, plus envelope.
     */
    private long maxBodyBytes() {
        return service.getMaxValueLength() * 12L + 1024;
    }

    /**
     * Read the request body, failing with PAYLOAD_TOO_LARGE as soon as it exceeds {@code limit} bytes.
     */
    private String readBody(HttpExchange exchange, long limit) throws IOException {
        String declared = exchange.getRequestHeaders().getFirst("Content-Length");
        if (declared != null) {
            try {
                if (Long.parseLong(declared.trim()) > limit) {
                    throw tooLarge(limit);
                }
            } catch (NumberFormatException e) {
                throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Invalid Content-Length: " + declared);
            }
        }

        int cap = (int) Math.min(limit + 1, Integer.MAX_VALUE - 8);
        byte[] bytes = exchange.getRequestBody().readNBytes(cap);
        if (bytes.length > limit) {
            throw tooLarge(limit);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static StringAnalyzerException tooLarge(long limit) {
        return new StringAnalyzerException(ErrorKind.PAYLOAD_TOO_LARGE,
            "Request body exceeds " + limit + " bytes");
    }

    /**
     * GET /strings?is_palindrome=true&min_length=5&max_length=20&word_count=2&contains_character=a
     */
    private void handleList(HttpExchange exchange) throws IOException {
        Map<String, String> params = FilterParams.parseQueryParams(exchange.getRequestURI().getRawQuery());
        FilterSet filters = FilterParams.toFilterSet(params);
        List<StringRecord> records = service.list(filters);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("data", toJsonList(records));
        response.put("count", records.size());
        response.put("filters_applied", filters.toJson());

        sendJson(exchange, 200, response);
    }

    /**
     * GET /strings/filter-by-natural-language?query=all%20single%20word%20palindromic%20strings
     */
    private void handleNaturalLanguage(HttpExchange exchange) throws IOException {
        // the context matches by prefix; anything longer is a key under /strings
        if (!exchange.getRequestURI().getPath().equals(NATURAL_LANGUAGE_PATH)) {
            handleStrings(exchange);
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed", Map.of());
            return;
        }

        Map<String, String> params = FilterParams.parseQueryParams(exchange.getRequestURI().getRawQuery());
        String query = params.get("query");
        if (query == null || query.isBlank()) {
            throw new StringAnalyzerException(ErrorKind.INVALID_INPUT, "Missing required parameter: query");
        }

        NaturalLanguageResult result = service.filterByNaturalLanguage(query);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("data", toJsonList(result.records()));
        response.put("count", result.records().size());
        response.put("interpreted_query", result.interpretedQuery().toJson());

        sendJson(exchange, 200, response);
    }

    private List<JSONObject> toJsonList(List<StringRecord> records) {
        List<JSONObject> data = new ArrayList<>(records.size());
        for (StringRecord record : records) {
            data.add(record.toJson());
        }
        return data;
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> data) throws IOException {
        byte[] body = JSON.toJSONString(data, JSONWriter.Feature.WriteMapNullValue).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.sendResponseHeaders(status, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message, Map<String, Object> details)
            throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", "error");
        error.put("code", status);
        error.put("message", message);
        error.putAll(details);

        sendJson(exchange, status, error);
    }

    /**
     * Builder for the API server.
     */
    public static class Builder {
        private StringAnalysisService service;
        private int port = 8080;
        private int threads = 8;

        public Builder withService(StringAnalysisService service) {
            this.service = service;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withThreads(int threads) {
            this.threads = threads;
            return this;
        }

        public StringAnalyzerApiServer build() {
            if (service == null) {
                throw new IllegalStateException("A StringAnalysisService is required");
            }
            return new StringAnalyzerApiServer(service, port, threads);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
