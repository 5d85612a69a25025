package pl.marcinmilkowski.initial_combos.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.config.ComboConfigLoader;
import pl.marcinmilkowski.initial_combos.initials.InitialsCodec;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;
import pl.marcinmilkowski.initial_combos.search.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * REST API server for initial-combination queries.
 *
 * Endpoints:
 * - GET  /health - Health check
 * - POST /api/combos/suggest - Combos for {"initials": [...]} (or "target" / "words")
 * - POST /api/combos/from-words - Combos for the first initial of each of {"words": [...]}
 * - GET  /api/lexicon/check?word=결근 - Word membership, score and sources
 * - GET  /api/lexicon/prefix?prefix=결&limit=20 - Best words starting with the given initials
 * - POST /api/lexicon/validate - Check a batch of {"words": [...]}
 * - GET  /api/config - Active configuration
 */
public class ComboApiServer {

    private static final Logger logger = LoggerFactory.getLogger(ComboApiServer.class);

    private final CombinationSearchEngine engine;
    private final LexiconIndex index;
    private final InitialsCodec codec;
    private final ComboConfigLoader config;
    private final int port;
    private HttpServer server;

    public ComboApiServer(CombinationSearchEngine engine, InitialsCodec codec, ComboConfigLoader config, int port) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.index = engine.getIndex();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
        this.port = port;
    }

    /**
     * Start the API server. Port 0 binds an ephemeral port, see {@link #getPort()}.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext("/api/combos/suggest", wrapHandler(this::handleSuggest));
        server.createContext("/api/combos/from-words", wrapHandler(this::handleFromWords));
        server.createContext("/api/lexicon/check", wrapHandler(this::handleCheck));
        server.createContext("/api/lexicon/prefix", wrapHandler(this::handlePrefix));
        server.createContext("/api/lexicon/validate", wrapHandler(this::handleValidate));
        server.createContext("/api/config", wrapHandler(this::handleConfig));
        server.createContext("/", wrapHandler(exchange -> sendError(exchange, 404, "Not found")));

        server.setExecutor(null);
        server.start();
        logger.info("API server started on http://localhost:{}", getPort());
        logger.info("Endpoints:");
        logger.info("  GET  /health                  - Health check");
        logger.info("  POST /api/combos/suggest      - Combos for a list of initials");
        logger.info("  POST /api/combos/from-words   - Combos for the initials of example words");
        logger.info("  GET  /api/lexicon/check       - Check a single word");
        logger.info("  GET  /api/lexicon/prefix      - Words starting with initials");
        logger.info("  POST /api/lexicon/validate    - Check a batch of words");
        logger.info("  GET  /api/config              - Active configuration");
    }

    /**
     * Stop the API server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
    }

    /**
     * The bound port once started, otherwise the configured one.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to catch all exceptions and return JSON error.
     */
    private HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                addCorsHeaders(exchange);
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            try {
                addCorsHeaders(exchange);
                handler.handle(exchange);
            } catch (IllegalArgumentException e) {
                // codec, parameter and target errors are the caller's fault
                logger.debug("Bad request {}: {}", exchange.getRequestURI(), e.getMessage());
                sendErrorSafely(exchange, 400, e.getMessage());
            } catch (JSONException e) {
                sendErrorSafely(exchange, 400, "Malformed JSON body: " + e.getMessage());
            } catch (Exception e) {
                logger.error("Unhandled exception for {}", exchange.getRequestURI(), e);
                sendErrorSafely(exchange, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        };
    }

    private void sendErrorSafely(HttpExchange exchange, int status, String message) {
        try {
            if (exchange.getResponseCode() != -1) {
                logger.warn("Cannot send error response: headers already sent");
                return;
            }
            sendError(exchange, status, message);
        } catch (IOException e) {
            logger.debug("Failed to send error response: {}", e.getMessage());
        } finally {
            exchange.close();
        }
    }

    private void addCorsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type, Authorization");
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return false;
        }
        return true;
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "initial-combos");
        response.put("port", getPort());
        response.put("lexicon_size", index.size());
        response.put("unit_kind", codec.unitKind().name().toLowerCase(Locale.ROOT));
        sendJson(exchange, 200, response);
    }

    private void handleConfig(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("config", config.toJson());
        sendJson(exchange, 200, response);
    }

    /**
     * POST /api/combos/suggest
     * {"initials": ["결","근","신","상"], "beam_width": 64, "max_results": 20, "keep_order": true, "trace": false}
     */
    private void handleSuggest(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        JSONObject body = readJsonBody(exchange);
        runSearch(exchange, body, initialsFrom(body));
    }

    /**
     * POST /api/combos/from-words
     * {"words": ["결합","근육","상피","신경"], "keep_order": false}
     */
    private void handleFromWords(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        JSONObject body = readJsonBody(exchange);
        JSONArray words = body.getJSONArray("words");
        if (words == null) {
            sendError(exchange, 400, "Missing 'words' array");
            return;
        }
        runSearch(exchange, body, codec.initialsFromWords(words.toJavaList(String.class)));
    }

    private void runSearch(HttpExchange exchange, JSONObject body, List<String> initials) throws IOException {
        ComboConfigLoader.ServerConfig limits = config.getServer();
        SearchParameters defaults = config.getSearchDefaults();

        int beamWidth = body.getIntValue("beam_width", defaults.beamWidth());
        if (beamWidth > limits.maxBeamWidth()) {
            throw new InvalidParameterException("beam_width must be <= " + limits.maxBeamWidth());
        }
        int maxResults = body.getIntValue("max_results",
            body.getIntValue("max_candidates", defaults.maxResults()));
        if (maxResults > limits.maxResultsCap()) {
            throw new InvalidParameterException("max_results must be <= " + limits.maxResultsCap());
        }
        boolean trace = Boolean.TRUE.equals(body.getBoolean("trace"));
        Boolean repeats = body.getBoolean("allow_repeated_words");

        SearchParameters params = defaults.toBuilder()
            .beamWidth(beamWidth)
            .maxResults(maxResults)
            .allowRepeatedWords(repeats != null ? repeats : defaults.allowRepeatedWords())
            .trace(trace)
            .build();

        SearchTarget target = new SearchTarget(modeFrom(body), initials);
        CancellationSignal cancellation = limits.timeoutMillis() > 0
            ? CancellationToken.withTimeout(Duration.ofMillis(limits.timeoutMillis()))
            : CancellationSignal.NONE;

        long start = System.nanoTime();
        SearchResult result = engine.search(target, params, cancellation);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        logger.info("Search {} (beam={}, max={}): {} combos in {} ms{}", target, beamWidth, maxResults,
            result.combos().size(), elapsedMs, result.cancelled() ? " [cancelled]" : "");

        JSONObject response = result.toJson(trace);
        response.put("status", "ok");
        response.put("elapsed_ms", elapsedMs);
        sendJson(exchange, 200, response);
    }

    /**
     * GET /api/lexicon/check?word=결근
     */
    private void handleCheck(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String word = params.get("word");
        if (word == null || word.isBlank()) {
            sendError(exchange, 400, "Missing word parameter");
            return;
        }
        JSONObject response = checkWord(word.trim());
        response.put("status", "ok");
        sendJson(exchange, 200, response);
    }

    /**
     * POST /api/lexicon/validate {"words": ["결근", "신상"]}
     */
    private void handleValidate(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        JSONObject body = readJsonBody(exchange);
        JSONArray words = body.getJSONArray("words");
        if (words == null) {
            sendError(exchange, 400, "Missing 'words' array");
            return;
        }
        JSONArray results = new JSONArray();
        boolean allValid = true;
        for (String word : words.toJavaList(String.class)) {
            JSONObject check = checkWord(word == null ? "" : word.trim());
            allValid &= check.getBooleanValue("is_word");
            results.add(check);
        }
        JSONObject response = new JSONObject();
        response.put("status", "ok");
        response.put("all_valid", allValid);
        response.put("results", results);
        sendJson(exchange, 200, response);
    }

    /**
     * GET /api/lexicon/prefix?prefix=결&limit=20
     */
    private void handlePrefix(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String prefix = params.get("prefix");
        if (prefix == null || prefix.isBlank()) {
            sendError(exchange, 400, "Missing prefix parameter");
            return;
        }
        int limit = Integer.parseInt(params.getOrDefault("limit", "50"));

        List<String> units = unitsOf(prefix);
        JSONArray entries = new JSONArray();
        for (LexiconEntry entry : index.lookupPrefix(units, limit)) {
            entries.add(entryJson(entry));
        }
        JSONObject response = new JSONObject();
        response.put("status", "ok");
        response.put("prefix", new JSONArray(units));
        response.put("count", entries.size());
        response.put("entries", entries);
        sendJson(exchange, 200, response);
    }

    private JSONObject checkWord(String word) {
        JSONObject obj = new JSONObject();
        obj.put("word", word);
        Optional<LexiconEntry> entry = index.entryOf(word);
        obj.put("is_word", entry.isPresent());
        boolean hasPrefix;
        try {
            hasPrefix = !word.isEmpty() && index.hasPrefix(codec.initialsOf(word));
        } catch (IllegalArgumentException e) {
            hasPrefix = false;
        }
        obj.put("has_prefix", hasPrefix);
        obj.put("sources", new JSONArray(new ArrayList<>(index.sourcesOf(word))));
        obj.put("score", entry.map(LexiconEntry::score).orElse(0.0));
        return obj;
    }

    private static JSONObject entryJson(LexiconEntry entry) {
        JSONObject obj = new JSONObject();
        obj.put("word", entry.word());
        obj.put("initials", new JSONArray(entry.initials()));
        obj.put("score", entry.score());
        obj.put("source", entry.source());
        return obj;
    }

    /**
     * Target initials from "initials" (alias "letters"), "words" or a "target" string.
     */
    private List<String> initialsFrom(JSONObject body) {
        JSONArray initials = body.getJSONArray("initials");
        if (initials == null) {
            initials = body.getJSONArray("letters");
        }
        if (initials != null) {
            return codec.normalizeUnits(initials.toJavaList(String.class));
        }
        JSONArray words = body.getJSONArray("words");
        if (words != null) {
            return codec.initialsFromWords(words.toJavaList(String.class));
        }
        String target = body.getString("target");
        if (target != null) {
            return unitsOf(target);
        }
        throw new InvalidParameterException("Request needs 'initials', 'words' or 'target'");
    }

    /**
     * "mode" wins, then "bag_mode", then "keep_order" (default: sequence).
     */
    private static SearchMode modeFrom(JSONObject body) {
        String mode = body.getString("mode");
        if (mode != null) {
            return SearchMode.parse(mode);
        }
        Boolean bagMode = body.getBoolean("bag_mode");
        if (bagMode != null) {
            return bagMode ? SearchMode.BAG : SearchMode.SEQUENCE;
        }
        Boolean keepOrder = body.getBoolean("keep_order");
        return SearchMode.fromKeepOrder(keepOrder == null || keepOrder);
    }

    /**
     * Split a free-form string into units, one per character; whitespace and commas separate.
     */
    private List<String> unitsOf(String text) {
        List<String> units = new ArrayList<>();
        text.codePoints()
            .filter(cp -> !Character.isWhitespace(cp) && cp != ',')
            .forEach(cp -> units.add(codec.normalizeUnit(new String(Character.toChars(cp)))));
        return units;
    }

    private JSONObject readJsonBody(HttpExchange exchange) throws IOException {
        String body = readRequestBody(exchange);
        if (body.isBlank()) {
            throw new InvalidParameterException("Empty request body");
        }
        JSONObject obj = JSON.parseObject(body);
        if (obj == null) {
            throw new InvalidParameterException("Request body must be a JSON object");
        }
        return obj;
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                params.put(URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8),
                    URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private String readRequestBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> data) throws IOException {
        String json = JSON.toJSONString(data, com.alibaba.fastjson2.JSONWriter.Feature.WriteMapNullValue);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-store, no-cache, must-revalidate, max-age=0");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("code", status);
        sendJson(exchange, status, error);
    }

    /**
     * Builder for the API server.
     */
    public static class Builder {
        private CombinationSearchEngine engine;
        private InitialsCodec codec;
        private ComboConfigLoader config;
        private Integer port;

        public Builder withEngine(CombinationSearchEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder withCodec(InitialsCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withConfig(ComboConfigLoader config) {
            this.config = config;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public ComboApiServer build() {
            ComboConfigLoader effective = config != null ? config : ComboConfigLoader.createDefault();
            InitialsCodec effectiveCodec = codec != null ? codec : effective.createCodec();
            int effectivePort = port != null ? port : effective.getServer().port();
            return new ComboApiServer(engine, effectiveCodec, effective, effectivePort);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
