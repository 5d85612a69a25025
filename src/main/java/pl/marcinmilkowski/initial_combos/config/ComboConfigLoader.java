package pl.marcinmilkowski.initial_combos.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.initials.HangulInitialsCodec;
import pl.marcinmilkowski.initial_combos.initials.InitialsCodec;
import pl.marcinmilkowski.initial_combos.initials.UnitKind;
import pl.marcinmilkowski.initial_combos.lexicon.ReconciliationPolicy;
import pl.marcinmilkowski.initial_combos.search.DefaultScoringPolicy;
import pl.marcinmilkowski.initial_combos.search.EmptyTargetPolicy;
import pl.marcinmilkowski.initial_combos.search.SearchParameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads and provides access to the application configuration from JSON.
 *
 * Expected JSON structure (every section except "version" is optional):
 * {
 *   "version": "1.0",
 *   "unit_kind": "syllable",
 *   "reconciliation": "max_score",
 *   "lexicon": "artifacts/lexicon.jsonl.gz",
 *   "source_weights": {"우리말샘": 1.0, "표준국어대사전": 2.0, "한국어기초사전": 3.0},
 *   "scoring": {"length_bonus": 0.3, "segment_penalty": 0.2},
 *   "search": {
 *     "beam_width": 64, "max_results": 20, "candidate_limit": 0,
 *     "allow_repeated_words": true, "empty_target": "trivial"
 *   },
 *   "server": {"port": 8080, "max_beam_width": 4096, "max_results_cap": 100, "timeout_ms": 5000}
 * }
 */
public class ComboConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ComboConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/initial-combos.json";

    private final String version;
    private final String origin;
    private final UnitKind unitKind;
    private final ReconciliationPolicy reconciliationPolicy;
    private final String lexiconPath;
    private final Map<String, Double> sourceWeights;
    private final DefaultScoringPolicy scoringPolicy;
    private final SearchParameters searchDefaults;
    private final ServerConfig server;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON config file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public ComboConfigLoader(Path configPath) throws IOException {
        this(readFile(configPath), configPath.toString());
    }

    private ComboConfigLoader(String content, String origin) {
        this.origin = origin;

        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed config JSON in " + origin + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty config: " + origin);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in config " + origin);
        }
        this.version = parsedVersion;

        this.unitKind = UnitKind.parse(root.getString("unit_kind"));
        this.reconciliationPolicy = ReconciliationPolicy.parse(root.getString("reconciliation"));
        this.lexiconPath = root.getString("lexicon");

        // Source weights, in declaration order
        Map<String, Double> weights = new LinkedHashMap<>();
        JSONObject weightsObj = root.getJSONObject("source_weights");
        if (weightsObj != null) {
            for (String source : weightsObj.keySet()) {
                Double weight = weightsObj.getDouble(source);
                if (weight == null || weight < 0) {
                    throw new IllegalArgumentException("Invalid weight for source '" + source + "': " + weight);
                }
                weights.put(source, weight);
            }
        }
        this.sourceWeights = Collections.unmodifiableMap(weights);

        JSONObject scoring = section(root, "scoring");
        this.scoringPolicy = new DefaultScoringPolicy(
            doubleOr(scoring, "length_bonus", DefaultScoringPolicy.DEFAULT.lengthBonus()),
            doubleOr(scoring, "segment_penalty", DefaultScoringPolicy.DEFAULT.segmentPenalty()));

        JSONObject search = section(root, "search");
        this.searchDefaults = SearchParameters.builder()
            .beamWidth(search.getIntValue("beam_width", SearchParameters.DEFAULT_BEAM_WIDTH))
            .maxResults(search.getIntValue("max_results", SearchParameters.DEFAULT_MAX_RESULTS))
            .candidateLimit(search.getIntValue("candidate_limit", 0))
            .allowRepeatedWords(booleanOr(search, "allow_repeated_words", true))
            .emptyTargetPolicy(EmptyTargetPolicy.parse(search.getString("empty_target")))
            .build();

        JSONObject serverObj = section(root, "server");
        this.server = new ServerConfig(
            serverObj.getIntValue("port", 8080),
            serverObj.getIntValue("max_beam_width", 4096),
            serverObj.getIntValue("max_results_cap", 100),
            longOr(serverObj, "timeout_ms", 5000L));
        if (server.maxBeamWidth() <= 0 || server.maxResultsCap() <= 0 || server.timeoutMillis() < 0) {
            throw new IllegalArgumentException("Invalid server limits in config " + origin + ": " + server);
        }

        logger.info("Loaded config version {}: unit kind {}, {} source weights from {}",
            version, unitKind, sourceWeights.size(), origin);
    }

    /**
     * Load the configuration bundled on the classpath ({@value #DEFAULT_RESOURCE}).
     */
    public static ComboConfigLoader createDefault() {
        try (InputStream in = ComboConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default config resource missing: " + DEFAULT_RESOURCE);
            }
            return new ComboConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default config: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parse configuration from a JSON string.
     */
    public static ComboConfigLoader fromJson(String json) {
        return new ComboConfigLoader(json, "<inline>");
    }

    private static String readFile(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Config file not found: " + configPath);
        }
        return Files.readString(configPath);
    }

    private static JSONObject section(JSONObject root, String name) {
        JSONObject obj = root.getJSONObject(name);
        return obj != null ? obj : new JSONObject();
    }

    private static double doubleOr(JSONObject obj, String key, double fallback) {
        Double value = obj.getDouble(key);
        return value != null ? value : fallback;
    }

    private static boolean booleanOr(JSONObject obj, String key, boolean fallback) {
        Boolean value = obj.getBoolean(key);
        return value != null ? value : fallback;
    }

    private static long longOr(JSONObject obj, String key, long fallback) {
        Long value = obj.getLong(key);
        return value != null ? value : fallback;
    }

    public String getVersion() {
        return version;
    }

    public String getOrigin() {
        return origin;
    }

    public UnitKind getUnitKind() {
        return unitKind;
    }

    /**
     * Codec matching the configured unit kind.
     */
    public InitialsCodec createCodec() {
        return new HangulInitialsCodec(unitKind);
    }

    public ReconciliationPolicy getReconciliationPolicy() {
        return reconciliationPolicy;
    }

    /**
     * Default lexicon location, or empty if the config does not name one.
     */
    public Optional<Path> getLexiconPath() {
        return lexiconPath == null || lexiconPath.isBlank() ? Optional.empty() : Optional.of(Path.of(lexiconPath));
    }

    public Map<String, Double> getSourceWeights() {
        return sourceWeights;
    }

    public DefaultScoringPolicy getScoringPolicy() {
        return scoringPolicy;
    }

    public SearchParameters getSearchDefaults() {
        return searchDefaults;
    }

    public ServerConfig getServer() {
        return server;
    }

    /**
     * Export the loaded config as a JSONObject for API responses.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        root.put("origin", origin);
        root.put("unit_kind", unitKind.name().toLowerCase(Locale.ROOT));
        root.put("reconciliation", reconciliationPolicy.name().toLowerCase(Locale.ROOT));
        if (lexiconPath != null) {
            root.put("lexicon", lexiconPath);
        }
        root.put("source_weights", new JSONObject(new LinkedHashMap<>(sourceWeights)));

        JSONObject scoring = new JSONObject();
        scoring.put("length_bonus", scoringPolicy.lengthBonus());
        scoring.put("segment_penalty", scoringPolicy.segmentPenalty());
        root.put("scoring", scoring);

        JSONObject search = new JSONObject();
        search.put("beam_width", searchDefaults.beamWidth());
        search.put("max_results", searchDefaults.maxResults());
        search.put("candidate_limit", searchDefaults.candidateLimit());
        search.put("allow_repeated_words", searchDefaults.allowRepeatedWords());
        search.put("empty_target", searchDefaults.emptyTargetPolicy().name().toLowerCase(Locale.ROOT));
        root.put("search", search);

        root.put("server", server.toJson());
        return root;
    }

    /**
     * HTTP server limits.
     */
    public record ServerConfig(int port, int maxBeamWidth, int maxResultsCap, long timeoutMillis) {
        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("port", port);
            obj.put("max_beam_width", maxBeamWidth);
            obj.put("max_results_cap", maxResultsCap);
            obj.put("timeout_ms", timeoutMillis);
            return obj;
        }
    }
}
