package pl.marcinmilkowski.initial_combos.lexicon;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.initials.InitialsCodec;
import pl.marcinmilkowski.initial_combos.initials.UnsupportedCharacterException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.*;
import java.util.zip.GZIPInputStream;

/**
 * Loads lexicon files produced by the dictionary ETL.
 *
 * Supported formats (optionally gzip-compressed, detected by a trailing .gz):
 * <ul>
 *   <li>JSON Lines (.jsonl / .json): {@code {"w": "결근", "sources": ["표준국어대사전"], "score": 2.0}};
 *       {@code "word"}/{@code "source"} are accepted as aliases and an explicit
 *       {@code "initials"} array overrides the codec</li>
 *   <li>TSV (anything else): {@code word<TAB>score[<TAB>source]}, lines starting with # are comments</li>
 * </ul>
 *
 * A record yields one entry per source. When a record carries no score, the
 * configured weight of its source is used. Words the codec cannot decompose are
 * skipped with a warning; structurally malformed lines fail the whole load.
 */
public class LexiconLoader {

    private static final Logger logger = LoggerFactory.getLogger(LexiconLoader.class);

    public static final String DEFAULT_SOURCE = "unknown";

    private final InitialsCodec codec;
    private final Map<String, Double> sourceWeights;

    public LexiconLoader(InitialsCodec codec) {
        this(codec, Map.of());
    }

    public LexiconLoader(InitialsCodec codec, Map<String, Double> sourceWeights) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sourceWeights = Map.copyOf(sourceWeights);
    }

    /**
     * Read raw (unreconciled) entries from a lexicon file.
     *
     * @throws FileNotFoundException if the file does not exist
     * @throws IOException on read errors or malformed lines
     */
    public List<LexiconEntry> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Lexicon file not found: " + path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean gzip = name.endsWith(".gz");
        if (gzip) {
            name = name.substring(0, name.length() - 3);
        }
        boolean json = name.endsWith(".jsonl") || name.endsWith(".json");

        try (InputStream raw = Files.newInputStream(path);
             BufferedReader reader = new BufferedReader(new InputStreamReader(
                gzip ? new GZIPInputStream(raw) : raw, StandardCharsets.UTF_8))) {
            LoadStats stats = new LoadStats();
            List<LexiconEntry> entries = json ? readJsonLines(reader, path, stats) : readTsv(reader, path, stats);
            logger.info("Read {} entries from {} ({} lines, {} skipped)",
                entries.size(), path, stats.lines, stats.skipped);
            return entries;
        }
    }

    /**
     * Read and reconcile a lexicon file.
     */
    public EntryStore load(Path path, ReconciliationPolicy policy) throws IOException {
        return EntryStore.of(read(path), policy);
    }

    /**
     * Open an index from either a snapshot file ({@value LexiconSnapshotWriter#EXTENSION})
     * or a lexicon file.
     */
    public LexiconIndex loadIndex(Path path, ReconciliationPolicy policy) throws IOException {
        if (isSnapshot(path)) {
            LexiconSnapshotReader.Snapshot snapshot = LexiconSnapshotReader.read(path);
            if (snapshot.unitKind() != codec.unitKind()) {
                throw new IOException("Snapshot " + path + " was built with unit kind "
                    + snapshot.unitKind() + " but " + codec.unitKind() + " is configured");
            }
            return snapshot.toIndex();
        }
        return LexiconIndex.build(load(path, policy));
    }

    public LexiconIndex loadIndex(Path path) throws IOException {
        return loadIndex(path, ReconciliationPolicy.MAX_SCORE);
    }

    public static boolean isSnapshot(Path path) {
        return path.getFileName().toString().endsWith(LexiconSnapshotWriter.EXTENSION);
    }

    public InitialsCodec getCodec() {
        return codec;
    }

    private List<LexiconEntry> readJsonLines(BufferedReader reader, Path path, LoadStats stats) throws IOException {
        List<LexiconEntry> entries = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            stats.lines++;
            if (line.isBlank()) {
                continue;
            }
            JSONObject record;
            try {
                record = JSON.parseObject(line);
            } catch (JSONException e) {
                throw new IOException("Malformed JSON at " + path + ":" + stats.lines + ": " + e.getMessage(), e);
            }
            if (record == null) {
                throw new IOException("Expected a JSON object at " + path + ":" + stats.lines);
            }

            String word;
            List<String> sources = new ArrayList<>();
            Double score;
            List<String> initials = null;
            try {
                word = record.getString("w");
                if (word == null) {
                    word = record.getString("word");
                }
                if (word == null || word.isBlank()) {
                    throw new IOException("Missing word ('w') at " + path + ":" + stats.lines);
                }

                JSONArray sourcesArray = record.getJSONArray("sources");
                if (sourcesArray != null) {
                    for (int i = 0; i < sourcesArray.size(); i++) {
                        String source = sourcesArray.getString(i);
                        if (source != null && !source.isBlank()) {
                            sources.add(source);
                        }
                    }
                } else if (record.getString("source") != null) {
                    sources.add(record.getString("source"));
                }
                if (sources.isEmpty()) {
                    sources.add(DEFAULT_SOURCE);
                }

                score = record.getDouble("score");

                JSONArray initialsArray = record.getJSONArray("initials");
                if (initialsArray != null) {
                    initials = initialsArray.toJavaList(String.class);
                }
            } catch (JSONException | IllegalArgumentException e) {
                throw new IOException("Invalid field value at " + path + ":" + stats.lines + ": " + e.getMessage(), e);
            }

            addEntries(entries, word, initials, score, sources, path, stats);
        }
        return entries;
    }

    private List<LexiconEntry> readTsv(BufferedReader reader, Path path, LoadStats stats) throws IOException {
        List<LexiconEntry> entries = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            stats.lines++;
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\t");
            if (parts.length < 2) {
                throw new IOException("Expected word<TAB>score[<TAB>source] at " + path + ":" + stats.lines);
            }
            double score;
            try {
                score = Double.parseDouble(parts[1].trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid score '" + parts[1] + "' at " + path + ":" + stats.lines, e);
            }
            String source = parts.length > 2 && !parts[2].isBlank() ? parts[2].trim() : DEFAULT_SOURCE;
            addEntries(entries, parts[0], null, score, List.of(source), path, stats);
        }
        return entries;
    }

    private void addEntries(List<LexiconEntry> out, String rawWord, List<String> initials, Double score,
                            List<String> sources, Path path, LoadStats stats) throws IOException {
        String word = Normalizer.normalize(rawWord.trim(), Normalizer.Form.NFC);
        List<String> units;
        try {
            units = initials != null ? codec.normalizeUnits(initials) : codec.initialsOf(word);
        } catch (UnsupportedCharacterException e) {
            stats.skipped++;
            logger.warn("Skipping '{}' at {}:{}: {}", word, path, stats.lines, e.getMessage());
            return;
        }
        for (String source : sources) {
            double entryScore = score != null ? score : sourceWeights.getOrDefault(source, 0.0);
            try {
                out.add(new LexiconEntry(word, units, entryScore, source));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid entry at " + path + ":" + stats.lines + ": " + e.getMessage(), e);
            }
        }
    }

    private static final class LoadStats {
        int lines;
        int skipped;
    }
}
