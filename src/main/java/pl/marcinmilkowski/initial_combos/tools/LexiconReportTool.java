package pl.marcinmilkowski.initial_combos.tools;

import com.alibaba.fastjson2.JSON;
import pl.marcinmilkowski.initial_combos.config.ComboConfigLoader;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summarizes a lexicon file or snapshot: entry count, initials-length
 * histogram, per-source coverage and membership of probe words.
 */
public class LexiconReportTool {

    public static void main(String[] args) throws Exception {
        Map<String, String> params = parseArgs(args);

        ComboConfigLoader config = params.containsKey("config")
            ? new ComboConfigLoader(Paths.get(params.get("config")))
            : ComboConfigLoader.createDefault();

        String lexiconArg = params.get("lexicon");
        Path lexiconPath = lexiconArg != null ? Paths.get(lexiconArg) : config.getLexiconPath().orElse(null);
        if (lexiconPath == null) {
            System.err.println("Usage: LexiconReportTool --lexicon <file> [--config <json>] [--probe 결근,신상] [--output <path>]");
            System.exit(1);
            return;
        }

        LexiconLoader loader = new LexiconLoader(config.createCodec(), config.getSourceWeights());
        LexiconIndex index = loader.loadIndex(lexiconPath, config.getReconciliationPolicy());

        List<String> probes = new ArrayList<>();
        String probeArg = params.get("probe");
        if (probeArg != null) {
            for (String p : probeArg.split(",")) {
                if (!p.isBlank()) {
                    probes.add(p.trim());
                }
            }
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp_utc", Instant.now().toString());
        out.put("lexicon_path", lexiconPath.toAbsolutePath().toString());
        out.putAll(report(index, probes));

        String pretty = JSON.toJSONString(out, com.alibaba.fastjson2.JSONWriter.Feature.PrettyFormat);
        Path outputPath = params.containsKey("output") ? Paths.get(params.get("output")) : null;
        if (outputPath != null) {
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            Files.writeString(outputPath, pretty);
            System.out.println("Report written: " + outputPath.toAbsolutePath());
        } else {
            System.out.println(pretty);
        }
    }

    /**
     * Build the report body for an index.
     */
    public static Map<String, Object> report(LexiconIndex index, List<String> probes) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("entry_count", index.size());
        out.put("trie_nodes", index.nodeCount());

        Map<Integer, Integer> lengths = new TreeMap<>();
        Map<String, Integer> bySource = new TreeMap<>();
        for (LexiconEntry entry : index.entries()) {
            lengths.merge(entry.length(), 1, Integer::sum);
            for (String source : index.sourcesOf(entry.word())) {
                bySource.merge(source, 1, Integer::sum);
            }
        }
        Map<String, Integer> histogram = new LinkedHashMap<>();
        lengths.forEach((length, count) -> histogram.put(String.valueOf(length), count));
        out.put("initials_length_histogram", histogram);
        out.put("source_coverage", bySource);

        Map<String, Object> probeResults = new LinkedHashMap<>();
        for (String probe : probes) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("is_word", index.contains(probe));
            result.put("sources", new ArrayList<>(index.sourcesOf(probe)));
            index.entryOf(probe).ifPresent(e -> result.put("score", e.score()));
            probeResults.put(probe, result);
        }
        out.put("probes", probeResults);
        return out;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            String key = arg.substring(2).toLowerCase(Locale.ROOT);
            String value = "true";
            if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                value = args[++i];
            }
            out.put(key, value);
        }
        return out;
    }
}
