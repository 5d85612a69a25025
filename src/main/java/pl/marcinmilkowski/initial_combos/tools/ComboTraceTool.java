package pl.marcinmilkowski.initial_combos.tools;

import com.alibaba.fastjson2.JSON;
import pl.marcinmilkowski.initial_combos.config.ComboConfigLoader;
import pl.marcinmilkowski.initial_combos.initials.InitialsCodec;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconLoader;
import pl.marcinmilkowski.initial_combos.search.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs one traced search and prints the ranked combos followed by the trace.
 *
 * <pre>
 * ComboTraceTool --lexicon lexicon.jsonl.gz --initials 결,근,신,상 --bag-mode --beam 128 --trace-limit 50
 * ComboTraceTool --lexicon lexicon.lexsnap --from-words 결합,근육,신경,상피
 * </pre>
 */
public class ComboTraceTool {

    public static void main(String[] args) throws Exception {
        Map<String, String> params = LexiconReportTool.parseArgs(args);

        ComboConfigLoader config = params.containsKey("config")
            ? new ComboConfigLoader(Paths.get(params.get("config")))
            : ComboConfigLoader.createDefault();
        String lexiconArg = params.get("lexicon");
        Path lexiconPath = lexiconArg != null ? Paths.get(lexiconArg) : config.getLexiconPath().orElse(null);
        if (lexiconPath == null || (!params.containsKey("initials") && !params.containsKey("from-words"))) {
            System.err.println("Usage: ComboTraceTool --lexicon <file> (--initials 결,근 | --from-words 결합,근육)"
                + " [--bag-mode] [--beam 64] [--max 20] [--trace-limit 200] [--json] [--config <json>]");
            System.exit(1);
            return;
        }

        InitialsCodec codec = config.createCodec();
        LexiconIndex index = new LexiconLoader(codec, config.getSourceWeights())
            .loadIndex(lexiconPath, config.getReconciliationPolicy());
        CombinationSearchEngine engine = new CombinationSearchEngine(index, config.getScoringPolicy());

        List<String> initials = params.containsKey("from-words")
            ? codec.initialsFromWords(splitList(params.get("from-words")))
            : codec.normalizeUnits(splitList(params.get("initials")));
        SearchMode mode = params.containsKey("bag-mode") ? SearchMode.BAG : SearchMode.SEQUENCE;

        SearchParameters defaults = config.getSearchDefaults();
        SearchParameters searchParams = defaults.toBuilder()
            .beamWidth(Integer.parseInt(params.getOrDefault("beam", String.valueOf(defaults.beamWidth()))))
            .maxResults(Integer.parseInt(params.getOrDefault("max", String.valueOf(defaults.maxResults()))))
            .trace(true)
            .build();
        int traceLimit = Integer.parseInt(params.getOrDefault("trace-limit", "200"));

        SearchResult result = engine.search(new SearchTarget(mode, initials), searchParams);
        if (params.containsKey("json")) {
            System.out.println(JSON.toJSONString(result.toJson(true),
                com.alibaba.fastjson2.JSONWriter.Feature.PrettyFormat));
        } else {
            render(result, traceLimit).forEach(System.out::println);
        }
    }

    /**
     * Human-readable report lines; at most {@code traceLimit} trace events (0 hides the trace).
     */
    public static List<String> render(SearchResult result, int traceLimit) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("Target: %s (%s)", result.target().units(), result.target().mode().wireName()));
        lines.add(String.format("Levels: %d, expanded states: %d, peak frontier: %d%s",
            result.levels(), result.expandedStates(), result.peakFrontier(),
            result.cancelled() ? " [cancelled]" : ""));
        lines.add("");
        lines.add("Combos:");
        if (result.combos().isEmpty()) {
            lines.add("  (none)");
        }
        int rank = 1;
        for (Combo combo : result.combos()) {
            lines.add(String.format("  %2d. %s", rank++, combo));
        }

        if (traceLimit > 0) {
            lines.add("");
            lines.add("Trace:");
            List<TraceEvent> trace = result.trace();
            for (int i = 0; i < Math.min(traceLimit, trace.size()); i++) {
                TraceEvent e = trace.get(i);
                lines.add(String.format("  [L%d] %-9s words=%s remaining=%s score=%.3f count=%d",
                    e.level(), e.type().wireName(), e.words(), e.remaining(), e.score(), e.count()));
            }
            if (trace.size() > traceLimit) {
                lines.add(String.format("  ... %d more events", trace.size() - traceLimit));
            }
        }
        return lines;
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        for (String part : Arrays.asList(value.split(","))) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }
}
