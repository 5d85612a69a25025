package pl.marcinmilkowski.initial_combos;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.api.ComboApiServer;
import pl.marcinmilkowski.initial_combos.config.ComboConfigLoader;
import pl.marcinmilkowski.initial_combos.initials.InitialsCodec;
import pl.marcinmilkowski.initial_combos.lexicon.EntryStore;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconLoader;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconSnapshotWriter;
import pl.marcinmilkowski.initial_combos.search.*;
import pl.marcinmilkowski.initial_combos.tools.ComboTraceTool;
import pl.marcinmilkowski.initial_combos.tools.LexiconReportTool;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point: builds lexicon snapshots, runs searches and starts the API server.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();
            String[] rest = Arrays.copyOfRange(args, 1, args.length);

            switch (command) {
                case "build":
                    handleBuildCommand(rest);
                    break;
                case "search":
                    handleSearchCommand(rest);
                    break;
                case "check":
                    handleCheckCommand(rest);
                    break;
                case "prefix":
                    handlePrefixCommand(rest);
                    break;
                case "trace":
                    ComboTraceTool.main(rest);
                    break;
                case "report":
                    LexiconReportTool.main(rest);
                    break;
                case "server":
                    handleServerCommand(rest);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    /**
     * Options shared by the commands that open a lexicon.
     */
    private static final class CommonOptions {
        String lexicon;
        String config;

        boolean consume(String[] args, int i) {
            switch (args[i]) {
                case "--lexicon":
                case "-l":
                    lexicon = args[i + 1];
                    return true;
                case "--config":
                case "-c":
                    config = args[i + 1];
                    return true;
                default:
                    return false;
            }
        }

        ComboConfigLoader loadConfig() throws IOException {
            return config != null ? new ComboConfigLoader(Paths.get(config)) : ComboConfigLoader.createDefault();
        }

        Path lexiconPath(ComboConfigLoader cfg) {
            if (lexicon != null) {
                return Paths.get(lexicon);
            }
            return cfg.getLexiconPath().orElseThrow(
                () -> new IllegalArgumentException("--lexicon is required (no lexicon in config)"));
        }
    }

    private static void handleBuildCommand(String[] args) throws IOException {
        CommonOptions common = new CommonOptions();
        String output = null;

        for (int i = 0; i < args.length; i++) {
            if (common.consume(args, i)) {
                i++;
                continue;
            }
            switch (args[i]) {
                case "--output":
                case "-o":
                    output = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (output == null) {
            System.err.println("Error: --output is required");
            System.err.println("Usage: java -jar initial-combos.jar build --lexicon <file> --output <file.lexsnap>");
            return;
        }

        ComboConfigLoader config = common.loadConfig();
        Path lexiconPath = common.lexiconPath(config);
        Path outputPath = Paths.get(output);

        System.out.println("Lexicon: " + lexiconPath);
        System.out.println("Snapshot: " + outputPath);
        long start = System.currentTimeMillis();

        LexiconLoader loader = new LexiconLoader(config.createCodec(), config.getSourceWeights());
        EntryStore store = loader.load(lexiconPath, config.getReconciliationPolicy());
        LexiconSnapshotWriter.write(store, config.getUnitKind(), outputPath);

        System.out.printf("Wrote %d entries in %d ms%n", store.size(), System.currentTimeMillis() - start);
    }

    private static void handleSearchCommand(String[] args) throws IOException {
        CommonOptions common = new CommonOptions();
        List<String> initials = null;
        List<String> fromWords = null;
        boolean bagMode = false;
        Integer beam = null;
        Integer max = null;

        for (int i = 0; i < args.length; i++) {
            if (common.consume(args, i)) {
                i++;
                continue;
            }
            switch (args[i]) {
                case "--initials":
                case "-i":
                    initials = splitList(args[++i]);
                    break;
                case "--from-words":
                case "-w":
                    fromWords = splitList(args[++i]);
                    break;
                case "--bag-mode":
                    bagMode = true;
                    break;
                case "--beam":
                    beam = Integer.parseInt(args[++i]);
                    break;
                case "--max":
                    max = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (initials == null && fromWords == null) {
            System.err.println("Error: --initials or --from-words is required");
            System.err.println("Usage: java -jar initial-combos.jar search --lexicon <file> --initials 결,근,신,상 [--bag-mode] [--beam 64] [--max 20]");
            return;
        }

        ComboConfigLoader config = common.loadConfig();
        InitialsCodec codec = config.createCodec();
        LexiconIndex index = new LexiconLoader(codec, config.getSourceWeights())
            .loadIndex(common.lexiconPath(config), config.getReconciliationPolicy());
        CombinationSearchEngine engine = new CombinationSearchEngine(index, config.getScoringPolicy());

        List<String> target = fromWords != null ? codec.initialsFromWords(fromWords) : codec.normalizeUnits(initials);
        SearchParameters defaults = config.getSearchDefaults();
        SearchParameters params = defaults.toBuilder()
            .beamWidth(beam != null ? beam : defaults.beamWidth())
            .maxResults(max != null ? max : defaults.maxResults())
            .build();

        SearchResult result = engine.search(new SearchTarget(bagMode ? SearchMode.BAG : SearchMode.SEQUENCE, target), params);
        ComboTraceTool.render(result, 0).forEach(System.out::println);
    }

    private static void handleCheckCommand(String[] args) throws IOException {
        CommonOptions common = new CommonOptions();
        List<String> words = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            if (common.consume(args, i)) {
                i++;
                continue;
            }
            if ("--word".equals(args[i]) || "-w".equals(args[i])) {
                words.add(args[++i]);
            } else {
                System.err.println("Unknown option: " + args[i]);
            }
        }

        if (words.isEmpty()) {
            System.err.println("Error: --word is required");
            System.err.println("Usage: java -jar initial-combos.jar check --lexicon <file> --word <word> [--word <word> ...]");
            return;
        }

        ComboConfigLoader config = common.loadConfig();
        LexiconIndex index = new LexiconLoader(config.createCodec(), config.getSourceWeights())
            .loadIndex(common.lexiconPath(config), config.getReconciliationPolicy());
        for (String word : words) {
            System.out.printf("  %s: %s%n", word, index.entryOf(word)
                .map(e -> String.format("score=%.2f sources=%s", e.score(), index.sourcesOf(word)))
                .orElse("not in lexicon"));
        }
    }

    private static void handlePrefixCommand(String[] args) throws IOException {
        CommonOptions common = new CommonOptions();
        List<String> prefix = null;
        int limit = 20;

        for (int i = 0; i < args.length; i++) {
            if (common.consume(args, i)) {
                i++;
                continue;
            }
            switch (args[i]) {
                case "--prefix":
                case "-p":
                    prefix = splitList(args[++i]);
                    break;
                case "--limit":
                    limit = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (prefix == null) {
            System.err.println("Error: --prefix is required");
            System.err.println("Usage: java -jar initial-combos.jar prefix --lexicon <file> --prefix 결,근 [--limit 20]");
            return;
        }

        ComboConfigLoader config = common.loadConfig();
        InitialsCodec codec = config.createCodec();
        LexiconIndex index = new LexiconLoader(codec, config.getSourceWeights())
            .loadIndex(common.lexiconPath(config), config.getReconciliationPolicy());
        for (LexiconEntry entry : index.lookupPrefix(codec.normalizeUnits(prefix), limit)) {
            System.out.printf("  %s %s score=%.2f (%s)%n", entry.word(), entry.initials(), entry.score(), entry.source());
        }
    }

    private static void handleServerCommand(String[] args) throws IOException {
        CommonOptions common = new CommonOptions();
        Integer port = null;

        for (int i = 0; i < args.length; i++) {
            if (common.consume(args, i)) {
                i++;
                continue;
            }
            switch (args[i]) {
                case "--port":
                case "-p":
                    port = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        ComboConfigLoader config = common.loadConfig();
        InitialsCodec codec = config.createCodec();
        LexiconIndex index = new LexiconLoader(codec, config.getSourceWeights())
            .loadIndex(common.lexiconPath(config), config.getReconciliationPolicy());

        ComboApiServer.Builder builder = ComboApiServer.builder()
            .withEngine(new CombinationSearchEngine(index, config.getScoringPolicy()))
            .withCodec(codec)
            .withConfig(config);
        if (port != null) {
            builder.withPort(port);
        }
        ComboApiServer server = builder.build();
        server.start();

        System.out.println("Press Ctrl+C to stop the server.");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\nShutting down...");
            server.stop();
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar initial-combos.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  build   --lexicon <file> --output <file.lexsnap>     Build a lexicon snapshot");
        System.out.println("  search  --lexicon <file> --initials 결,근,신,상       Find word combinations");
        System.out.println("          [--from-words 결합,근육] [--bag-mode] [--beam 64] [--max 20]");
        System.out.println("  trace   --lexicon <file> --initials ... [--trace-limit 200]  Search with trace output");
        System.out.println("  check   --lexicon <file> --word <word>                Check dictionary membership");
        System.out.println("  prefix  --lexicon <file> --prefix 결,근 [--limit 20]  Best words for initials");
        System.out.println("  report  --lexicon <file> [--probe 결근,신상]          Lexicon statistics");
        System.out.println("  server  --lexicon <file> [--port 8080]               Start the REST API");
        System.out.println("  help                                                 Show this message");
        System.out.println();
        System.out.println("All commands accept --config <file.json>; without --lexicon the config's lexicon is used.");
    }
}
