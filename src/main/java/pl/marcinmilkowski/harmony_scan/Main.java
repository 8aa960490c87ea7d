package pl.marcinmilkowski.harmony_scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.chord.ChordTokenizer;
import pl.marcinmilkowski.harmony_scan.chord.SixNineStyle;
import pl.marcinmilkowski.harmony_scan.config.ScanConfigLoader;
import pl.marcinmilkowski.harmony_scan.corpus.ChordChartReader;
import pl.marcinmilkowski.harmony_scan.corpus.CorpusFiles;
import pl.marcinmilkowski.harmony_scan.corpus.CorpusScanner;
import pl.marcinmilkowski.harmony_scan.corpus.HitCsvWriter;
import pl.marcinmilkowski.harmony_scan.corpus.PatternHits;
import pl.marcinmilkowski.harmony_scan.corpus.Piece;
import pl.marcinmilkowski.harmony_scan.corpus.PieceReadException;
import pl.marcinmilkowski.harmony_scan.corpus.PieceScan;
import pl.marcinmilkowski.harmony_scan.corpus.PieceSource;
import pl.marcinmilkowski.harmony_scan.grammar.PatternParser;
import pl.marcinmilkowski.harmony_scan.grammar.PatternSyntaxException;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.indexer.ProgressionIndexer;
import pl.marcinmilkowski.harmony_scan.query.IndexedPieceHits;
import pl.marcinmilkowski.harmony_scan.query.MatchHit;
import pl.marcinmilkowski.harmony_scan.query.ProgressionQueryExecutor;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point: scan a corpus of chord charts for Roman-numeral progressions,
 * dump charts as token sequences, and build or query a progression index.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            showUsage(out);
            return EXIT_USAGE;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "scan":
                    return handleScanCommand(args, out, err);
                case "chart":
                    return handleChartCommand(args, out, err);
                case "index":
                    return handleIndexCommand(args, out, err);
                case "query":
                    return handleQueryCommand(args, out, err);
                case "presets":
                    return handlePresetsCommand(args, out, err);
                case "help":
                    showUsage(out);
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    showUsage(out);
                    return EXIT_USAGE;
            }
        } catch (PatternSyntaxException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            logger.error("Application error", e);
            err.println("Error: " + e.getMessage());
            err.println("Use 'help' command for usage information.");
            return EXIT_ERROR;
        }
    }

    /**
     * Options shared by the corpus commands.
     */
    private static final class Options {
        String path;
        String configPath;
        String output;
        String indexPath;
        final List<String> patterns = new ArrayList<>();
        final List<String> presets = new ArrayList<>();
        boolean verbose;
        boolean showLiterals;
        Integer threads;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--pattern":
                    case "-p":
                        o.patterns.add(value(args, ++i));
                        break;
                    case "--preset":
                        o.presets.add(value(args, ++i));
                        break;
                    case "--verbose":
                    case "-v":
                        o.verbose = true;
                        break;
                    case "--output":
                    case "-o":
                        o.output = value(args, ++i);
                        break;
                    case "--show-literals":
                        o.showLiterals = true;
                        break;
                    case "--threads":
                        o.threads = Integer.parseInt(value(args, ++i));
                        break;
                    case "--config":
                        o.configPath = value(args, ++i);
                        break;
                    case "--index":
                    case "-i":
                        o.indexPath = value(args, ++i);
                        break;
                    default:
                        if (args[i].startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + args[i]);
                        }
                        if (o.path != null) {
                            throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                        }
                        o.path = args[i];
                }
            }
            return o;
        }

        private static String value(String[] args, int i) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i - 1]);
            }
            return args[i];
        }

        ScanConfigLoader loadConfig() throws IOException {
            return configPath != null
                ? new ScanConfigLoader(Paths.get(configPath))
                : ScanConfigLoader.loadDefault();
        }

        /**
         * Compile -p patterns followed by --preset patterns. Fails on the first bad one.
         */
        List<ProgressionPattern> compilePatterns(ScanConfigLoader config) {
            return compilePatterns(config, config.getSixNineStyle());
        }

        List<ProgressionPattern> compilePatterns(ScanConfigLoader config, SixNineStyle style) {
            List<String> sources = new ArrayList<>(patterns);
            for (String id : presets) {
                ScanConfigLoader.PresetConfig preset = config.getPreset(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown preset: " + id));
                sources.add(preset.pattern());
            }
            if (sources.isEmpty()) {
                throw new IllegalArgumentException("At least one --pattern or --preset is required");
            }
            return new PatternParser(style).parseAll(sources);
        }
    }

    private static int handleScanCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        Options options = Options.parse(args);
        if (options.path == null) {
            err.println("Error: corpus path is required");
            err.println("Usage: harmony-scan scan <path> -p <pattern> [-p ...] [-v] [-o out.csv] [--show-literals]");
            return EXIT_USAGE;
        }

        ScanConfigLoader config = options.loadConfig();
        // Patterns are compiled before any file is touched
        List<ProgressionPattern> patterns = options.compilePatterns(config);

        List<Path> files = CorpusFiles.list(Paths.get(options.path), config.getExtensions());
        if (files.isEmpty()) {
            err.println("No chord chart files found.");
            return EXIT_ERROR;
        }

        int threads = options.threads != null ? options.threads : config.getThreads();
        CorpusScanner scanner = new CorpusScanner(new ChordChartReader(),
            new ChordTokenizer(config.getSixNineStyle()), threads);
        List<PieceScan> scans = scanner.scan(files, patterns);

        int failed = 0;
        int totalHits = 0;
        for (PieceScan scan : scans) {
            if (scan.isFailed()) {
                out.println("× " + scan.stem() + ": ERROR (" + scan.error() + ")");
                failed++;
                continue;
            }
            totalHits += scan.totalHits();
            if (options.verbose) {
                for (PatternHits result : scan.results()) {
                    printHits(out, scan.stem(), result.pattern(), result.hits(), options.showLiterals);
                }
            }
        }

        if (options.output != null) {
            int rows = 0;
            try (HitCsvWriter writer = HitCsvWriter.open(Paths.get(options.output), options.showLiterals)) {
                for (PieceScan scan : scans) {
                    rows += writer.write(scan);
                }
            }
            logger.info("Wrote {} rows to {}", rows, options.output);
        }

        logger.info("Scanned {} files ({} failed), {} hits for {} patterns",
            scans.size(), failed, totalHits, patterns.size());
        return EXIT_OK;
    }

    private static void printHits(PrintStream out, String name, ProgressionPattern pattern,
                                  List<MatchHit> hits, boolean showLiterals) {
        out.println("✓ " + name + " [" + pattern.source() + "]: " + hits.size() + " hit(s)");
        for (MatchHit hit : hits) {
            String line = "  → bar " + hit.startBar() + ": " + hit.tokenText();
            if (showLiterals) {
                line += "  |  " + hit.literalText();
            }
            out.println(line);
        }
    }

    private static int handleChartCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        Options options = Options.parse(args);
        if (options.path == null) {
            err.println("Error: chart path is required");
            err.println("Usage: harmony-scan chart <file-or-folder>");
            return EXIT_USAGE;
        }

        ScanConfigLoader config = options.loadConfig();
        Path base = Paths.get(options.path);
        boolean folder = Files.isDirectory(base);
        List<Path> files = CorpusFiles.list(base, config.getExtensions());
        if (files.isEmpty()) {
            err.println("No chord chart files found.");
            return EXIT_ERROR;
        }

        PieceSource source = new ChordChartReader();
        ChordTokenizer tokenizer = new ChordTokenizer(config.getSixNineStyle());
        for (Path file : files) {
            if (folder) {
                out.println();
                out.println("=== " + file.getFileName() + " ===");
            }
            Piece piece;
            try {
                piece = source.read(file);
            } catch (PieceReadException e) {
                logger.warn("Skipping {}: {}", file, e.getMessage());
                out.println("× " + CorpusFiles.stem(file) + ": ERROR (" + e.getMessage() + ")");
                continue;
            }
            out.println("Key: " + piece.key().displayName() + " (written/analyzed)");
            for (ChordToken chord : tokenizer.tokenize(piece.events())) {
                out.println(chord);
            }
        }
        return EXIT_OK;
    }

    private static int handleIndexCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        Options options = Options.parse(args);
        if (options.path == null || options.output == null) {
            err.println("Error: corpus path and --output are required");
            err.println("Usage: harmony-scan index <path> --output <index-dir>");
            return EXIT_USAGE;
        }

        ScanConfigLoader config = options.loadConfig();
        List<Path> files = CorpusFiles.list(Paths.get(options.path), config.getExtensions());
        if (files.isEmpty()) {
            err.println("No chord chart files found.");
            return EXIT_ERROR;
        }

        out.println("Indexing corpus: " + options.path);
        out.println("Output index: " + options.output);
        out.println();

        PieceSource source = new ChordChartReader();
        ChordTokenizer tokenizer = new ChordTokenizer(config.getSixNineStyle());
        int failed = 0;
        try (ProgressionIndexer indexer = new ProgressionIndexer(Paths.get(options.output), config.getSixNineStyle())) {
            for (Path file : files) {
                try {
                    Piece piece = source.read(file);
                    indexer.indexPiece(piece, tokenizer.tokenize(piece.events()));
                } catch (PieceReadException e) {
                    logger.warn("Skipping {}: {}", file, e.getMessage());
                    out.println("× " + CorpusFiles.stem(file) + ": ERROR (" + e.getMessage() + ")");
                    failed++;
                }
            }
            indexer.commit();
            out.println("Indexed " + indexer.getPieceCount() + " pieces, "
                + indexer.getChordCount() + " chords (" + failed + " failed)");
        }
        return EXIT_OK;
    }

    private static int handleQueryCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        Options options = Options.parse(args);
        if (options.indexPath == null) {
            err.println("Error: --index is required");
            err.println("Usage: harmony-scan query --index <index-dir> -p <pattern> [-p ...] [-o out.csv] [--show-literals]");
            return EXIT_USAGE;
        }

        ScanConfigLoader config = options.loadConfig();

        HitCsvWriter writer = null;
        try (ProgressionQueryExecutor executor = new ProgressionQueryExecutor(Paths.get(options.indexPath))) {
            // Exact 6/9 elements must be spelled the way the index was built
            SixNineStyle style = executor.getSixNineStyle();
            if (style != config.getSixNineStyle()) {
                logger.info("Index uses 6/9 style '{}', overriding configured '{}'",
                    style.suffix(), config.getSixNineStyle().suffix());
            }
            List<ProgressionPattern> patterns = options.compilePatterns(config, style);

            if (options.output != null) {
                writer = HitCsvWriter.open(Paths.get(options.output), options.showLiterals);
            }
            logger.info("Querying {} pieces in {}", executor.getPieceCount(), options.indexPath);
            for (ProgressionPattern pattern : patterns) {
                List<IndexedPieceHits> results = executor.search(pattern);
                int total = 0;
                for (IndexedPieceHits piece : results) {
                    printHits(out, piece.title(), pattern, piece.hits(), options.showLiterals);
                    total += piece.hits().size();
                    if (writer != null) {
                        writer.write(piece.title(), piece.path(), piece.key(), pattern, piece.hits());
                    }
                }
                out.println("[" + pattern.source() + "]: " + total + " hit(s) in " + results.size() + " piece(s)");
            }
        } finally {
            if (writer != null) {
                writer.close();
            }
        }
        return EXIT_OK;
    }

    private static int handlePresetsCommand(String[] args, PrintStream out, PrintStream err) throws IOException {
        ScanConfigLoader config = Options.parse(args).loadConfig();
        if (config.getPresets().isEmpty()) {
            out.println("No presets configured.");
            return EXIT_OK;
        }
        for (ScanConfigLoader.PresetConfig preset : config.getPresets()) {
            out.printf("  %-16s %-24s %s%n", preset.id(), preset.pattern(),
                preset.description() != null ? preset.description() : "");
        }
        return EXIT_OK;
    }

    private static void showUsage(PrintStream out) {
        out.println("==========================================");
        out.println("           Harmony Scan v1.0.0            ");
        out.println("==========================================");
        out.println();
        out.println("Usage: java -jar harmony-scan.jar <command> [options]");
        out.println();
        out.println("Available commands:");
        out.println("  scan      - Scan chord charts for Roman-numeral progressions");
        out.println("  chart     - Print a chart as bar-by-bar tokens");
        out.println("  index     - Build a progression index from chord charts");
        out.println("  query     - Query a progression index");
        out.println("  presets   - List configured pattern presets");
        out.println("  help      - Show this help message");
        out.println();
        out.println("Scan command:");
        out.println("  java -jar harmony-scan.jar scan <path> -p <pattern> [-p ...] [--preset <id>]");
        out.println("    [-v] [-o <out.csv>] [--show-literals] [--threads <n>] [--config <file>]");
        out.println();
        out.println("Chart command:");
        out.println("  java -jar harmony-scan.jar chart <file-or-folder>");
        out.println();
        out.println("Index command:");
        out.println("  java -jar harmony-scan.jar index <path> --output <index-dir>");
        out.println();
        out.println("Query command:");
        out.println("  java -jar harmony-scan.jar query --index <index-dir> -p <pattern> [-o <out.csv>] [--show-literals]");
        out.println();
        out.println("Pattern tokens:");
        out.println("  Exact:    IVmaj7  I6  V7  ii-7  iv-6  viiø7  viio7  I69");
        out.println("  Families: I* (major), ii* (minor), V7* (dominant seventh)");
        out.println("  Accidentals: bVII7, #IV*");
        out.println();
        out.println("Examples:");
        out.println("  java -jar harmony-scan.jar scan charts/ -p \"ii-7 V7 I*\" -v");
        out.println("  java -jar harmony-scan.jar scan charts/ --preset backdoor -o hits.csv --show-literals");
    }
}
