package pl.marcinmilkowski.harmony_scan.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.chord.ChordTokenizer;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.query.SequenceScanner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs compiled patterns over a list of corpus files.
 *
 * Each file is read, tokenized and scanned independently on a fixed thread pool;
 * results come back in file order regardless of the pool size. A file that cannot
 * be read yields a failed {@link PieceScan} and the run continues.
 */
public class CorpusScanner {

    private static final Logger logger = LoggerFactory.getLogger(CorpusScanner.class);

    private final PieceSource source;
    private final ChordTokenizer tokenizer;
    private final SequenceScanner scanner;
    private final int threads;

    public CorpusScanner(PieceSource source, ChordTokenizer tokenizer, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.source = source;
        this.tokenizer = tokenizer;
        this.scanner = new SequenceScanner();
        this.threads = threads;
    }

    public List<PieceScan> scan(List<Path> files, List<ProgressionPattern> patterns) {
        if (threads == 1 || files.size() <= 1) {
            List<PieceScan> out = new ArrayList<>(files.size());
            for (Path file : files) {
                out.add(scanFile(file, patterns));
            }
            return out;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Future<PieceScan>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> scanFile(file, patterns)));
            }
            List<PieceScan> out = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                out.add(await(futures.get(i), files.get(i)));
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Read, tokenize and scan a single file.
     */
    public PieceScan scanFile(Path file, List<ProgressionPattern> patterns) {
        Piece piece;
        try {
            piece = source.read(file);
        } catch (PieceReadException e) {
            logger.warn("Skipping {}: {}", file, e.getMessage());
            return PieceScan.failed(file, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Skipping {}: unexpected {}", file, e.toString(), e);
            return PieceScan.failed(file, e.toString());
        }

        List<ChordToken> sequence = tokenizer.tokenize(piece.events());
        List<PatternHits> results = new ArrayList<>(patterns.size());
        for (ProgressionPattern pattern : patterns) {
            results.add(new PatternHits(pattern, scanner.scan(sequence, pattern)));
        }
        logger.debug("{}: {} chords, {} patterns", file, sequence.size(), patterns.size());
        return new PieceScan(file, piece, sequence, results, null);
    }

    private static PieceScan await(Future<PieceScan> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scanning " + file, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Scan failed for " + file, cause);
        }
    }
}
