package pl.marcinmilkowski.harmony_scan.corpus;

import pl.marcinmilkowski.harmony_scan.chord.ChordToken;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of scanning one corpus file: either the piece with its token sequence and hits
 * per pattern, or the error that made the file unreadable.
 */
public record PieceScan(
    Path path,                      // Corpus file
    Piece piece,                    // null when failed
    List<ChordToken> sequence,      // Tokenized chords in score order
    List<PatternHits> results,      // One entry per pattern, in pattern order
    String error                    // null on success
) {

    public PieceScan {
        sequence = sequence == null ? List.of() : List.copyOf(sequence);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static PieceScan failed(Path path, String error) {
        return new PieceScan(path, null, List.of(), List.of(), error);
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * File name without extension, as used in console reports.
     */
    public String stem() {
        return CorpusFiles.stem(path);
    }

    public int totalHits() {
        int total = 0;
        for (PatternHits r : results) {
            total += r.count();
        }
        return total;
    }
}
