package pl.marcinmilkowski.harmony_scan.query;

import java.util.List;

/**
 * Hits of a pattern in one indexed piece.
 */
public record IndexedPieceHits(
    String title,
    String path,
    String key,           // Display form, e.g. "Eb major"
    int ordinal,          // Corpus order at index time
    List<MatchHit> hits
) {

    public IndexedPieceHits {
        hits = List.copyOf(hits);
    }
}
