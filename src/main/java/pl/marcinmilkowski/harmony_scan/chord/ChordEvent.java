package pl.marcinmilkowski.harmony_scan.chord;

import java.util.Comparator;

/**
 * One chord symbol of a piece, as delivered by the score and harmony services.
 *
 * Ordered by bar, then offset within the bar, then the order it was encountered.
 */
public record ChordEvent(
    int barNumber,           // Bar (measure) number, 0 when unknown
    double offset,           // Offset within the bar
    int sequenceIndex,       // Encounter order, stable tie-break
    String literalText,      // Chord symbol as written, e.g. "E-7"
    String rawDegreeHead,    // Degree of the raw analysis, e.g. "bVII", "vi"
    String rawQualityTail    // Remainder of the raw figure, e.g. "7", "65"
) implements Comparable<ChordEvent> {

    private static final Comparator<ChordEvent> ORDER = Comparator
        .comparingInt(ChordEvent::barNumber)
        .thenComparingDouble(ChordEvent::offset)
        .thenComparingInt(ChordEvent::sequenceIndex);

    public ChordEvent {
        if (barNumber < 0) {
            throw new IllegalArgumentException("Bar number must be >= 0: " + barNumber);
        }
        literalText = literalText == null ? "" : literalText;
        rawDegreeHead = rawDegreeHead == null ? "" : rawDegreeHead;
        rawQualityTail = rawQualityTail == null ? "" : rawQualityTail;
    }

    /**
     * Build an event from a full raw figure such as {@code "V65"}.
     */
    public static ChordEvent ofFigure(int barNumber, double offset, int sequenceIndex,
                                      String literalText, String rawFigure) {
        RomanFigure figure = RomanFigure.parse(rawFigure);
        return new ChordEvent(barNumber, offset, sequenceIndex, literalText,
            figure.degreeHead(), figure.qualityTail());
    }

    @Override
    public int compareTo(ChordEvent other) {
        return ORDER.compare(this, other);
    }
}
