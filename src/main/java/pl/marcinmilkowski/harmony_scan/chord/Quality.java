package pl.marcinmilkowski.harmony_scan.chord;

/**
 * Harmonic quality of a single chord, as decided by the {@link QualityClassifier}.
 *
 * Minor-cased qualities always render their degree in lower case.
 */
public enum Quality {
    MAJOR_PLAIN(false),
    MAJOR_SIX(false),
    MAJOR_MAJ7(false),
    MAJOR_SIX_NINE(false),
    DOMINANT_7(false),
    MINOR_TRIAD(true),
    MINOR_SIX(true),
    MINOR_SEVEN(true),
    MINOR_MAJ7(true),
    DIMINISHED_7(true),
    HALF_DIMINISHED_7(true),
    /** Neither the literal nor the raw quality tail determined a family. */
    UNRESOLVED(false);

    private final boolean minorCase;

    Quality(boolean minorCase) {
        this.minorCase = minorCase;
    }

    public boolean isMinorCase() {
        return minorCase;
    }
}
