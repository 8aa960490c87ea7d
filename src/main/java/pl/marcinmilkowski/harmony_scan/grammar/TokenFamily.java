package pl.marcinmilkowski.harmony_scan.grammar;

import pl.marcinmilkowski.harmony_scan.chord.Quality;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Chord families selectable with a {@code *} wildcard in a pattern.
 *
 * - {@code I*}, {@code IVmaj7*}: MAJOR (triad, 6, maj7, 6/9)
 * - {@code V7*}: DOMINANT_SEVENTH (any dominant seventh, tensions included)
 * - {@code ii*}, {@code ii-7*}: MINOR (triad, -6, -7, minor-major seventh)
 */
public enum TokenFamily {
    MAJOR("maj", EnumSet.of(Quality.MAJOR_PLAIN, Quality.MAJOR_SIX, Quality.MAJOR_MAJ7, Quality.MAJOR_SIX_NINE)),
    MINOR("min", EnumSet.of(Quality.MINOR_TRIAD, Quality.MINOR_SIX, Quality.MINOR_SEVEN, Quality.MINOR_MAJ7)),
    DOMINANT_SEVENTH("dom", EnumSet.of(Quality.DOMINANT_7));

    private static final Set<String> MAJOR_SUFFIXES = Set.of("", "6", "maj7", "6/9", "69");
    private static final Set<String> MINOR_SUFFIXES = Set.of("", "-6", "-7", "maj7");

    private final String code;
    private final Set<Quality> members;

    TokenFamily(String code, Set<Quality> members) {
        this.code = code;
        this.members = members;
    }

    public boolean accepts(Quality quality) {
        return members.contains(quality);
    }

    /** Short code used in index terms. */
    public String code() {
        return code;
    }

    /**
     * Index term standing for "this family on this degree head", e.g. {@code *maj:IV}.
     */
    public String indexTerm(String degreeHead) {
        return "*" + code + ":" + degreeHead;
    }

    /**
     * The family a wildcard selects from its degree case and suffix; empty when the combination is not allowed.
     */
    public static Optional<TokenFamily> select(boolean upperDegree, String suffix) {
        String s = suffix == null ? "" : suffix;
        if (upperDegree) {
            if (s.equals("7")) return Optional.of(DOMINANT_SEVENTH);
            if (MAJOR_SUFFIXES.contains(s)) return Optional.of(MAJOR);
            return Optional.empty();
        }
        return MINOR_SUFFIXES.contains(s) ? Optional.of(MINOR) : Optional.empty();
    }

    /**
     * The family a quality belongs to, if any.
     */
    public static Optional<TokenFamily> of(Quality quality) {
        for (TokenFamily family : values()) {
            if (family.accepts(quality)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }
}
