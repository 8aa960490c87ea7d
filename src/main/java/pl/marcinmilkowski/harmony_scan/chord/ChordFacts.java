package pl.marcinmilkowski.harmony_scan.chord;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Precomputed views of one chord that the classification rules inspect.
 *
 * @param literal          normalized literal, original case
 * @param lower            lower-cased literal with {@code min}/{@code mi} after the root read as {@code m}
 * @param rawTail          raw quality tail, maj7 aliases unified, inversion figures stripped, lower-cased
 * @param lowerCaseDegree  whether the raw degree head was written in lower case
 */
public record ChordFacts(String literal, String lower, String rawTail, boolean lowerCaseDegree) {

    private static final Pattern MINOR_WORD = Pattern.compile("^([a-g][#b]?)(?:minor|min|mi)(?!n)");
    private static final Pattern RAW_MAJ7_ALIASES = Pattern.compile("\\^7|M7|maj7|Maj7|MAJ7|Δ7|Δ");

    /** Figured-bass inversion digits denote voicing, never quality. */
    public static final Pattern INVERSION_FIGURES = Pattern.compile("65|64|63|62|54|53|43|42|32");

    public static ChordFacts of(String normalizedLiteral, String rawQualityTail, String rawDegreeHead) {
        String literal = normalizedLiteral == null ? "" : normalizedLiteral;
        String lower = MINOR_WORD.matcher(literal.toLowerCase(Locale.ROOT)).replaceFirst("$1m");
        return new ChordFacts(literal, lower, normalizeRawTail(rawQualityTail),
            RomanFigure.parse(rawDegreeHead).degree().chars().anyMatch(Character::isLowerCase));
    }

    /**
     * Unify maj7 aliases, drop spaces and inversion figures, lower-case.
     */
    static String normalizeRawTail(String rawQualityTail) {
        if (rawQualityTail == null || rawQualityTail.isEmpty()) return "";
        String t = rawQualityTail.replace(" ", "");
        t = RAW_MAJ7_ALIASES.matcher(t).replaceAll("maj7");
        t = INVERSION_FIGURES.matcher(t).replaceAll("");
        return t.toLowerCase(Locale.ROOT);
    }
}
