package pl.marcinmilkowski.harmony_scan.chord;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans a raw chord-symbol string into its canonical literal form.
 *
 * Steps, in order:
 * - trim
 * - root accidentals: `E-` becomes `Eb`, `F+` becomes `F#` (only right after a pitch letter)
 * - suspension phrasing: `add4 subtract3`, `add4 no3`, `add11 no3`, `sus 4` fold to `sus4`
 * - whitespace runs collapse to a single space
 */
public final class LiteralNormalizer {

    // Pitch letter not inside a word, followed by end, slash, space, paren or digit
    private static final Pattern ROOT_MINUS = Pattern.compile(
        "(?<![A-Za-z])([A-Ga-g])-(?=$|[/\\s(0-9])"
    );
    private static final Pattern ROOT_PLUS = Pattern.compile(
        "(?<![A-Za-z])([A-Ga-g])\\+(?=$|[/\\s(0-9])"
    );

    private static final List<Pattern> SUS4_VARIANTS = List.of(
        Pattern.compile("add\\s*4\\s*(?:subtract|minus|no|omit)\\s*3\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("add\\s*11\\s*(?:no|omit)\\s*3\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("sus\\s+4\\b", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern REPEATED_SUS4 = Pattern.compile(
        "sus4(?:\\s+sus4\\b)+", Pattern.CASE_INSENSITIVE
    );
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s{2,}");

    private LiteralNormalizer() {
    }

    /**
     * Normalize a chord-symbol literal. Null or empty input yields an empty string.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String s = raw.trim();
        s = ROOT_MINUS.matcher(s).replaceAll("$1b");
        s = ROOT_PLUS.matcher(s).replaceAll("$1#");
        s = normalizeSuspensions(s);
        s = WHITESPACE_RUN.matcher(s).replaceAll(" ");
        return s;
    }

    private static String normalizeSuspensions(String text) {
        String s = text;
        for (Pattern variant : SUS4_VARIANTS) {
            s = variant.matcher(s).replaceAll("sus4");
        }
        return REPEATED_SUS4.matcher(s).replaceAll("sus4");
    }
}
