package pl.marcinmilkowski.harmony_scan.chord;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads canonical Roman-numeral tokens back into their parts.
 *
 * Token form: {@code [b|#]DEGREE[suffix][(tensions)]}, e.g. {@code bVII7}, {@code ii-7}, {@code V7(b9,#9)}.
 */
public final class CanonicalTokens {

    /** Scale degree numerals, longest alternatives first. */
    public static final String DEGREE = "VII|VI|V|IV|III|II|I|vii|vi|v|iv|iii|ii|i";

    /** Closed suffix vocabulary; both 6/9 spellings are accepted. */
    public static final String SUFFIX = "maj7|-7|7|ø7|o7|6/9|69|-6|6";

    private static final Pattern DEGREE_HEAD = Pattern.compile("^([b#]?)(" + DEGREE + ")");
    private static final Pattern TOKEN = Pattern.compile(
        "^([b#]?)(" + DEGREE + ")(" + SUFFIX + ")?(\\((?:b9|#9)(?:,(?:b9|#9))?\\))?$"
    );

    private CanonicalTokens() {
    }

    /**
     * Check whether the text is a well-formed canonical token.
     */
    public static boolean isCanonical(String text) {
        return text != null && TOKEN.matcher(text).matches();
    }

    /**
     * Accidental plus degree numeral of a token ({@code bVII} for {@code bVII7}), or "" if none.
     */
    public static String degreeHead(String token) {
        if (token == null) return "";
        Matcher m = DEGREE_HEAD.matcher(token);
        return m.find() ? m.group(0) : "";
    }

    /**
     * Quality suffix of a token with any tension annotation removed.
     */
    public static String suffixOf(String token) {
        String head = degreeHead(token);
        if (head.isEmpty()) return token == null ? "" : token;
        String rest = token.substring(head.length());
        int paren = rest.indexOf('(');
        return paren >= 0 ? rest.substring(0, paren) : rest;
    }

    /**
     * Recover the quality a canonical token encodes.
     * Case decides between the major and minor reading of {@code ""} and {@code maj7};
     * every other suffix names its quality outright. Anything else is {@link Quality#UNRESOLVED}.
     */
    public static Quality qualityOf(String token) {
        if (token == null) return Quality.UNRESOLVED;
        Matcher m = TOKEN.matcher(token);
        if (!m.matches()) {
            return Quality.UNRESOLVED;
        }
        boolean upper = Character.isUpperCase(m.group(2).charAt(0));
        String suffix = m.group(3) == null ? "" : m.group(3);
        switch (suffix) {
            case "":
                return upper ? Quality.MAJOR_PLAIN : Quality.MINOR_TRIAD;
            case "maj7":
                return upper ? Quality.MAJOR_MAJ7 : Quality.MINOR_MAJ7;
            case "6":
                return Quality.MAJOR_SIX;
            case "69":
            case "6/9":
                return Quality.MAJOR_SIX_NINE;
            case "7":
                return Quality.DOMINANT_7;
            case "-6":
                return Quality.MINOR_SIX;
            case "-7":
                return Quality.MINOR_SEVEN;
            case "o7":
                return Quality.DIMINISHED_7;
            case "ø7":
                return Quality.HALF_DIMINISHED_7;
            default:
                return Quality.UNRESOLVED;
        }
    }

    /**
     * True if the degree numeral of the head is written in upper case.
     */
    public static boolean isUpperDegree(String head) {
        for (int i = 0; i < head.length(); i++) {
            char c = head.charAt(i);
            if (c == 'b' || c == '#') continue;
            return Character.isUpperCase(c);
        }
        return false;
    }
}
