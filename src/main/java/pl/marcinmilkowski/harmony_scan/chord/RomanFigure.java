package pl.marcinmilkowski.harmony_scan.chord;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A raw Roman-numeral figure as produced by the harmonic-analysis service,
 * split into its degree head ({@code bVII}) and quality tail ({@code 7}, {@code 65}, {@code ø7}).
 */
public record RomanFigure(String degreeHead, String qualityTail) {

    private static final Pattern HEAD = Pattern.compile("^[b#]?(?:" + CanonicalTokens.DEGREE + ")");
    private static final Pattern FULL_HEAD = Pattern.compile("^([b#]?)(" + CanonicalTokens.DEGREE + ")$");

    public RomanFigure {
        degreeHead = degreeHead == null ? "" : degreeHead;
        qualityTail = qualityTail == null ? "" : qualityTail;
    }

    /**
     * Split a full figure such as {@code "bVII7"} or {@code "V 65"}.
     * A figure without a recognizable degree keeps everything in the tail.
     */
    public static RomanFigure parse(String figure) {
        String t = figure == null ? "" : figure.replace(" ", "");
        Matcher m = HEAD.matcher(t);
        if (!m.find()) {
            return new RomanFigure("", t);
        }
        return new RomanFigure(m.group(), t.substring(m.end()));
    }

    /**
     * True if the head is exactly an optional accidental plus one degree numeral.
     */
    public boolean hasValidHead() {
        return FULL_HEAD.matcher(degreeHead).matches();
    }

    /** Leading accidental of the head, "" when natural or invalid. */
    public String accidental() {
        Matcher m = FULL_HEAD.matcher(degreeHead);
        return m.matches() ? m.group(1) : "";
    }

    /** Degree numeral of the head without accidental, "" when invalid. */
    public String degree() {
        Matcher m = FULL_HEAD.matcher(degreeHead);
        return m.matches() ? m.group(2) : "";
    }

    /** Figure text as received. */
    public String figure() {
        return degreeHead + qualityTail;
    }
}
