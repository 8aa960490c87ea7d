package pl.marcinmilkowski.harmony_scan.chord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Assembles a canonical token from degree, accidental, quality and the literal's tensions.
 *
 * Degree case is derived, never chosen freely:
 * - dominant sevenths are always upper case ({@code v} + {@code D7} gives {@code V7})
 * - minor, diminished and half-diminished qualities are always lower case
 * - everything else keeps the case of the raw degree head
 */
public class TokenBuilder {

    private static final Pattern FLAT_NINE = Pattern.compile("(?<!\\p{L})b9(?!\\d)");
    private static final Pattern SHARP_NINE = Pattern.compile("(?<!\\p{L})#9(?!\\d)");

    private final SixNineStyle sixNineStyle;

    public TokenBuilder(SixNineStyle sixNineStyle) {
        this.sixNineStyle = sixNineStyle;
    }

    public TokenBuilder() {
        this(SixNineStyle.COMPACT);
    }

    /**
     * Build a token from a raw degree head such as {@code bVII}.
     * A head outside the degree vocabulary yields the raw figure unchanged.
     */
    public String buildToken(String rawDegreeHead, String rawQualityTail, Quality quality, String normalizedLiteral) {
        RomanFigure figure = new RomanFigure(rawDegreeHead, rawQualityTail);
        if (!figure.hasValidHead()) {
            return figure.figure();
        }
        return buildToken(figure.accidental(), figure.degree(), rawQualityTail, quality, normalizedLiteral);
    }

    /**
     * Build a token from an already separated accidental and degree numeral.
     */
    public String buildToken(String accidental, String degree, String rawQualityTail,
                             Quality quality, String normalizedLiteral) {
        StringBuilder token = new StringBuilder();
        token.append(accidental == null ? "" : accidental);
        token.append(degreeCase(degree, quality));
        token.append(suffix(quality, rawQualityTail));

        List<String> tensions = tensions(normalizedLiteral);
        if (!tensions.isEmpty()) {
            token.append('(').append(String.join(",", tensions)).append(')');
        }
        return token.toString();
    }

    private String degreeCase(String degree, Quality quality) {
        if (quality == Quality.DOMINANT_7) {
            return degree.toUpperCase(Locale.ROOT);
        }
        boolean rawLower = !degree.isEmpty() && Character.isLowerCase(degree.charAt(0));
        if (quality.isMinorCase() || rawLower) {
            return degree.toLowerCase(Locale.ROOT);
        }
        return degree.toUpperCase(Locale.ROOT);
    }

    private String suffix(Quality quality, String rawQualityTail) {
        switch (quality) {
            case MAJOR_PLAIN:
            case MINOR_TRIAD:
                return "";
            case MAJOR_SIX:
                return "6";
            case MAJOR_MAJ7:
            case MINOR_MAJ7:
                return "maj7";
            case MAJOR_SIX_NINE:
                return sixNineStyle.suffix();
            case DOMINANT_7:
                return "7";
            case MINOR_SIX:
                return "-6";
            case MINOR_SEVEN:
                return "-7";
            case DIMINISHED_7:
                return "o7";
            case HALF_DIMINISHED_7:
                return "ø7";
            case UNRESOLVED:
            default:
                return unresolvedSuffix(rawQualityTail);
        }
    }

    // Best effort: whatever the analysis reported, minus inversion figures
    private static String unresolvedSuffix(String rawQualityTail) {
        if (rawQualityTail == null || rawQualityTail.isEmpty()) return "";
        String t = rawQualityTail.replace(" ", "");
        return ChordFacts.INVERSION_FIGURES.matcher(t).replaceAll("");
    }

    /**
     * Tension annotations carried by the literal, in display order.
     */
    static List<String> tensions(String normalizedLiteral) {
        List<String> tensions = new ArrayList<>(2);
        if (normalizedLiteral == null || normalizedLiteral.isEmpty()) return tensions;
        if (FLAT_NINE.matcher(normalizedLiteral).find()) tensions.add("b9");
        if (SHARP_NINE.matcher(normalizedLiteral).find()) tensions.add("#9");
        return tensions;
    }

    public SixNineStyle getSixNineStyle() {
        return sixNineStyle;
    }
}
