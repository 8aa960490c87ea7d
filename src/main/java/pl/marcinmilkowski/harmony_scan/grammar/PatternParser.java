package pl.marcinmilkowski.harmony_scan.grammar;

import pl.marcinmilkowski.harmony_scan.chord.CanonicalTokens;
import pl.marcinmilkowski.harmony_scan.chord.SixNineStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for progression patterns.
 *
 * Pattern syntax: whitespace-separated tokens, each
 * - optional accidental: {@code b} or {@code #}
 * - one degree numeral: {@code I..VII} (major/dominant) or {@code i..vii} (minor)
 * - optional exact quality: {@code maj7 -7 7 ø7 o7 6/9 69 -6 6}
 * - optional {@code *}: family wildcard
 *
 * Examples:
 * - Exact: {@code ii-7 V7 Imaj7}, {@code IVmaj7 I6 III7}, {@code viiø7}
 * - Families: {@code I*} any major chord on I, {@code ii*} any minor chord on ii,
 *   {@code V7*} any dominant seventh on V
 *
 * Parsing stops at the first malformed token; no partial pattern is returned.
 */
public class PatternParser {

    private static final Pattern TOKEN = Pattern.compile(
        "^([b#]?)(" + CanonicalTokens.DEGREE + ")(" + CanonicalTokens.SUFFIX + ")?(\\*)?$"
    );

    private final SixNineStyle sixNineStyle;

    public PatternParser(SixNineStyle sixNineStyle) {
        this.sixNineStyle = sixNineStyle;
    }

    public PatternParser() {
        this(SixNineStyle.COMPACT);
    }

    /**
     * Parse a pattern string into a compiled pattern.
     *
     * @throws PatternSyntaxException if the pattern is blank or any token is malformed
     */
    public ProgressionPattern parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PatternSyntaxException(null, "Pattern error: empty pattern");
        }
        String source = text.trim();
        List<PatternToken> tokens = new ArrayList<>();
        for (String raw : source.split("\\s+")) {
            tokens.add(parseToken(raw));
        }
        return new ProgressionPattern(source, tokens);
    }

    /**
     * Parse every pattern of a run up front, failing on the first bad one.
     */
    public List<ProgressionPattern> parseAll(List<String> patterns) {
        List<ProgressionPattern> compiled = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            compiled.add(parse(pattern));
        }
        return compiled;
    }

    private PatternToken parseToken(String raw) {
        Matcher m = TOKEN.matcher(raw);
        if (!m.matches()) {
            throw new PatternSyntaxException(raw, "Pattern error: Bad token syntax: '" + raw + "'");
        }
        String accidental = m.group(1);
        String degree = m.group(2);
        String suffix = renderSixNine(m.group(3));
        boolean wildcard = m.group(4) != null;

        TokenFamily family = null;
        if (wildcard) {
            family = TokenFamily.select(Character.isUpperCase(degree.charAt(0)), suffix)
                .orElseThrow(() -> new PatternSyntaxException(raw,
                    "Pattern error: no chord family for wildcard '" + raw + "'"));
        }
        return new PatternToken(accidental, degree, suffix, wildcard, family);
    }

    // Exact 6/9 elements must use the same spelling the token builder emits
    private String renderSixNine(String suffix) {
        if ("69".equals(suffix) || "6/9".equals(suffix)) {
            return sixNineStyle.suffix();
        }
        return suffix;
    }
}
