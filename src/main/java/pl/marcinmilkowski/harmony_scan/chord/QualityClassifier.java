package pl.marcinmilkowski.harmony_scan.chord;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides the harmonic quality of a chord from its normalized literal,
 * falling back to the raw quality tail of the Roman-numeral analysis.
 *
 * The rules form an ordered decision table evaluated top to bottom; the first
 * rule that applies wins and later rules never override it. Literal rules come
 * first, so the raw tail is consulted only when the literal is inconclusive.
 *
 * Literal matching is done on the lower-cased literal. The exceptions are the
 * canonical-token rule and the {@code CM7} spelling, which are case sensitive.
 */
public class QualityClassifier {

    private static final Pattern DIM7 = Pattern.compile("dim7|°7|o7");
    private static final Pattern HALF_DIM = Pattern.compile("m7\\(?b5|ø");
    private static final Pattern MIN_MAJ7 = Pattern.compile("m\\(maj7\\)|mmaj7|m\\^7|mδ");
    private static final Pattern MAJ_FAMILY = Pattern.compile("(?:maj|\\^|δ)\\s*(?:7|9|13)(?!\\d)|δ(?=$|[/\\s(])");
    private static final Pattern UPPER_M_MAJ = Pattern.compile("^[A-G][#b]?M(?:7|9|13)(?!\\d)");
    private static final Pattern MINOR_SIX = Pattern.compile("^[a-g][#b]?m6");
    private static final Pattern SIX_NINE = Pattern.compile("6\\s*(?:/|-|\\+|add|\\()\\s*9|(?<!\\d)69(?!\\d)");
    private static final Pattern BARE_SIX = Pattern.compile("(?<!\\d[b#])(?<!\\d)6(?=$|/|\\s)");
    private static final Pattern MINOR_SEVENTH = Pattern.compile("m7|^[a-g][#b]?m(?:9|11|13)(?!\\d)");
    private static final Pattern PLAIN_SEVEN = Pattern.compile("(?<![jmøo°^δ\\d])7");
    private static final Pattern DOMINANT_EXTENSION = Pattern.compile("^[a-g][#b]?(?:9|11|13)(?!\\d)");
    private static final Pattern MINOR_TRIAD = Pattern.compile("^[a-g][#b]?m(?=$|[/\\s(]|\\d)");
    private static final Pattern MAJOR_TRIAD = Pattern.compile("^[a-g][#b]?(?:/[a-g][#b]?)?$");
    private static final Pattern RAW_BARE_SIX = Pattern.compile("(?<!\\d)6(?![049])");

    private static final List<QualityRule> RULES = List.of(
        new QualityRule("canonical token", f -> CanonicalTokens.isCanonical(f.literal()),
            f -> CanonicalTokens.qualityOf(f.literal())),
        QualityRule.of("diminished seventh", f -> DIM7.matcher(f.lower()).find(), Quality.DIMINISHED_7),
        QualityRule.of("half-diminished", f -> HALF_DIM.matcher(f.lower()).find(), Quality.HALF_DIMINISHED_7),
        QualityRule.of("minor-major seventh", f -> MIN_MAJ7.matcher(f.lower()).find(), Quality.MINOR_MAJ7),
        QualityRule.of("major seventh family", f -> MAJ_FAMILY.matcher(f.lower()).find()
            || UPPER_M_MAJ.matcher(f.literal()).find(), Quality.MAJOR_MAJ7),
        QualityRule.of("minor sixth", f -> MINOR_SIX.matcher(f.lower()).find(), Quality.MINOR_SIX),
        QualityRule.of("minor 6/9", f -> SIX_NINE.matcher(f.lower()).find() && isMinorTriad(f), Quality.MINOR_SIX),
        QualityRule.of("6/9", f -> SIX_NINE.matcher(f.lower()).find(), Quality.MAJOR_SIX_NINE),
        QualityRule.of("minor bare sixth", f -> BARE_SIX.matcher(f.lower()).find() && isMinorTriad(f), Quality.MINOR_SIX),
        QualityRule.of("bare sixth", f -> BARE_SIX.matcher(f.lower()).find(), Quality.MAJOR_SIX),
        QualityRule.of("minor seventh", f -> MINOR_SEVENTH.matcher(f.lower()).find(), Quality.MINOR_SEVEN),
        QualityRule.of("plain dominant", f -> PLAIN_SEVEN.matcher(f.lower()).find()
            || DOMINANT_EXTENSION.matcher(f.lower()).find(), Quality.DOMINANT_7),
        QualityRule.of("minor triad", QualityClassifier::isMinorTriad, Quality.MINOR_TRIAD),
        QualityRule.of("major triad", f -> MAJOR_TRIAD.matcher(f.lower()).matches(), Quality.MAJOR_PLAIN),
        // Raw Roman-numeral tail, only reached when the literal said nothing
        QualityRule.of("raw maj7", f -> f.rawTail().contains("maj"), Quality.MAJOR_MAJ7),
        QualityRule.of("raw half-diminished", f -> f.rawTail().contains("ø") || f.rawTail().contains("/o"),
            Quality.HALF_DIMINISHED_7),
        QualityRule.of("raw diminished", f -> f.rawTail().contains("o7") || f.rawTail().contains("°7"),
            Quality.DIMINISHED_7),
        QualityRule.of("raw 6/9", f -> f.rawTail().contains("6/9") || f.rawTail().contains("69"),
            Quality.MAJOR_SIX_NINE),
        QualityRule.of("raw sixth", f -> RAW_BARE_SIX.matcher(f.rawTail()).find(), Quality.MAJOR_SIX),
        QualityRule.of("raw minor seventh", f -> f.lowerCaseDegree() && f.rawTail().contains("7"),
            Quality.MINOR_SEVEN),
        QualityRule.of("raw seventh", f -> f.rawTail().contains("7"), Quality.DOMINANT_7)
    );

    /**
     * Classify with an unknown raw degree (treated as upper case).
     */
    public Quality classify(String normalizedLiteral, String rawQualityTail) {
        return classify(normalizedLiteral, rawQualityTail, "");
    }

    public Quality classify(String normalizedLiteral, String rawQualityTail, String rawDegreeHead) {
        return classify(ChordFacts.of(normalizedLiteral, rawQualityTail, rawDegreeHead));
    }

    public Quality classify(ChordFacts facts) {
        return explain(facts)
            .map(rule -> rule.qualityFor(facts))
            .orElse(Quality.UNRESOLVED);
    }

    /**
     * The first rule that applies to the chord, or empty when the chord is unresolved.
     */
    public Optional<QualityRule> explain(ChordFacts facts) {
        for (QualityRule rule : RULES) {
            if (rule.appliesTo(facts)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * The decision table in evaluation order.
     */
    public List<QualityRule> rules() {
        return RULES;
    }

    private static boolean isMinorTriad(ChordFacts f) {
        return MINOR_TRIAD.matcher(f.lower()).find();
    }
}
