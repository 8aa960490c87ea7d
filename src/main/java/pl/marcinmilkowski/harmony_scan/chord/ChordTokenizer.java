package pl.marcinmilkowski.harmony_scan.chord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns chord events into canonical tokens: normalize the literal, classify, build.
 *
 * Stateless apart from its configuration, so one instance can serve many threads.
 */
public class ChordTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(ChordTokenizer.class);

    private final QualityClassifier classifier;
    private final TokenBuilder builder;

    public ChordTokenizer(QualityClassifier classifier, TokenBuilder builder) {
        this.classifier = classifier;
        this.builder = builder;
    }

    public ChordTokenizer(SixNineStyle sixNineStyle) {
        this(new QualityClassifier(), new TokenBuilder(sixNineStyle));
    }

    /**
     * Tokenize a single chord.
     */
    public ChordToken tokenize(ChordEvent event) {
        String literal = LiteralNormalizer.normalize(event.literalText());
        return new ChordToken(event.barNumber(),
            token(literal, event.rawDegreeHead(), event.rawQualityTail()), literal);
    }

    /**
     * Canonical token for an already normalized literal and its raw analysis.
     */
    public String token(String normalizedLiteral, String rawDegreeHead, String rawQualityTail) {
        Quality quality = classifier.classify(normalizedLiteral, rawQualityTail, rawDegreeHead);
        String token = builder.buildToken(rawDegreeHead, rawQualityTail, quality, normalizedLiteral);
        if (quality == Quality.UNRESOLVED) {
            logger.debug("Unresolved quality for literal '{}' (raw {}{}), emitting '{}'",
                normalizedLiteral, rawDegreeHead, rawQualityTail, token);
        }
        return token;
    }

    /**
     * Tokenize all chords of a piece in score order. Every event yields exactly one entry.
     */
    public List<ChordToken> tokenize(List<ChordEvent> events) {
        List<ChordEvent> ordered = new ArrayList<>(events);
        ordered.sort(null);
        List<ChordToken> tokens = new ArrayList<>(ordered.size());
        for (ChordEvent event : ordered) {
            tokens.add(tokenize(event));
        }
        return tokens;
    }
}
