package pl.marcinmilkowski.harmony_scan.indexer;

import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;
import pl.marcinmilkowski.harmony_scan.chord.CanonicalTokens;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.grammar.TokenFamily;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * A TokenStream that emits a piece's canonical chord tokens, one position per chord.
 *
 * Each position carries:
 * - the token text (or {@link #EMPTY_TERM} for a chord without analysis)
 * - a family term such as {@code *maj:IV} stacked at the same position when the
 *   token belongs to a wildcard family, so {@code IV*} compiles to a single term query
 */
public final class ChordTokenStream extends TokenStream {

    /** Term emitted for chords with an empty token, so positions stay aligned with the sequence. */
    public static final String EMPTY_TERM = "_";

    private final CharTermAttribute termAttr;
    private final PositionIncrementAttribute posIncrAttr;

    private List<ChordToken> tokens;
    private int currentPosition;
    private String pendingFamilyTerm;

    public ChordTokenStream() {
        super();
        termAttr = addAttribute(CharTermAttribute.class);
        posIncrAttr = addAttribute(PositionIncrementAttribute.class);
    }

    /**
     * Sets the chord sequence to emit.
     */
    public void setTokens(List<ChordToken> tokens) {
        this.tokens = tokens;
        this.currentPosition = 0;
        this.pendingFamilyTerm = null;
    }

    @Override
    public boolean incrementToken() throws IOException {
        clearAttributes();

        if (pendingFamilyTerm != null) {
            termAttr.setEmpty().append(pendingFamilyTerm);
            posIncrAttr.setPositionIncrement(0);
            pendingFamilyTerm = null;
            return true;
        }

        if (tokens == null || currentPosition >= tokens.size()) {
            return false;
        }

        String token = tokens.get(currentPosition).token();
        if (token.isEmpty()) {
            termAttr.setEmpty().append(EMPTY_TERM);
        } else {
            termAttr.setEmpty().append(token);
            pendingFamilyTerm = familyTerm(token).orElse(null);
        }
        posIncrAttr.setPositionIncrement(1);

        currentPosition++;
        return true;
    }

    /**
     * The stacked family term for a canonical token, if it belongs to a family.
     */
    static Optional<String> familyTerm(String token) {
        String head = CanonicalTokens.degreeHead(token);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        return TokenFamily.of(CanonicalTokens.qualityOf(token)).map(f -> f.indexTerm(head));
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        currentPosition = 0;
        pendingFamilyTerm = null;
    }
}
