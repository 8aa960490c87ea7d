package pl.marcinmilkowski.harmony_scan.query;

import org.apache.lucene.index.Term;
import org.apache.lucene.queries.spans.SpanNearQuery;
import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.queries.spans.SpanTermQuery;
import pl.marcinmilkowski.harmony_scan.grammar.PatternToken;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.indexer.ProgressionIndexer;

import java.util.List;

/**
 * Compiles a progression pattern to a Lucene SpanQuery over the {@code harmony} field.
 *
 * Exact elements become a term on the token text, wildcard elements a term on the
 * family term stacked at the same position (e.g. {@code *maj:I}). Elements must be
 * adjacent and in order, so multi-element patterns become a SpanNearQuery with slop 0.
 */
public class PatternToLuceneCompiler {

    private final String field;

    public PatternToLuceneCompiler() {
        this(ProgressionIndexer.FIELD_HARMONY);
    }

    public PatternToLuceneCompiler(String field) {
        this.field = field;
    }

    public SpanQuery compile(ProgressionPattern pattern) {
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("Cannot compile an empty pattern");
        }
        List<PatternToken> elements = pattern.tokens();
        if (elements.size() == 1) {
            return compileElement(elements.get(0));
        }
        SpanQuery[] clauses = new SpanQuery[elements.size()];
        for (int i = 0; i < clauses.length; i++) {
            clauses[i] = compileElement(elements.get(i));
        }
        return new SpanNearQuery(clauses, 0, true);
    }

    SpanQuery compileElement(PatternToken element) {
        String term = element.wildcard()
            ? element.family().indexTerm(element.head())
            : element.exactText();
        return new SpanTermQuery(new Term(field, term));
    }
}
