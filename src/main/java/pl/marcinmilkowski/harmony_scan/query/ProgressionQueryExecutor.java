package pl.marcinmilkowski.harmony_scan.query;

import org.apache.lucene.document.Document;
import org.apache.lucene.index.BinaryDocValues;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.queries.spans.SpanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.chord.SixNineStyle;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.indexer.ChordSequenceCodec;
import pl.marcinmilkowski.harmony_scan.indexer.ProgressionIndexer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Runs progression patterns against an index built by {@link ProgressionIndexer}.
 *
 * The span query narrows the search to candidate pieces; each candidate's chord
 * sequence is then decoded from doc values and scanned with {@link SequenceScanner},
 * which yields the exact hits (bars, tokens, literals).
 */
public class ProgressionQueryExecutor implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ProgressionQueryExecutor.class);

    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final PatternToLuceneCompiler compiler;
    private final SequenceScanner scanner;
    private final SixNineStyle sixNineStyle;

    public ProgressionQueryExecutor(Path indexPath) throws IOException {
        this.directory = FSDirectory.open(indexPath);
        this.reader = DirectoryReader.open(directory);
        this.searcher = new IndexSearcher(reader);
        this.compiler = new PatternToLuceneCompiler();
        this.scanner = new SequenceScanner();
        this.sixNineStyle = readSixNineStyle(reader);
    }

    private static SixNineStyle readSixNineStyle(DirectoryReader reader) throws IOException {
        String stored = reader.getIndexCommit().getUserData().get(ProgressionIndexer.COMMIT_SIX_NINE_STYLE);
        if (stored == null) {
            logger.warn("Index has no recorded 6/9 style, assuming {}", SixNineStyle.COMPACT.suffix());
            return SixNineStyle.COMPACT;
        }
        try {
            return SixNineStyle.fromConfig(stored);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt index metadata: " + e.getMessage(), e);
        }
    }

    /**
     * Find every piece containing the pattern, in corpus order.
     */
    public List<IndexedPieceHits> search(ProgressionPattern pattern) throws IOException {
        if (pattern.isEmpty()) {
            return Collections.emptyList();
        }
        SpanQuery query = compiler.compile(pattern);
        TopDocs topDocs = searcher.search(query, Math.max(1, reader.maxDoc()));
        logger.debug("Pattern '{}' -> {} candidate pieces", pattern, topDocs.scoreDocs.length);

        List<IndexedPieceHits> results = new ArrayList<>();
        for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
            List<MatchHit> hits = scanner.scan(loadSequence(scoreDoc.doc), pattern);
            if (hits.isEmpty()) {
                logger.debug("Candidate doc {} not confirmed for '{}'", scoreDoc.doc, pattern);
                continue;
            }
            Document doc = searcher.storedFields().document(scoreDoc.doc);
            results.add(new IndexedPieceHits(
                doc.get(ProgressionIndexer.FIELD_TITLE),
                doc.get(ProgressionIndexer.FIELD_PATH),
                doc.get(ProgressionIndexer.FIELD_KEY),
                doc.getField(ProgressionIndexer.FIELD_ORDINAL).numericValue().intValue(),
                hits));
        }
        results.sort(Comparator.comparingInt(IndexedPieceHits::ordinal));
        return results;
    }

    /**
     * 6/9 spelling the index was built with. Patterns searched here must be compiled with it,
     * or exact 6/9 elements will never match.
     */
    public SixNineStyle getSixNineStyle() {
        return sixNineStyle;
    }

    /**
     * Number of indexed pieces.
     */
    public int getPieceCount() {
        return reader.numDocs();
    }

    /**
     * Load a piece's chord sequence from doc values.
     */
    List<ChordToken> loadSequence(int docId) throws IOException {
        for (LeafReaderContext leafContext : reader.leaves()) {
            int localDocId = docId - leafContext.docBase;
            if (localDocId >= 0 && localDocId < leafContext.reader().maxDoc()) {
                BinaryDocValues chords = leafContext.reader().getBinaryDocValues(ProgressionIndexer.FIELD_CHORDS);
                if (chords != null && chords.advanceExact(localDocId)) {
                    BytesRef bytesRef = chords.binaryValue();
                    return ChordSequenceCodec.decode(bytesRef);
                }
            }
        }
        return Collections.emptyList();
    }

    @Override
    public void close() throws IOException {
        reader.close();
        directory.close();
    }
}
