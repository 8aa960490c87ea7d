package pl.marcinmilkowski.harmony_scan.indexer;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.BinaryDocValuesField;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;
import pl.marcinmilkowski.harmony_scan.chord.SixNineStyle;
import pl.marcinmilkowski.harmony_scan.corpus.Piece;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds a piece-per-document index of tokenized chord sequences.
 *
 * Index structure:
 * - Each document = one piece
 * - Fields:
 *   - harmony (positions, one per chord: token term plus stacked family term)
 *   - title, path, key (stored, for display)
 *   - ordinal (stored and numeric doc values, corpus order)
 *   - chord_count (stored)
 *   - chords (BinaryDocValues, encoded sequence for verification and display)
 *
 * Commit user data records the 6/9 spelling the tokens were built with
 * ({@link #COMMIT_SIX_NINE_STYLE}), so queries can spell exact 6/9 elements the same way.
 */
public class ProgressionIndexer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ProgressionIndexer.class);

    public static final String FIELD_HARMONY = "harmony";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_KEY = "key";
    public static final String FIELD_ORDINAL = "ordinal";
    public static final String FIELD_CHORD_COUNT = "chord_count";
    public static final String FIELD_CHORDS = "chords";

    public static final String COMMIT_SIX_NINE_STYLE = "six_nine_style";

    private final IndexWriter writer;
    private final Directory directory;
    private final ChordTokenStream tokenStream = new ChordTokenStream();
    private int pieceCount;
    private long chordCount;

    public ProgressionIndexer(Path indexPath) throws IOException {
        this(indexPath, SixNineStyle.COMPACT);
    }

    /**
     * Creates a new index at the given directory, replacing any existing one.
     *
     * @param sixNineStyle spelling used by the tokenizer that feeds this index
     */
    public ProgressionIndexer(Path indexPath, SixNineStyle sixNineStyle) throws IOException {
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);

        // Custom token stream for the harmony field; the analyzer is never applied to it
        Analyzer analyzer = new StandardAnalyzer();

        IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        this.writer = new IndexWriter(directory, config);
        writer.setLiveCommitData(Map.of(COMMIT_SIX_NINE_STYLE, sixNineStyle.suffix()).entrySet());

        log.info("Progression indexer initialized at: {}", indexPath);
    }

    /**
     * Indexes one piece with its tokenized sequence. Documents are numbered in call order.
     */
    public void indexPiece(Piece piece, List<ChordToken> sequence) throws IOException {
        Document doc = new Document();

        doc.add(new StoredField(FIELD_TITLE, piece.title()));
        doc.add(new StoredField(FIELD_PATH, piece.path().toString()));
        doc.add(new StoredField(FIELD_KEY, piece.key().displayName()));

        doc.add(new StoredField(FIELD_ORDINAL, pieceCount));
        doc.add(new NumericDocValuesField(FIELD_ORDINAL, pieceCount));
        doc.add(new StoredField(FIELD_CHORD_COUNT, sequence.size()));

        tokenStream.setTokens(sequence);
        doc.add(new TextField(FIELD_HARMONY, tokenStream));
        doc.add(new BinaryDocValuesField(FIELD_CHORDS, ChordSequenceCodec.encode(sequence)));

        writer.addDocument(doc);
        pieceCount++;
        chordCount += sequence.size();

        if (pieceCount % 1000 == 0) {
            log.info("Indexed {} pieces, {} chords", pieceCount, chordCount);
        }
    }

    public void commit() throws IOException {
        writer.commit();
        log.info("Committed {} pieces, {} chords", pieceCount, chordCount);
    }

    public int getPieceCount() {
        return pieceCount;
    }

    public long getChordCount() {
        return chordCount;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        directory.close();
    }
}
