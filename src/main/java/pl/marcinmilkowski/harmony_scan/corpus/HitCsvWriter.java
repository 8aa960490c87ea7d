package pl.marcinmilkowski.harmony_scan.corpus;

import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.query.MatchHit;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes pattern hits as CSV, one row per hit.
 *
 * Columns: Title, Path, Key, BarStart, Pattern, Tokens and, when enabled, Literals.
 */
public class HitCsvWriter implements Closeable {

    private final Writer out;
    private final boolean showLiterals;

    public HitCsvWriter(Writer out, boolean showLiterals) throws IOException {
        this.out = out;
        this.showLiterals = showLiterals;
        List<String> header = new ArrayList<>(List.of("Title", "Path", "Key", "BarStart", "Pattern", "Tokens"));
        if (showLiterals) {
            header.add("Literals");
        }
        writeRow(header);
    }

    public static HitCsvWriter open(Path file, boolean showLiterals) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new HitCsvWriter(writer, showLiterals);
    }

    /**
     * Write every hit of a scanned piece. Failed pieces and patterns without hits write nothing.
     *
     * @return number of rows written
     */
    public int write(PieceScan scan) throws IOException {
        if (scan.isFailed()) {
            return 0;
        }
        int rows = 0;
        Piece piece = scan.piece();
        for (PatternHits result : scan.results()) {
            rows += write(piece.title(), piece.path().toString(), piece.key().displayName(),
                result.pattern(), result.hits());
        }
        return rows;
    }

    /**
     * Write the hits of one pattern in one piece.
     *
     * @return number of rows written
     */
    public int write(String title, String path, String key, ProgressionPattern pattern,
                     List<MatchHit> hits) throws IOException {
        for (MatchHit hit : hits) {
            List<String> row = new ArrayList<>(7);
            row.add(title);
            row.add(path);
            row.add(key);
            row.add(String.valueOf(hit.startBar()));
            row.add(pattern.source());
            row.add(hit.tokenText());
            if (showLiterals) {
                row.add(hit.literalText());
            }
            writeRow(row);
        }
        return hits.size();
    }

    private void writeRow(List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(quote(fields.get(i)));
        }
        out.write("\r\n");
    }

    static String quote(String field) {
        if (field == null) {
            return "";
        }
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
