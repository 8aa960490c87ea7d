package pl.marcinmilkowski.harmony_scan.corpus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.harmony_scan.grammar.PatternParser;
import pl.marcinmilkowski.harmony_scan.grammar.ProgressionPattern;
import pl.marcinmilkowski.harmony_scan.query.MatchHit;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HitCsvWriterTest {

    @TempDir
    Path tempDir;

    private static PieceScan backdoorScan() {
        ProgressionPattern pattern = new PatternParser().parse("iv-7 bVII7 I*");
        Piece piece = new Piece("Backdoor, Revisited", Path.of("charts", "Backdoor.json"),
            new KeyDescriptor("E-", "major"), List.of());
        MatchHit hit = new MatchHit(0, 1, List.of("iv-7", "bVII7", "Imaj7"), List.of("Abm7", "Db7", "Ebmaj7"));
        return new PieceScan(piece.path(), piece, List.of(),
            List.of(new PatternHits(pattern, List.of(hit))), null);
    }

    @Test
    @DisplayName("One row per hit, fields with commas quoted")
    void writesRows() throws IOException {
        StringWriter out = new StringWriter();
        int rows;
        try (HitCsvWriter writer = new HitCsvWriter(out, false)) {
            rows = writer.write(backdoorScan());
        }

        assertEquals(1, rows);
        String path = Path.of("charts", "Backdoor.json").toString();
        assertEquals("Title,Path,Key,BarStart,Pattern,Tokens\r\n"
            + "\"Backdoor, Revisited\"," + path + ",Eb major,1,iv-7 bVII7 I*,iv-7 bVII7 Imaj7\r\n",
            out.toString());
    }

    @Test
    @DisplayName("Literals column is added on request")
    void literalsColumn() throws IOException {
        StringWriter out = new StringWriter();
        try (HitCsvWriter writer = new HitCsvWriter(out, true)) {
            writer.write(backdoorScan());
        }

        String[] lines = out.toString().split("\r\n");
        assertEquals("Title,Path,Key,BarStart,Pattern,Tokens,Literals", lines[0]);
        assertTrue(lines[1].endsWith(",Abm7 | Db7 | Ebmaj7"));
    }

    @Test
    void failedScanWritesNothing() throws IOException {
        StringWriter out = new StringWriter();
        try (HitCsvWriter writer = new HitCsvWriter(out, false)) {
            assertEquals(0, writer.write(PieceScan.failed(Path.of("x.json"), "boom")));
        }
        assertEquals("Title,Path,Key,BarStart,Pattern,Tokens\r\n", out.toString());
    }

    @Test
    void quoting() {
        assertEquals("plain", HitCsvWriter.quote("plain"));
        assertEquals("\"a,b\"", HitCsvWriter.quote("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", HitCsvWriter.quote("say \"hi\""));
        assertEquals("\"two\nlines\"", HitCsvWriter.quote("two\nlines"));
        assertEquals("", HitCsvWriter.quote(null));
    }

    @Test
    void opensFileInNewDirectory() throws IOException {
        Path csv = tempDir.resolve("out").resolve("hits.csv");
        try (HitCsvWriter writer = HitCsvWriter.open(csv, true)) {
            writer.write(backdoorScan());
        }
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
    }
}
