package pl.marcinmilkowski.harmony_scan.indexer;

import org.apache.lucene.util.BytesRef;
import pl.marcinmilkowski.harmony_scan.chord.ChordToken;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary form of a tokenized chord sequence, stored in the {@code chords} doc values field.
 *
 * Layout: version byte, chord count, then per chord: bar (int), token, literal.
 * Strings are written as a byte length (int) followed by UTF-8 bytes, so literals of any length fit.
 */
public final class ChordSequenceCodec {

    private static final byte VERSION = 1;

    private ChordSequenceCodec() {
    }

    public static BytesRef encode(List<ChordToken> sequence) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(16 + sequence.size() * 16);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeByte(VERSION);
            out.writeInt(sequence.size());
            for (ChordToken chord : sequence) {
                out.writeInt(chord.bar());
                writeString(out, chord.token());
                writeString(out, chord.literal());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot encode chord sequence", e);
        }
        return new BytesRef(bytes.toByteArray());
    }

    public static List<ChordToken> decode(BytesRef ref) throws IOException {
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(ref.bytes, ref.offset, ref.length));
        byte version = in.readByte();
        if (version != VERSION) {
            throw new IOException("Unsupported chord sequence version: " + version);
        }
        int count = in.readInt();
        if (count < 0 || count > ref.length) {
            throw new IOException("Corrupt chord sequence: chord count " + count);
        }
        List<ChordToken> sequence = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int bar = in.readInt();
            String token = readString(in);
            String literal = readString(in);
            sequence.add(new ChordToken(bar, token, literal));
        }
        return sequence;
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(utf8.length);
        out.write(utf8);
    }

    private static String readString(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > in.available()) {
            throw new IOException("Corrupt chord sequence: string length " + length);
        }
        byte[] utf8 = new byte[length];
        in.readFully(utf8);
        return new String(utf8, StandardCharsets.UTF_8);
    }
}
