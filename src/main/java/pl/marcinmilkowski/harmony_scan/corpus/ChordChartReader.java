package pl.marcinmilkowski.harmony_scan.corpus;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.harmony_scan.chord.ChordEvent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads chord charts exported by the score and harmony analysis services.
 *
 * Expected JSON structure:
 * {
 *   "title": "Autumn Leaves",
 *   "key": {"tonic": "E-", "mode": "minor"},      // or "key": "Eb minor"
 *   "chords": [
 *     {"bar": 1, "offset": 0.0, "literal": "Cm7", "degree": "iv", "quality": "7"},
 *     {"bar": 2, "offset": 0.0, "literal": "F7", "figure": "VII7"},
 *     ...
 *   ]
 * }
 *
 * A chord may carry its raw analysis either split ("degree" + "quality") or as a
 * single "figure". A chord with neither is kept with an empty analysis.
 */
public class ChordChartReader implements PieceSource {

    private static final Logger logger = LoggerFactory.getLogger(ChordChartReader.class);

    @Override
    public Piece read(Path path) throws PieceReadException {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new PieceReadException(path, "Cannot read " + path + ": " + e.getMessage(), e);
        }

        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new PieceReadException(path, "Invalid chord chart JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new PieceReadException(path, "Empty chord chart");
        }

        String title = root.getString("title");
        if (title == null || title.isBlank()) {
            title = CorpusFiles.stem(path);
        }

        KeyDescriptor key = readKey(path, root);

        List<ChordEvent> events = readChords(path, root);

        logger.debug("Read {} chords from {} ({})", events.size(), path, key);
        return new Piece(title, path, key, events);
    }

    private KeyDescriptor readKey(Path path, JSONObject root) throws PieceReadException {
        Object keyNode = root.get("key");
        try {
            if (keyNode instanceof JSONObject) {
                JSONObject keyObj = (JSONObject) keyNode;
                return new KeyDescriptor(keyObj.getString("tonic"), keyObj.getString("mode"));
            }
            if (keyNode instanceof String) {
                return KeyDescriptor.parse((String) keyNode);
            }
        } catch (IllegalArgumentException e) {
            throw new PieceReadException(path, "Cannot resolve key: " + e.getMessage(), e);
        }
        throw new PieceReadException(path, "Missing 'key'");
    }

    private List<ChordEvent> readChords(Path path, JSONObject root) throws PieceReadException {
        JSONArray chords;
        try {
            chords = root.getJSONArray("chords");
        } catch (JSONException e) {
            throw new PieceReadException(path, "'chords' is not an array", e);
        }
        if (chords == null) {
            throw new PieceReadException(path, "Missing 'chords' array");
        }

        List<ChordEvent> events = new ArrayList<>(chords.size());
        for (int i = 0; i < chords.size(); i++) {
            try {
                JSONObject chord = chords.getJSONObject(i);
                if (chord == null) {
                    throw new PieceReadException(path, "Invalid chord at index " + i);
                }
                events.add(readChord(path, chord, i));
            } catch (JSONException | IllegalArgumentException e) {
                throw new PieceReadException(path, "Invalid chord at index " + i + ": " + e.getMessage(), e);
            }
        }
        return events;
    }

    // Type coercion failures (JSONException, NumberFormatException) are wrapped by readChords
    private ChordEvent readChord(Path path, JSONObject chord, int index) throws PieceReadException {
        int bar = chord.getIntValue("bar", 0);
        if (bar < 0) {
            throw new PieceReadException(path, "Negative bar number at chord " + index);
        }
        double offset = chord.getDoubleValue("offset");
        String literal = chord.getString("literal");

        if (chord.containsKey("figure")) {
            return ChordEvent.ofFigure(bar, offset, index, literal, chord.getString("figure"));
        }
        return new ChordEvent(bar, offset, index, literal, chord.getString("degree"), chord.getString("quality"));
    }
}
