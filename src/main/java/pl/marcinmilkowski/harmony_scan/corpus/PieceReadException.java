package pl.marcinmilkowski.harmony_scan.corpus;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A corpus file could not be turned into a piece. Fatal for that piece only.
 */
public class PieceReadException extends IOException {

    private final Path path;

    public PieceReadException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public PieceReadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
