package pl.marcinmilkowski.harmony_scan.corpus;

import java.util.Locale;

/**
 * Tonal key of a piece as resolved by the key-analysis service. Used for display only.
 */
public record KeyDescriptor(String tonic, String mode) {

    public KeyDescriptor {
        if (tonic == null || tonic.isBlank()) {
            throw new IllegalArgumentException("Key tonic is required");
        }
        tonic = tonic.trim();
        mode = mode == null || mode.isBlank() ? "major" : mode.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a key string: {@code "C"}, {@code "Eb"}, {@code "A-"}, {@code "F# minor"}.
     * A single lower-case tonic such as {@code "c"} denotes a minor key.
     */
    public static KeyDescriptor parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Unrecognized key string: " + text);
        }
        String[] parts = text.trim().split("\\s+");
        if (parts.length == 1) {
            String tonic = parts[0];
            boolean minor = Character.isLowerCase(tonic.charAt(0));
            return new KeyDescriptor(tonic, minor ? "minor" : "major");
        }
        if (parts.length == 2) {
            return new KeyDescriptor(parts[0], parts[1]);
        }
        throw new IllegalArgumentException("Unrecognized key string: " + text);
    }

    /**
     * Tonic spelled with {@code b}/{@code #} and capitalized, e.g. {@code "E-"} becomes {@code "Eb"}.
     */
    public String tonicName() {
        String t = tonic.replace("-", "b").replace("+", "#");
        return t.substring(0, 1).toUpperCase(Locale.ROOT) + t.substring(1);
    }

    /**
     * Display form {@code "<Tonic> <mode>"}, e.g. {@code "Eb major"}.
     */
    public String displayName() {
        return tonicName() + " " + mode;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
