package pl.marcinmilkowski.harmony_scan.chord;

import java.util.Locale;

/**
 * Output spelling of major 6/9 chords: {@code IV69} or {@code IV6/9}.
 */
public enum SixNineStyle {
    COMPACT("69"),
    SLASHED("6/9");

    private final String suffix;

    SixNineStyle(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Parse a configured style. Accepts the suffix itself ("69", "6/9") or the constant name.
     */
    public static SixNineStyle fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return COMPACT;
        }
        String v = value.trim();
        for (SixNineStyle style : values()) {
            if (style.suffix.equals(v) || style.name().equals(v.toUpperCase(Locale.ROOT))) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unknown 6/9 style: " + value + " (expected 69 or 6/9)");
    }
}
