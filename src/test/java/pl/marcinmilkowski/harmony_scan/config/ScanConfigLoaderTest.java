package pl.marcinmilkowski.harmony_scan.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.harmony_scan.chord.SixNineStyle;
import pl.marcinmilkowski.harmony_scan.grammar.PatternParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScanConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String json) throws IOException {
        return Files.writeString(tempDir.resolve("config.json"), json);
    }

    @Test
    @DisplayName("Load test configuration")
    void loadConfig() throws Exception {
        Path path = Path.of(ScanConfigLoaderTest.class.getResource("/test-config.json").toURI());
        ScanConfigLoader config = new ScanConfigLoader(path);

        assertEquals("test-1", config.getVersion());
        assertEquals(SixNineStyle.SLASHED, config.getSixNineStyle());
        assertEquals(Set.of(".json", ".chart"), config.getExtensions());
        assertEquals(2, config.getThreads());
        assertEquals(2, config.getPresets().size());
        assertEquals("iv-7 bVII7 I*", config.getPreset("backdoor").orElseThrow().pattern());
        assertNull(config.getPreset("backdoor").orElseThrow().description());
        assertTrue(config.getPreset("missing").isEmpty());
        assertEquals(path, config.getConfigPath());
    }

    @Test
    @DisplayName("Built-in defaults")
    void defaults() {
        ScanConfigLoader config = ScanConfigLoader.defaults();

        assertEquals(SixNineStyle.COMPACT, config.getSixNineStyle());
        assertEquals(Set.of(".json"), config.getExtensions());
        assertEquals(1, config.getThreads());
        assertTrue(config.getPresets().isEmpty());
        assertNull(config.getConfigPath());
    }

    @Test
    @DisplayName("Shipped configuration loads and its presets compile")
    void shippedConfig() throws IOException {
        ScanConfigLoader config = new ScanConfigLoader(ScanConfigLoader.DEFAULT_CONFIG);
        PatternParser parser = new PatternParser(config.getSixNineStyle());

        assertFalse(config.getPresets().isEmpty());
        for (ScanConfigLoader.PresetConfig preset : config.getPresets()) {
            assertFalse(parser.parse(preset.pattern()).isEmpty(), preset.id());
        }
    }

    @Test
    void optionalFieldsDefault() throws IOException {
        ScanConfigLoader config = new ScanConfigLoader(write("{\"version\": \"2\"}"));
        assertEquals(SixNineStyle.COMPACT, config.getSixNineStyle());
        assertEquals(List.copyOf(ScanConfigLoader.DEFAULT_EXTENSIONS), List.copyOf(config.getExtensions()));
        assertEquals(1, config.getThreads());
    }

    @Test
    void invalidConfigurations() throws IOException {
        Path noVersion = write("{\"threads\": 2}");
        assertThrows(IllegalArgumentException.class, () -> new ScanConfigLoader(noVersion));

        Path zeroThreads = write("{\"version\": \"1\", \"threads\": 0}");
        assertThrows(IllegalArgumentException.class, () -> new ScanConfigLoader(zeroThreads));

        Path badStyle = write("{\"version\": \"1\", \"six_nine_style\": \"6-9\"}");
        assertThrows(IllegalArgumentException.class, () -> new ScanConfigLoader(badStyle));

        Path duplicate = write("{\"version\": \"1\", \"presets\": ["
            + "{\"id\": \"a\", \"pattern\": \"I\"}, {\"id\": \"a\", \"pattern\": \"V7\"}]}");
        assertThrows(IllegalArgumentException.class, () -> new ScanConfigLoader(duplicate));

        Path noPattern = write("{\"version\": \"1\", \"presets\": [{\"id\": \"a\"}]}");
        assertThrows(IllegalArgumentException.class, () -> new ScanConfigLoader(noPattern));

        Path notJson = write("{ version");
        assertThrows(IllegalArgumentException.class, () -> new ScanConfigLoader(notJson));
    }

    @Test
    void missingFile() {
        assertThrows(IOException.class, () -> new ScanConfigLoader(tempDir.resolve("absent.json")));
    }
}
