package pl.marcinmilkowski.harmony_scan.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.harmony_scan.chord.SixNineStyle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads scanner configuration from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "six_nine_style": "69",                // or "6/9"
 *   "extensions": [".json"],
 *   "threads": 4,
 *   "presets": [
 *     {"id": "ii-V-I", "pattern": "ii-7 V7 I*", "description": "..."},
 *     ...
 *   ]
 * }
 *
 * Only "version" is required; other fields fall back to the built-in defaults.
 */
public class ScanConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ScanConfigLoader.class);

    public static final Path DEFAULT_CONFIG = Path.of("config/harmony-scan.json");

    static final List<String> DEFAULT_EXTENSIONS = List.of(".json");

    private final String version;
    private final SixNineStyle sixNineStyle;
    private final Set<String> extensions;
    private final int threads;
    private final List<PresetConfig> presets;
    private final Map<String, PresetConfig> presetsById;
    private final Path configPath;

    /**
     * Load configuration from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public ScanConfigLoader(Path configPath) throws IOException {
        this(parse(configPath), configPath);
    }

    private ScanConfigLoader(JSONObject root, Path configPath) {
        this.configPath = configPath;

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in scan config");
        }
        this.version = parsedVersion;

        this.sixNineStyle = SixNineStyle.fromConfig(root.getString("six_nine_style"));

        JSONArray extArray = root.getJSONArray("extensions");
        Set<String> loadedExtensions = new LinkedHashSet<>();
        if (extArray == null || extArray.isEmpty()) {
            loadedExtensions.addAll(DEFAULT_EXTENSIONS);
        } else {
            for (int i = 0; i < extArray.size(); i++) {
                String ext = extArray.getString(i);
                if (ext == null || ext.isBlank()) {
                    throw new IllegalArgumentException("Blank extension at index " + i);
                }
                ext = ext.trim().toLowerCase(Locale.ROOT);
                loadedExtensions.add(ext.startsWith(".") ? ext : "." + ext);
            }
        }
        this.extensions = Collections.unmodifiableSet(loadedExtensions);

        int parsedThreads = root.getIntValue("threads", 1);
        if (parsedThreads < 1) {
            throw new IllegalArgumentException("'threads' must be >= 1, got " + parsedThreads);
        }
        this.threads = parsedThreads;

        List<PresetConfig> loadedPresets = new ArrayList<>();
        Map<String, PresetConfig> loadedPresetsById = new LinkedHashMap<>();
        JSONArray presetsArray = root.getJSONArray("presets");
        if (presetsArray != null) {
            for (int i = 0; i < presetsArray.size(); i++) {
                JSONObject presetObj = presetsArray.getJSONObject(i);
                if (presetObj == null) {
                    throw new IllegalArgumentException("Invalid preset at index " + i);
                }
                String id = presetObj.getString("id");
                if (id == null || id.isBlank()) {
                    throw new IllegalArgumentException("Missing 'id' field for preset at index " + i);
                }
                String pattern = presetObj.getString("pattern");
                if (pattern == null || pattern.isBlank()) {
                    throw new IllegalArgumentException("Missing 'pattern' field for preset " + id);
                }
                if (loadedPresetsById.containsKey(id)) {
                    throw new IllegalArgumentException("Duplicate preset id: " + id);
                }
                PresetConfig preset = new PresetConfig(id, pattern.trim(), presetObj.getString("description"));
                loadedPresets.add(preset);
                loadedPresetsById.put(id, preset);
            }
        }
        this.presets = Collections.unmodifiableList(loadedPresets);
        this.presetsById = Collections.unmodifiableMap(loadedPresetsById);

        if (configPath != null) {
            logger.info("Loaded scan config version {}: {} extensions, {} presets from {}",
                version, extensions.size(), presets.size(), configPath);
        }
    }

    private static JSONObject parse(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Scan config file not found: " + configPath);
        }
        String content = Files.readString(configPath);
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid JSON in scan config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty scan config: " + configPath);
        }
        return root;
    }

    /**
     * Built-in configuration: compact 6/9, chord charts only, one thread, no presets.
     */
    public static ScanConfigLoader defaults() {
        JSONObject root = new JSONObject();
        root.put("version", "builtin");
        return new ScanConfigLoader(root, null);
    }

    /**
     * Load {@link #DEFAULT_CONFIG} when present, otherwise the built-in defaults.
     */
    public static ScanConfigLoader loadDefault() throws IOException {
        if (Files.exists(DEFAULT_CONFIG)) {
            return new ScanConfigLoader(DEFAULT_CONFIG);
        }
        logger.debug("No {} found, using built-in defaults", DEFAULT_CONFIG);
        return defaults();
    }

    public String getVersion() {
        return version;
    }

    public SixNineStyle getSixNineStyle() {
        return sixNineStyle;
    }

    /**
     * Corpus file extensions, lower case with leading dot.
     */
    public Set<String> getExtensions() {
        return extensions;
    }

    public int getThreads() {
        return threads;
    }

    public List<PresetConfig> getPresets() {
        return presets;
    }

    public Optional<PresetConfig> getPreset(String id) {
        return Optional.ofNullable(presetsById.get(id));
    }

    /**
     * Config file path, or null for the built-in defaults.
     */
    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Named pattern.
     */
    public record PresetConfig(String id, String pattern, String description) {
    }
}
