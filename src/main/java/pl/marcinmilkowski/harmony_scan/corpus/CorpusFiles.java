package pl.marcinmilkowski.harmony_scan.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates corpus files: a single file, or every matching file below a directory,
 * sorted by file name (case-insensitive).
 */
public final class CorpusFiles {

    private CorpusFiles() {
    }

    /**
     * @param base       file or directory
     * @param extensions accepted extensions, lower case, with leading dot
     */
    public static List<Path> list(Path base, Set<String> extensions) throws IOException {
        if (Files.isRegularFile(base)) {
            return hasExtension(base, extensions) ? List.of(base) : List.of();
        }
        if (!Files.isDirectory(base)) {
            throw new IOException("Corpus path not found: " + base);
        }
        try (Stream<Path> walk = Files.walk(base)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> hasExtension(p, extensions))
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString().toLowerCase(Locale.ROOT))
                    .thenComparing(Path::toString))
                .collect(Collectors.toList());
        }
    }

    /**
     * File name without its extension.
     */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean hasExtension(Path path, Set<String> extensions) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
