package info.isaksson.erland.paramdup.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the .java files to rewrite under an input directory.
 *
 * <p>The returned list is sorted by relative path, so runs over the same tree visit files
 * in the same order.</p>
 */
public final class SourceScanner {

    private static final List<String> BUILD_DIRS = List.of(
            "target/", "build/", "out/", ".git/", ".idea/", ".gradle/", "node_modules/"
    );

    private SourceScanner() {}

    public static List<Path> scan(Path inputRoot, List<String> excludeGlobs, boolean includeTests) throws IOException {
        return scan(inputRoot, excludeGlobs, includeTests, null);
    }

    /**
     * Scan for .java files under {@code inputRoot}.
     *
     * @param excludeGlobs glob patterns matched against the path relative to {@code inputRoot} ('/' separators)
     * @param includeTests whether to include common test folders (src/test, test, ...)
     * @param skipDir a directory to leave out entirely (typically the output root when it is nested
     *                inside the input root); may be null
     */
    public static List<Path> scan(Path inputRoot, List<String> excludeGlobs, boolean includeTests, Path skipDir) throws IOException {
        Objects.requireNonNull(inputRoot, "inputRoot");
        final Path root = inputRoot.toAbsolutePath().normalize();
        final Path skip = skipDir == null ? null : skipDir.toAbsolutePath().normalize();
        final List<PathMatcher> excludes = compileExcludes(excludeGlobs);

        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .filter(p -> skip == null || skip.equals(root) || !p.startsWith(skip))
                    .filter(p -> includeTests || !isTestPath(relativePath(root, p)))
                    .filter(p -> !isBuildOutput(relativePath(root, p)))
                    .filter(p -> !isExcluded(root.relativize(p), excludes))
                    .sorted(Comparator.comparing(p -> relativePath(root, p)))
                    .collect(Collectors.toList());
        }
    }

    /** Path of {@code file} relative to {@code root}, always with '/' separators. */
    public static String relativePath(Path root, Path file) {
        Path r = root.toAbsolutePath().normalize();
        Path f = file.toAbsolutePath().normalize();
        return r.relativize(f).toString().replace('\\', '/');
    }

    private static List<PathMatcher> compileExcludes(List<String> globs) {
        if (globs == null || globs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<PathMatcher> out = new ArrayList<>();
        for (String raw : globs) {
            if (raw == null || raw.isBlank()) continue;
            String pattern = raw.trim().replace('\\', '/');
            // A plain directory name excludes everything below it.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith(".java")) {
                pattern = (pattern.endsWith("/") ? pattern : pattern + "/") + "**";
            }
            out.add(fs.getPathMatcher("glob:" + pattern));
        }
        return out;
    }

    private static boolean isExcluded(Path relative, List<PathMatcher> excludes) {
        if (excludes.isEmpty()) return false;
        Path normalized = Path.of(relative.toString().replace('\\', '/'));
        for (PathMatcher m : excludes) {
            if (m.matches(normalized)) return true;
        }
        return false;
    }

    private static boolean isTestPath(String rel) {
        return rel.startsWith("src/test/")
                || rel.startsWith("src/it/")
                || rel.startsWith("test/")
                || rel.contains("/test/")
                || rel.contains("/tests/");
    }

    private static boolean isBuildOutput(String rel) {
        for (String dir : BUILD_DIRS) {
            if (rel.startsWith(dir)) return true;
        }
        return false;
    }
}
