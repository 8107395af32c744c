package info.isaksson.erland.paramdup.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Result container for programmatic usage. */
public final class ParamDuplicatorResult {
    public final Path input;
    public final Path output;

    /** One outcome per processed file, sorted by relative path. */
    public final List<FileOutcome> files;

    ParamDuplicatorResult(Path input, Path output, List<FileOutcome> files) {
        this.input = input;
        this.output = output;
        List<FileOutcome> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(f -> f.relativePath));
        this.files = List.copyOf(sorted);
    }

    /** Declarations modified across all files. */
    public int totalModified() {
        return files.stream().mapToInt(FileOutcome::modifiedCount).sum();
    }

    public List<FileOutcome> parseFailures() {
        List<FileOutcome> out = new ArrayList<>();
        for (FileOutcome f : files) {
            if (f.failed()) out.add(f);
        }
        return out;
    }
}
