package info.isaksson.erland.paramdup.core;

import info.isaksson.erland.paramdup.rewrite.ParameterDuplication;

import java.util.List;

/** Result of rewriting one source file. */
public final class FileOutcome {
    /** Path relative to the run input ('/' separators); the file name in single-file mode. */
    public final String relativePath;

    public final List<ParameterDuplication> duplications;

    /** Parser diagnostic when the file was copied unchanged because it could not be parsed; else null. */
    public final String parseError;

    FileOutcome(String relativePath, List<ParameterDuplication> duplications, String parseError) {
        this.relativePath = relativePath;
        this.duplications = duplications == null ? List.of() : List.copyOf(duplications);
        this.parseError = parseError;
    }

    public int modifiedCount() {
        return duplications.size();
    }

    public boolean failed() {
        return parseError != null;
    }
}
