package info.isaksson.erland.paramdup.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Outcome for one source file of a run. */
@JsonPropertyOrder({"path", "declarationsModified", "parseError", "duplications"})
public final class ReportFile {
    /** Path relative to the run input ('/' separators); the file name in single-file mode. */
    public final String path;
    public final int declarationsModified;

    /** Parser diagnostic when the file could not be rewritten; absent otherwise. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String parseError;

    public final List<ReportEntry> duplications;

    @JsonCreator
    public ReportFile(
            @JsonProperty("path") String path,
            @JsonProperty("declarationsModified") int declarationsModified,
            @JsonProperty("parseError") String parseError,
            @JsonProperty("duplications") List<ReportEntry> duplications
    ) {
        this.path = path;
        this.declarationsModified = declarationsModified;
        this.parseError = parseError;
        this.duplications = duplications == null ? List.of() : List.copyOf(duplications);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportFile)) return false;
        ReportFile that = (ReportFile) o;
        return declarationsModified == that.declarationsModified &&
                Objects.equals(path, that.path) &&
                Objects.equals(parseError, that.parseError) &&
                Objects.equals(duplications, that.duplications);
    }

    @Override public int hashCode() {
        return Objects.hash(path, declarationsModified, parseError, duplications);
    }
}
