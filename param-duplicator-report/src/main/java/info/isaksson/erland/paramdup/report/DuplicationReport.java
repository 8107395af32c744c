package info.isaksson.erland.paramdup.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Machine-readable summary of one param-duplicator run.
 *
 * <p>Written by {@link ReportJson}; list ordering is normalized by {@link ReportNormalizer}.</p>
 */
@JsonPropertyOrder({"schemaVersion", "input", "output", "totalDeclarationsModified", "parseErrors", "files"})
public final class DuplicationReport {

    public static final String SCHEMA_VERSION = "1";

    public final String schemaVersion;
    public final String input;
    public final String output;
    public final int totalDeclarationsModified;
    public final int parseErrors;
    public final List<ReportFile> files;

    @JsonCreator
    public DuplicationReport(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("input") String input,
            @JsonProperty("output") String output,
            @JsonProperty("totalDeclarationsModified") int totalDeclarationsModified,
            @JsonProperty("parseErrors") int parseErrors,
            @JsonProperty("files") List<ReportFile> files
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.input = input;
        this.output = output;
        this.totalDeclarationsModified = totalDeclarationsModified;
        this.parseErrors = parseErrors;
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DuplicationReport)) return false;
        DuplicationReport that = (DuplicationReport) o;
        return totalDeclarationsModified == that.totalDeclarationsModified &&
                parseErrors == that.parseErrors &&
                Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(input, that.input) &&
                Objects.equals(output, that.output) &&
                Objects.equals(files, that.files);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, input, output, totalDeclarationsModified, parseErrors, files);
    }
}
