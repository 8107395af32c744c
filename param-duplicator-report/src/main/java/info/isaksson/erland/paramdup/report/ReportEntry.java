package info.isaksson.erland.paramdup.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One duplicated parameter. */
@JsonPropertyOrder({"line", "declaringType", "declaration", "kind", "parameterType", "originalParameter", "addedParameter"})
public final class ReportEntry {
    public final int line;
    public final String declaringType;
    public final String declaration;
    /** METHOD or CONSTRUCTOR. */
    public final String kind;
    public final String parameterType;
    public final String originalParameter;
    public final String addedParameter;

    @JsonCreator
    public ReportEntry(
            @JsonProperty("line") int line,
            @JsonProperty("declaringType") String declaringType,
            @JsonProperty("declaration") String declaration,
            @JsonProperty("kind") String kind,
            @JsonProperty("parameterType") String parameterType,
            @JsonProperty("originalParameter") String originalParameter,
            @JsonProperty("addedParameter") String addedParameter
    ) {
        this.line = line;
        this.declaringType = declaringType == null ? "" : declaringType;
        this.declaration = declaration;
        this.kind = kind == null ? "METHOD" : kind;
        this.parameterType = parameterType == null ? "" : parameterType;
        this.originalParameter = originalParameter;
        this.addedParameter = addedParameter;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportEntry)) return false;
        ReportEntry that = (ReportEntry) o;
        return line == that.line &&
                Objects.equals(declaringType, that.declaringType) &&
                Objects.equals(declaration, that.declaration) &&
                Objects.equals(kind, that.kind) &&
                Objects.equals(parameterType, that.parameterType) &&
                Objects.equals(originalParameter, that.originalParameter) &&
                Objects.equals(addedParameter, that.addedParameter);
    }

    @Override public int hashCode() {
        return Objects.hash(line, declaringType, declaration, kind, parameterType, originalParameter, addedParameter);
    }
}
