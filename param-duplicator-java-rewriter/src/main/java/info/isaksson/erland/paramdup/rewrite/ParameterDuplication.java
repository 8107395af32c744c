package info.isaksson.erland.paramdup.rewrite;

import java.util.Objects;

/**
 * One rewritten declaration: its sole parameter was duplicated under a new name.
 */
public final class ParameterDuplication {
    /** Simple name of the nearest enclosing type, or empty when there is none. */
    public final String declaringType;

    /** Method or constructor name. */
    public final String declaration;

    public final DeclarationKind kind;

    /** 1-based source line of the declaration, or 0 when the position is unknown. */
    public final int line;

    public final String originalParameter;
    public final String addedParameter;

    /** Parameter type as written in the source (including a trailing {@code ...} for varargs). */
    public final String parameterType;

    public ParameterDuplication(String declaringType,
                                String declaration,
                                DeclarationKind kind,
                                int line,
                                String originalParameter,
                                String addedParameter,
                                String parameterType) {
        this.declaringType = Objects.requireNonNullElse(declaringType, "");
        this.declaration = Objects.requireNonNull(declaration, "declaration must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.line = Math.max(0, line);
        this.originalParameter = Objects.requireNonNull(originalParameter, "originalParameter must not be null");
        this.addedParameter = Objects.requireNonNull(addedParameter, "addedParameter must not be null");
        this.parameterType = Objects.requireNonNullElse(parameterType, "");
    }

    /** Human-readable one-liner used by console output. */
    public String describe() {
        return "Duplicated parameter '" + originalParameter + "' as '" + addedParameter + "' in "
                + (kind == DeclarationKind.CONSTRUCTOR ? "constructor" : "method")
                + " '" + declaration + "'";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterDuplication)) return false;
        ParameterDuplication that = (ParameterDuplication) o;
        return line == that.line
                && kind == that.kind
                && Objects.equals(declaringType, that.declaringType)
                && Objects.equals(declaration, that.declaration)
                && Objects.equals(originalParameter, that.originalParameter)
                && Objects.equals(addedParameter, that.addedParameter)
                && Objects.equals(parameterType, that.parameterType);
    }

    @Override public int hashCode() {
        return Objects.hash(declaringType, declaration, kind, line, originalParameter, addedParameter, parameterType);
    }

    @Override public String toString() {
        return declaringType + "." + declaration + ":" + line + " " + originalParameter + " -> " + addedParameter;
    }
}
