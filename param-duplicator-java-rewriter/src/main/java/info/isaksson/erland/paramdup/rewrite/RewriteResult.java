package info.isaksson.erland.paramdup.rewrite;

import java.util.List;

/** Output of rewriting one unit of Java source text. */
public final class RewriteResult {
    /** Rewritten source text; identical to the input when nothing was modified. */
    public final String text;

    /** Records in traversal order; its size is the number of declarations modified. */
    public final List<ParameterDuplication> duplications;

    RewriteResult(String text, List<ParameterDuplication> duplications) {
        this.text = text;
        this.duplications = duplications == null ? List.of() : List.copyOf(duplications);
    }

    public int modifiedCount() {
        return duplications.size();
    }

    public boolean changed() {
        return !duplications.isEmpty();
    }
}
