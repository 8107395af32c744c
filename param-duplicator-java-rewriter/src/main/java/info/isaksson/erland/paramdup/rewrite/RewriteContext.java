package info.isaksson.erland.paramdup.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run accumulator handed to {@link ParameterDuplicationRewriter} as the visitor argument.
 *
 * <p>One instance belongs to one traversal; it is not thread-safe.</p>
 */
public final class RewriteContext {

    private final boolean includeConstructors;
    private final List<ParameterDuplication> duplications = new ArrayList<>();

    public RewriteContext() {
        this(false);
    }

    public RewriteContext(boolean includeConstructors) {
        this.includeConstructors = includeConstructors;
    }

    public boolean includeConstructors() {
        return includeConstructors;
    }

    void record(ParameterDuplication duplication) {
        duplications.add(duplication);
    }

    /** Number of declarations modified so far. */
    public int modifiedCount() {
        return duplications.size();
    }

    /** Duplications in traversal order. */
    public List<ParameterDuplication> duplications() {
        return Collections.unmodifiableList(duplications);
    }
}
