package info.isaksson.erland.paramdup.core;

/**
 * Core (embeddable) options for a param-duplicator run.
 *
 * <p>Mirrors the CLI flags in structured form.</p>
 */
public final class ParamDuplicatorOptions {

    /** Also rewrite single-parameter constructors. Methods are always rewritten. */
    public boolean includeConstructors = false;

    /** Directory mode: include common test folders (src/test, test, ...). */
    public boolean includeTests = false;

    /** Directory mode: number of files rewritten concurrently. Values below 1 mean 1. */
    public int threads = Runtime.getRuntime().availableProcessors();
}
