package info.isaksson.erland.paramdup.rewrite;

/** Kind of callable declaration whose parameter list was rewritten. */
public enum DeclarationKind {
    METHOD,
    CONSTRUCTOR
}
