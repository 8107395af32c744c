package info.isaksson.erland.paramdup.rewrite;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;

import java.nio.charset.StandardCharsets;

/**
 * Parses one unit of Java source, duplicates single parameters and prints it back.
 *
 * <p>The compilation unit is parsed with lexical preservation enabled, so every region the
 * rewriter does not touch is emitted exactly as it was read. The tree is private to each call;
 * the caller's text is never modified. Instances are safe to share between threads.</p>
 */
public final class JavaSourceRewriter {

    private final ParserConfiguration configuration;
    private final boolean includeConstructors;

    public JavaSourceRewriter() {
        this(false);
    }

    public JavaSourceRewriter(boolean includeConstructors) {
        this.includeConstructors = includeConstructors;
        this.configuration = new ParserConfiguration()
                .setCharacterEncoding(StandardCharsets.UTF_8)
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setLexicalPreservationEnabled(true);
    }

    /**
     * Rewrite {@code source}.
     *
     * @throws ParseProblemException if the text is not a syntactically valid compilation unit
     */
    public RewriteResult rewrite(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");

        CompilationUnit cu = parse(source);
        RewriteContext ctx = ParameterDuplicationRewriter.INSTANCE.rewrite(cu, new RewriteContext(includeConstructors));

        // Nothing changed: hand back the input itself rather than a re-print.
        if (ctx.modifiedCount() == 0) {
            return new RewriteResult(source, ctx.duplications());
        }
        return new RewriteResult(LexicalPreservingPrinter.print(cu), ctx.duplications());
    }

    private CompilationUnit parse(String source) {
        // JavaParser instances keep per-parse state, so each call gets its own.
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ParseProblemException(result.getProblems());
        }
        return result.getResult().get();
    }
}
