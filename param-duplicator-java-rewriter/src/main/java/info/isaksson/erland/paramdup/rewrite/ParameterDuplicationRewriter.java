package info.isaksson.erland.paramdup.rewrite;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Duplicates the sole parameter of every single-parameter method (and optionally constructor).
 *
 * <p>The traversal is the depth-first walk of {@link ModifierVisitor}, so declarations inside
 * nested, local and anonymous classes are visited too. Declarations with zero or several
 * parameters are returned untouched. For an eligible declaration the original parameter stays
 * first and a clone with a name from {@link NameSuggester} is appended.</p>
 *
 * <p>The visitor holds no state; counts and records go to the {@link RewriteContext} argument.</p>
 */
public final class ParameterDuplicationRewriter extends ModifierVisitor<RewriteContext> {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterDuplicationRewriter.class);

    public static final ParameterDuplicationRewriter INSTANCE = new ParameterDuplicationRewriter();

    /**
     * Rewrite all eligible declarations under {@code root}.
     *
     * @return {@code ctx}, for chaining
     */
    public RewriteContext rewrite(Node root, RewriteContext ctx) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");
        root.accept(this, ctx);
        return ctx;
    }

    @Override
    public Visitable visit(MethodDeclaration n, RewriteContext ctx) {
        MethodDeclaration md = (MethodDeclaration) super.visit(n, ctx);
        duplicateSoleParameter(md, DeclarationKind.METHOD, ctx);
        return md;
    }

    @Override
    public Visitable visit(ConstructorDeclaration n, RewriteContext ctx) {
        ConstructorDeclaration cd = (ConstructorDeclaration) super.visit(n, ctx);
        if (ctx.includeConstructors()) {
            duplicateSoleParameter(cd, DeclarationKind.CONSTRUCTOR, ctx);
        }
        return cd;
    }

    private static void duplicateSoleParameter(CallableDeclaration<?> declaration, DeclarationKind kind, RewriteContext ctx) {
        NodeList<Parameter> params = declaration.getParameters();
        if (params.size() != 1) return;

        Parameter original = params.get(0);
        String originalName = original.getNameAsString();
        String addedName = NameSuggester.suggest(originalName);

        // Same type, modifiers, annotations and varargs marker; comments stay with the original.
        Parameter duplicate = original.clone();
        duplicate.removeComment();
        // The clone carries the original's preserved text; drop it so the printer renders the new node.
        duplicate.walk(n -> n.removeData(LexicalPreservingPrinter.NODE_TEXT_DATA));
        duplicate.setName(addedName);
        declaration.addParameter(duplicate);

        ParameterDuplication record = new ParameterDuplication(
                declaringTypeOf(declaration),
                declaration.getNameAsString(),
                kind,
                declaration.getName().getBegin().map(p -> p.line).orElse(0),
                originalName,
                addedName,
                typeText(original)
        );
        ctx.record(record);
        LOG.debug("{} (line {})", record.describe(), record.line);
    }

    private static String declaringTypeOf(CallableDeclaration<?> declaration) {
        return declaration.findAncestor(TypeDeclaration.class)
                .map(td -> ((TypeDeclaration<?>) td).getNameAsString())
                .orElse("");
    }

    private static String typeText(Parameter p) {
        String t = p.getType().asString();
        return p.isVarArgs() ? t + "..." : t;
    }
}
