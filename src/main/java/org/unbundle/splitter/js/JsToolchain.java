package org.unbundle.splitter.js;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JsAst;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.Optional;

/**
 * Parse and print capability backed by the Closure Compiler.
 *
 * <p>One toolchain owns one {@link Compiler}, which is not thread-safe, so a toolchain must
 * only be used by the thread splitting a single chunk. Parse errors are counted per
 * {@link #parse} call.</p>
 */
public final class JsToolchain {

    private final Compiler compiler;
    private final String sourceName;

    /**
     * Creates a toolchain for one chunk.
     *
     * @param sourceName Logical file name used for parser error messages.
     */
    public JsToolchain(String sourceName) {
        this.sourceName = sourceName;
        this.compiler = new Compiler();
        this.compiler.initOptions(createOptions());
    }

    private static CompilerOptions createOptions() {
        CompilerOptions options = new CompilerOptions();
        options.setLanguageIn(CompilerOptions.LanguageMode.ECMASCRIPT_NEXT);
        options.setLanguageOut(CompilerOptions.LanguageMode.NO_TRANSPILE);
        options.setEmitUseStrict(false);
        options.setPrettyPrint(true);
        options.setPreserveNonJSDocComments(true);
        return options;
    }

    /**
     * Parses source text into a {@code SCRIPT} node.
     *
     * @param source The JavaScript source.
     * @return The script root, or empty if the parser reported errors.
     */
    public Optional<Node> parse(String source) {
        int errorsBefore = compiler.getErrorCount();
        Node root = new JsAst(SourceFile.fromCode(sourceName, source)).getAstRoot(compiler);
        if (root == null || compiler.getErrorCount() > errorsBefore) {
            return Optional.empty();
        }
        return Optional.of(root);
    }

    /**
     * Creates an ES module script ({@code SCRIPT > MODULE_BODY}) that takes ownership of the
     * given statements, detaching them from their current parent.
     *
     * @param template   The parsed chunk root, used for source-file bookkeeping.
     * @param statements The first statement to move; it and all its following siblings move.
     * @return The new script node.
     */
    public Node newModuleScript(Node template, Node statements) {
        Node script = IR.script();
        script.setStaticSourceFile(template.getStaticSourceFile());
        script.setInputId(template.getInputId());
        Node moduleBody = new Node(Token.MODULE_BODY);
        moduleBody.srcref(template);
        Node statement = statements;
        while (statement != null) {
            Node next = statement.getNext();
            moduleBody.addChildToBack(statement.detach());
            statement = next;
        }
        script.addChildToBack(moduleBody);
        return script;
    }

    /**
     * Pretty-prints a tree back to source text.
     */
    public String print(Node node) {
        return compiler.toSource(node);
    }

    /**
     * Runs a traversal callback over a tree using the Closure scope creator.
     */
    public void traverse(Node root, NodeTraversal.Callback callback) {
        NodeTraversal.traverse(compiler, root, callback);
    }
}
