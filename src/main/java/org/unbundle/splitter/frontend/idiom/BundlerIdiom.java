package org.unbundle.splitter.frontend.idiom;

import com.google.javascript.rhino.Node;

/**
 * The closed set of webpack runtime idioms recognized inside a module body.
 */
public sealed interface BundlerIdiom
        permits BundlerIdiom.NoMatch, BundlerIdiom.ExportDefinition,
                BundlerIdiom.ModuleRequire, BundlerIdiom.DefaultExportAssignment {

    /** The node is not a recognized idiom. */
    record NoMatch() implements BundlerIdiom {
        static final NoMatch INSTANCE = new NoMatch();
    }

    /**
     * {@code require.d(exports, {...})}.
     *
     * @param call The {@code CALL} node. Its arguments are validated by the export rewriter.
     */
    record ExportDefinition(Node call) implements BundlerIdiom {}

    /**
     * {@code require(id)} or one of the chunk-load-then-require forms.
     *
     * @param expression The outermost matched expression, i.e. the node to replace.
     * @param rawModuleId The module id as written in the bundle.
     */
    record ModuleRequire(Node expression, String rawModuleId) implements BundlerIdiom {}

    /**
     * {@code module.exports = value}.
     *
     * @param assignment The {@code ASSIGN} node.
     * @param value      The assigned value.
     */
    record DefaultExportAssignment(Node assignment, Node value) implements BundlerIdiom {}

    static BundlerIdiom noMatch() {
        return NoMatch.INSTANCE;
    }
}
