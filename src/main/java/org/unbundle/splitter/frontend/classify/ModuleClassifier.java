package org.unbundle.splitter.frontend.classify;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.frontend.idiom.BundlerIdiom;
import org.unbundle.splitter.frontend.idiom.IdiomMatcher;
import org.unbundle.splitter.js.JsToolchain;

/**
 * Decides whether a lifted module body is CommonJS or an ES module.
 *
 * <p>A module is CommonJS if it assigns {@code module.exports} more than once, or assigns it
 * an object literal. The scan stops descending as soon as that is confirmed.</p>
 */
public final class ModuleClassifier {

    private final JsToolchain toolchain;
    private final IdiomMatcher matcher;

    public ModuleClassifier(JsToolchain toolchain, IdiomMatcher matcher) {
        this.toolchain = toolchain;
        this.matcher = matcher;
    }

    /**
     * Classifies a module.
     *
     * @param moduleScript The module's {@code SCRIPT} node.
     * @param diagnostics  The module's reporting scope; the verdict reason is reported at info level.
     * @return The module kind.
     */
    public ModuleKind classify(Node moduleScript, DiagnosticsEngine.Scope diagnostics) {
        Scan scan = new Scan();
        toolchain.traverse(moduleScript, scan);
        if (scan.reason != null) {
            diagnostics.info("{}, assuming CommonJS", scan.reason);
            return ModuleKind.COMMON_JS;
        }
        return ModuleKind.ESM;
    }

    private final class Scan extends NodeTraversal.AbstractPreOrderCallback {
        private int defaultExports;
        private String reason;

        @Override
        public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
            if (reason != null) {
                return false;
            }
            if (n.isAssign()
                    && matcher.match(n, t.getScope()) instanceof BundlerIdiom.DefaultExportAssignment assignment) {
                defaultExports++;
                if (defaultExports > 1) {
                    reason = "Multiple default exports found";
                } else if (assignment.value().isObjectLit()) {
                    reason = "Default export is an object";
                }
            }
            return reason == null;
        }
    }
}
