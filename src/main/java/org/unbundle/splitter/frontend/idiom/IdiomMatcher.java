package org.unbundle.splitter.frontend.idiom;

import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.jscomp.Scope;
import com.google.javascript.rhino.Node;
import org.unbundle.splitter.frontend.module.ModuleFunctionParams;

import java.util.Optional;

/**
 * Recognizes webpack runtime idioms on single nodes of a module tree.
 *
 * <p>The runtime is reached through the factory parameters fixed in the chunk's
 * {@link ModuleFunctionParams}. After a module body has been lifted out of its factory those
 * parameters are free names, so any binding of the same name in scope at the match site
 * means the code refers to something else, and the node is not matched.</p>
 */
public final class IdiomMatcher {

    private static final String DEFINE_EXPORTS = "d";
    private static final String EXPORTS = "exports";
    private static final String THEN = "then";
    private static final String BIND = "bind";

    private final ModuleFunctionParams params;

    public IdiomMatcher(ModuleFunctionParams params) {
        this.params = params;
    }

    /**
     * Matches a node against every idiom.
     *
     * @param n     The candidate node.
     * @param scope The scope in effect at {@code n}.
     * @return The match, or {@link BundlerIdiom.NoMatch}.
     */
    public BundlerIdiom match(Node n, Scope scope) {
        if (n.isCall()) {
            if (isExportDefinition(n, scope)) {
                return new BundlerIdiom.ExportDefinition(n);
            }
            Optional<String> moduleId = matchModuleRequire(n, scope);
            if (moduleId.isPresent()) {
                return new BundlerIdiom.ModuleRequire(n, moduleId.get());
            }
        } else if (n.isAssign()) {
            Node target = n.getFirstChild();
            if (target.isGetProp() && EXPORTS.equals(target.getString())
                    && isRuntimeName(target.getFirstChild(), params.module(), scope)) {
                return new BundlerIdiom.DefaultExportAssignment(n, n.getLastChild());
            }
        }
        return BundlerIdiom.noMatch();
    }

    /**
     * Matches {@code require(id)}, {@code x.then(() => require(id))},
     * {@code x.then(function () { return require(id); })} and
     * {@code x.then(require.bind(require, id))}.
     *
     * @return The raw module id, or empty.
     */
    public Optional<String> matchModuleRequire(Node call, Scope scope) {
        if (!call.isCall()) {
            return Optional.empty();
        }
        Optional<String> direct = matchRequireCall(call, scope);
        if (direct.isPresent()) {
            return direct;
        }

        Node callee = call.getFirstChild();
        if (!callee.isGetProp() || !THEN.equals(callee.getString()) || !call.hasTwoChildren()) {
            return Optional.empty();
        }
        Node callback = call.getLastChild();
        if (callback.isFunction()) {
            return matchLoaderCallback(callback, scope);
        }
        if (callback.isCall()) {
            return matchBoundRequire(callback, scope);
        }
        return Optional.empty();
    }

    private boolean isExportDefinition(Node call, Scope scope) {
        Node callee = call.getFirstChild();
        return callee.isGetProp()
                && DEFINE_EXPORTS.equals(callee.getString())
                && isRuntimeName(callee.getFirstChild(), params.require(), scope);
    }

    private Optional<String> matchRequireCall(Node call, Scope scope) {
        if (!call.hasTwoChildren() || !isRuntimeName(call.getFirstChild(), params.require(), scope)) {
            return Optional.empty();
        }
        return literalModuleId(call.getLastChild());
    }

    // () => require(id), function () { return require(id); }
    private Optional<String> matchLoaderCallback(Node function, Scope scope) {
        String requireName = params.require().orElse(null);
        if (requireName == null || declaresParam(function, requireName)) {
            return Optional.empty();
        }
        Node body = NodeUtil.getFunctionBody(function);
        Node result;
        if (body.isBlock()) {
            if (!body.hasOneChild() || !body.getFirstChild().isReturn() || !body.getFirstChild().hasChildren()) {
                return Optional.empty();
            }
            result = body.getFirstChild().getFirstChild();
        } else {
            result = body;
        }
        return result.isCall() ? matchRequireCall(result, scope) : Optional.empty();
    }

    // require.bind(require, id)
    private Optional<String> matchBoundRequire(Node bindCall, Scope scope) {
        Node callee = bindCall.getFirstChild();
        if (!callee.isGetProp() || !BIND.equals(callee.getString())
                || !isRuntimeName(callee.getFirstChild(), params.require(), scope)
                || bindCall.getChildCount() != 3) {
            return Optional.empty();
        }
        Node receiver = callee.getNext();
        if (!isRuntimeName(receiver, params.require(), scope)) {
            return Optional.empty();
        }
        return literalModuleId(receiver.getNext());
    }

    private static boolean declaresParam(Node function, String name) {
        for (Node param = NodeUtil.getFunctionParameters(function).getFirstChild();
             param != null; param = param.getNext()) {
            if (param.isName() && name.equals(param.getString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isRuntimeName(Node n, Optional<String> runtimeName, Scope scope) {
        return n != null
                && n.isName()
                && runtimeName.isPresent()
                && runtimeName.get().equals(n.getString())
                && scope.getVar(n.getString()) == null;
    }

    /**
     * Renders a numeric or string literal module id as text.
     */
    static Optional<String> literalModuleId(Node n) {
        if (n.isStringLit()) {
            return Optional.of(n.getString());
        }
        if (n.isNumber()) {
            double value = n.getDouble();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return Optional.of(Long.toString((long) value));
            }
            return Optional.of(Double.toString(value));
        }
        return Optional.empty();
    }
}
