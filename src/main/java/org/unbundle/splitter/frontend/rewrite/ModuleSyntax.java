package org.unbundle.splitter.frontend.rewrite;

import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import org.unbundle.splitter.api.ModuleId;

/**
 * Builders for the module syntax the rewriters emit.
 */
final class ModuleSyntax {

    private ModuleSyntax() {}

    /** The relative specifier a split module is imported by: {@code ./<id>}. */
    static String specifier(ModuleId moduleId) {
        return "./" + moduleId.value();
    }

    /** {@code require("./<id>")} */
    static Node requireCall(ModuleId moduleId) {
        return IR.call(IR.name("require"), IR.string(specifier(moduleId)));
    }

    /** {@code import("./<id>")} */
    static Node dynamicImport(ModuleId moduleId) {
        return new Node(Token.DYNAMIC_IMPORT, IR.string(specifier(moduleId)));
    }

    /** {@code await import("./<id>")} */
    static Node awaitImport(ModuleId moduleId) {
        return new Node(Token.AWAIT, dynamicImport(moduleId));
    }

    /** {@code import * as <local> from "./<id>";} */
    static Node importNamespace(String local, ModuleId moduleId) {
        return IR.importNode(IR.empty(), IR.importStar(local), IR.string(specifier(moduleId)));
    }

    /** {@code import { <imported> as <local> } from "./<id>";} */
    static Node importNamed(String imported, String local, ModuleId moduleId) {
        Node importSpec = new Node(Token.IMPORT_SPEC);
        importSpec.addChildToBack(IR.name(imported));
        importSpec.addChildToBack(IR.name(local));
        if (imported.equals(local)) {
            importSpec.putIntProp(Node.IS_SHORTHAND_PROPERTY, 1);
        }
        Node importSpecs = new Node(Token.IMPORT_SPECS);
        importSpecs.addChildToBack(importSpec);
        return new Node(Token.IMPORT, IR.empty(), importSpecs, IR.string(specifier(moduleId)));
    }

    /** {@code export { <local> as <exported> };} */
    static Node exportNamed(String local, String exported) {
        Node exportSpec = new Node(Token.EXPORT_SPEC);
        exportSpec.addChildToBack(IR.name(local));
        exportSpec.addChildToBack(IR.name(exported));
        if (local.equals(exported)) {
            exportSpec.putIntProp(Node.IS_SHORTHAND_PROPERTY, 1);
        }
        Node exportSpecs = new Node(Token.EXPORT_SPECS);
        exportSpecs.addChildToBack(exportSpec);
        return IR.export(exportSpecs);
    }

    /** {@code export default <value>;} */
    static Node exportDefault(Node value) {
        Node export = new Node(Token.EXPORT);
        export.putBooleanProp(Node.EXPORT_DEFAULT, true);
        export.addChildToFront(value);
        return export;
    }

    /** {@code module.exports} */
    static Node moduleExports() {
        return IR.getprop(IR.name("module"), "exports");
    }

    /** {@code void 0} */
    static Node undefinedValue() {
        return new Node(Token.VOID, IR.number(0));
    }
}
