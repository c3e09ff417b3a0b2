package org.unbundle.splitter.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unbundle.splitter.ChunkSplitter;
import org.unbundle.splitter.SplitterOptions;
import org.unbundle.splitter.diagnostics.Diagnostic;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.unbundle.splitter.ChunkFixtures.chunk;
import static org.unbundle.splitter.ChunkFixtures.compact;

@Tag("unit")
class ScopeRenamerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @Test
    void importLocalIsRenamedEverywhere() {
        String source = module("const a = n(124).useMemo; function f() { return a(() => a); }");

        assertThat(source)
                .containsPattern("import \\{useMemo( as useMemo)?\\} from \"\\./124\";")
                .contains("return useMemo(() => useMemo);");
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void reservedImportNameGetsPrefix() {
        String source = module("const d = n(124).delete; d(1);");

        assertThat(source).contains("import {delete as _delete} from \"./124\";").contains("_delete(1);");
    }

    @Test
    void collisionWithModuleBindingKeepsAlias() {
        String source = module("const a = n(124).x; var x = 5; a(x);");

        assertThat(source).contains("import {x as a} from \"./124\";").contains("a(x);");
        assertThat(warnings()).containsExactly("Cannot rename local to match import, x is already bound");
    }

    @Test
    void collisionWithGlobalKeepsAlias() {
        String source = module("const a = n(124).window; window.foo = a;");

        assertThat(source).contains("import {window as a} from \"./124\";");
        assertThat(warnings()).containsExactly("Cannot rename local to match import, window is already bound");
    }

    @Test
    void collisionWithNestedBindingKeepsAlias() {
        String source = module("const a = n(124).b; function f(b) { return a + b; }");

        assertThat(source).contains("import {b as a} from \"./124\";").contains("return a + b;");
        assertThat(warnings()).hasSize(1);
    }

    @Test
    void shorthandPropertyIsExpandedOnRename() {
        String source = module("const a = n(124).x; var o = {a};");

        assertThat(source).containsPattern("var o = \\{a: ?x\\};");
    }

    @Test
    void exportLocalIsRenamedToExportedName() {
        String source = module("n.d(t, {render: () => b}); function b() { return b; }");

        assertThat(source)
                .containsPattern("export \\{render( as render)?\\};")
                .contains("function render() {return render;}");
    }

    @Test
    void reservedWordsAreRecognized() {
        assertThat(ReservedWords.isReserved("delete")).isTrue();
        assertThat(ReservedWords.isReserved("await")).isTrue();
        assertThat(ReservedWords.isReserved("useState")).isFalse();
        assertThat(ReservedWords.toBindingName("default")).isEqualTo("_default");
        assertThat(ReservedWords.toBindingName("render")).isEqualTo("render");
    }

    private String module(String body) {
        ChunkSplitter splitter = new ChunkSplitter(SplitterOptions.defaults(), diagnostics);
        return compact(splitter.split(chunk("{1: function (e, t, n) {" + body + "}}")).orElseThrow()
                .module("1").orElseThrow().sourceText());
    }

    private List<String> warnings() {
        return diagnostics.warnings().stream().map(Diagnostic::message).toList();
    }
}
