package org.unbundle.splitter.frontend.module;

import com.google.javascript.rhino.Node;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unbundle.splitter.api.ModuleId;
import org.unbundle.splitter.api.ModuleTransformation;
import org.unbundle.splitter.diagnostics.Diagnostic;
import org.unbundle.splitter.diagnostics.DiagnosticsEngine;
import org.unbundle.splitter.graph.ModuleGraph;
import org.unbundle.splitter.js.JsToolchain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModuleMapReaderTest {

    private static final int CHUNK_ID = 7;

    private final JsToolchain toolchain = new JsToolchain("chunk-7.js");
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final ModuleGraph graph = new ModuleGraph();

    @Test
    void locatesObjectLiteralInWrapper() {
        Node root = toolchain.parse("({1: function (e) {}}, 0)").orElseThrow();

        Optional<Node> map = ModuleMapReader.locateModuleMap(root);

        assertThat(map).isPresent();
        assertThat(map.get().isObjectLit()).isTrue();
        assertThat(map.get().getChildCount()).isEqualTo(1);
    }

    @Test
    void locatesObjectLiteralBeforeRuntimeCallback() {
        Node root = toolchain.parse("({1: function (e) {}}, function (r) {}, 0)").orElseThrow();

        assertThat(ModuleMapReader.locateModuleMap(root)).isPresent();
    }

    @Test
    void rejectsOtherShapes() {
        assertThat(ModuleMapReader.locateModuleMap(toolchain.parse("([1, 2], 0)").orElseThrow())).isEmpty();
        assertThat(ModuleMapReader.locateModuleMap(toolchain.parse("({}); 0;").orElseThrow())).isEmpty();
        assertThat(ModuleMapReader.locateModuleMap(toolchain.parse("var x = 1;").orElseThrow())).isEmpty();
    }

    @Test
    void readsValidEntry() {
        List<ModuleDescriptor> read = readAll("{5: function (e, t, n) { n(6); }}", Map.of());

        assertThat(read).hasSize(1);
        ModuleDescriptor descriptor = read.get(0);
        assertThat(descriptor.id()).isEqualTo(new ModuleId("5"));
        assertThat(descriptor.rawKey()).isEqualTo("5");
        assertThat(descriptor.factory().isFunction()).isTrue();
        assertThat(descriptor.body().isBlock()).isTrue();
        assertThat(graph.attributes(new ModuleId("5"))).containsEntry(ModuleGraph.CHUNK_ID, CHUNK_ID);
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void acceptsArrowFactoryWithBlockBody() {
        assertThat(readAll("{5: (e, t) => { t.x = 1; }}", Map.of())).hasSize(1);
    }

    @Test
    void appliesModuleRename() {
        List<ModuleDescriptor> read = readAll("{5: function (e) {}}",
                Map.of("5", ModuleTransformation.renameModule("lodash")));

        assertThat(read.get(0).id()).isEqualTo(new ModuleId("lodash"));
        assertThat(read.get(0).rawKey()).isEqualTo("5");
        assertThat(graph.hasNode(new ModuleId("lodash"))).isTrue();
        assertThat(graph.hasNode(new ModuleId("5"))).isFalse();
    }

    @Test
    void skipsFactoryWithTooManyParamsButKeepsSiblingsAndGraphNode() {
        List<ModuleDescriptor> read = readAll(
                "{1: function (e, t, n, r) {}, 2: function (e, t, n) {}}", Map.of());

        assertThat(read).extracting(ModuleDescriptor::rawKey).containsExactly("2");
        assertThat(warnings()).containsExactly("Too many chunk module function params: 4");
        assertThat(diagnostics.warnings().get(0).scope()).isEqualTo("chunk-7/module-1");
        assertThat(graph.attributes(new ModuleId("1"))).containsEntry(ModuleGraph.CHUNK_ID, CHUNK_ID);
    }

    @Test
    void reportsFusionModulesUnderTheirOwnScope() {
        List<ModuleDescriptor> read = readAll("{__fusion__3: function (e) {}, 4: function (e) {}}", Map.of());

        assertThat(read).extracting(ModuleDescriptor::rawKey).containsExactly("4");
        Diagnostic warning = diagnostics.warnings().get(0);
        assertThat(warning.scope()).isEqualTo("chunk-7/fusion-module-3");
        assertThat(warning.message()).isEqualTo("Fusion modules not implemented");
    }

    @Test
    void reportsInvalidEntries() {
        List<ModuleDescriptor> read = readAll("""
                {
                  "a-b": function (e) {},
                  abc: function (e) {},
                  3: 42,
                  4: function ({a}) {},
                  5: (e) => 1,
                  6() {}
                }""", Map.of());

        assertThat(read).isEmpty();
        assertThat(warnings()).containsExactly(
                "Invalid chunk module key: a-b",
                "Invalid chunk module key: abc",
                "Invalid chunk module value: NUMBER",
                "Invalid chunk module function param: OBJECT_PATTERN",
                "Invalid chunk module function body: NUMBER",
                "Chunk module is not an object property: COMPUTED_PROP");
    }

    @Test
    void rejectsFactoryWithConflictingParamNames() {
        List<ModuleDescriptor> read = readAll(
                "{1: function (e, t, n) {}, 2: function (a, t, n) {}, 3: function (e) {}}", Map.of());

        assertThat(read).extracting(ModuleDescriptor::rawKey).containsExactly("1", "3");
        assertThat(warnings()).containsExactly("Invalid chunk module function param: a (expected [e, t, n])");
    }

    private List<ModuleDescriptor> readAll(String moduleMap, Map<String, ModuleTransformation> transformations) {
        Node root = toolchain.parse("(" + moduleMap + ", 0)").orElseThrow();
        Node map = ModuleMapReader.locateModuleMap(root).orElseThrow();
        ModuleMapReader reader = new ModuleMapReader(CHUNK_ID, new ModuleResolver(transformations), graph,
                diagnostics.forChunk(CHUNK_ID));
        List<ModuleDescriptor> descriptors = new ArrayList<>();
        for (Node property = map.getFirstChild(); property != null; property = property.getNext()) {
            reader.read(property).ifPresent(descriptors::add);
        }
        return descriptors;
    }

    private List<String> warnings() {
        return diagnostics.warnings().stream().map(Diagnostic::message).toList();
    }
}
