package webpackre.build;

import clojure.lang.IPersistentMap;
import com.google.common.collect.ImmutableMap;
import com.google.javascript.rhino.Node;
import org.junit.Test;
import webpackre.build.closure.ChunkDiagnostics;
import webpackre.build.closure.ErrorCollector;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.google.common.truth.Truth.assertThat;

public class ChunkSplitterTest {

    static final String CHUNK = "(self.webpackChunk_app = self.webpackChunk_app || []).push([[179], {\n"
            + "  10: function(e, t, n) {\n"
            + "    \"use strict\";\n"
            + "    n.r(t);\n"
            + "    n.d(t, { foo: () => bar });\n"
            + "    var r = n(20), o = n(30);\n"
            + "    var bar = r.x + o;\n"
            + "  },\n"
            + "  20: function(e) {\n"
            + "    e.exports = { x: 1 };\n"
            + "  },\n"
            + "  30: function(e, t, n) {\n"
            + "    n.d(t, { default: () => a });\n"
            + "    var a = n(9);\n"
            + "  },\n"
            + "  40: function(e, x) {\n"
            + "    x.y = 1;\n"
            + "  }\n"
            + "}]);\n"
            + "//# sourceMappingURL=179.js.map";

    static final String OTHER_CHUNK = "(self.webpackChunk_app = self.webpackChunk_app || []).push([[180], {\n"
            + "  50: function(e, t, n) { var a = n(9), b = n(10); }\n"
            + "}]);";

    @Test
    public void notAChunk() {
        assertThat(new ChunkSplitter().split("foo.js", "console.log(1);")).isNull();
    }

    @Test
    public void splitsModules() {
        ErrorCollector errors = new ErrorCollector();
        Chunk chunk = new ChunkSplitter().split("179.js", CHUNK, errors);

        assertThat(chunk).isNotNull();
        assertThat(chunk.getId()).isEqualTo("179");
        assertThat(chunk.getGlobalName()).isEqualTo("self.webpackChunk_app");
        // 40 uses another name for the exports slot
        assertThat(chunk.getModules().keySet()).containsExactly("10", "20", "30").inOrder();
        assertThat(errors.getDiagnostics(ChunkDiagnostics.PARAM_MISMATCH)).hasSize(1);

        ChunkModule module = chunk.getModules().get("10");
        assertThat(module.isCommonJs()).isFalse();
        assertThat(module.hasDefaultExport()).isFalse();
        assertThat(module.getImports()).containsExactly("20", "30").inOrder();

        assertThat(chunk.getModules().get("20").isCommonJs()).isTrue();
        assertThat(chunk.getModules().get("30").hasDefaultExport()).isTrue();
    }

    @Test
    public void importsFollowTheImportedModule() {
        Chunk chunk = new ChunkSplitter().split("179.js", CHUNK);

        Node script = chunk.getModules().get("10").getTree();
        // 20 is CommonJS with a default export, 30 defines default
        Node first = script.getSecondChild().getNext();
        assertThat(first.isImport()).isTrue();
        assertThat(first.getFirstChild().getString()).isEqualTo("r");
        assertThat(first.getLastChild().getString()).isEqualTo("./20");

        String source = chunk.getModules().get("20").getSource().replaceAll("\\s", "");
        assertThat(source).isEqualTo("module.exports={x:1};");

        String other = chunk.getModules().get("30").getSource().replaceAll("\\s", "");
        assertThat(other).contains("exportdefaulta;");
        assertThat(other).contains("import*asafrom\"./9\";");
    }

    @Test
    public void commonJsOutput() {
        Chunk chunk = new ChunkSplitter(new SplitOptions().setEsm(false)).split("179.js", CHUNK);

        String source = chunk.getModules().get("10").getSource().replaceAll("\\s", "");
        assertThat(source).contains("varr=require(\"./20\"),o=require(\"./30\");");
        assertThat(source).contains("Object.defineProperties(exports,");
        assertThat(source).doesNotContain("import");
    }

    @Test
    public void overrides() {
        SplitOptions options = new SplitOptions()
                .setOverride("20", ModuleOverride.absolute("lodash"))
                .setOverride("30", ModuleOverride.rename("lib/thirty"))
                .setOverride("10", ModuleOverride.variables(ImmutableMap.of(3, "value")));

        Chunk chunk = new ChunkSplitter(options).split("179.js", CHUNK);

        assertThat(chunk.getModules().keySet()).containsExactly("10", "lodash", "lib/thirty").inOrder();

        ChunkModule module = chunk.getModules().get("10");
        assertThat(module.getImports()).containsExactly("lodash", "lib/thirty").inOrder();
        String source = module.getSource().replaceAll("\\s", "");
        assertThat(source).contains("from\"lodash\"");
        assertThat(source).contains("from\"./lib/thirty\"");
        assertThat(module.getAnnotations()).isNotEmpty();
        assertThat(module.getAnnotations().get(2).name).isEqualTo("value");
    }

    @Test
    public void annotateVariables() {
        Chunk chunk = new ChunkSplitter(new SplitOptions().setAnnotateVariables(true)).split("179.js", CHUNK);

        assertThat(chunk.getModules().get("30").getAnnotations()).hasSize(1);
        assertThat(chunk.getModules().get("20").getAnnotations()).isEmpty();
        assertThat(new ChunkSplitter().split("179.js", CHUNK).getModules().get("30").getAnnotations()).isEmpty();
    }

    @Test
    public void annotatedSourceListsOrdinals() {
        String annotated = new ChunkSplitter(new SplitOptions().setAnnotateVariables(true))
                .split("179.js", CHUNK).getModules().get("30").getSource();
        String plain = new ChunkSplitter().split("179.js", CHUNK).getModules().get("30").getSource();

        assertThat(annotated).isNotEqualTo(plain);
        assertThat(annotated).startsWith("/*\n * bindings\n * #1 a at ");
        assertThat(annotated).endsWith(plain);
        assertThat(plain).doesNotContain("bindings");
    }

    @Test
    public void sharedGraphAcrossChunks() throws Exception {
        DependencyGraph graph = new DependencyGraph();
        ChunkSplitter splitter = new ChunkSplitter(new SplitOptions().setGraph(graph));

        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("179.js", CHUNK);
        sources.put("180.js", OTHER_CHUNK);
        sources.put("vendor.js", "var x = 1;");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        Map<String, Chunk> chunks;
        try {
            chunks = splitter.splitAll(sources, executor);
        } finally {
            executor.shutdown();
        }

        assertThat(chunks.keySet()).containsExactly("179.js", "180.js").inOrder();
        assertThat(graph.getUndeclaredModules()).containsExactly("9");
        assertThat(ChunkSplitter.findUndeclaredModules(chunks.values())).containsExactly("9");
        assertThat(graph.hasDependency("50", "10")).isTrue();
        assertThat(graph.getNode("10").getModule()).isSameInstanceAs(chunks.get("179.js").getModules().get("10"));
    }

    @Test
    public void asMap() {
        Chunk chunk = new ChunkSplitter().split("179.js", CHUNK);

        assertThat(chunk.asMap().valAt(Chunk.KW_ID)).isEqualTo("179");
        assertThat(((IPersistentMap) chunk.asMap().valAt(Chunk.KW_MODULES)).count()).isEqualTo(3);
        assertThat(chunk.getModules().get("20").asMap().valAt(ChunkModule.KW_COMMONJS)).isEqualTo(true);
        assertThat(Arrays.asList("179")).containsExactlyElementsIn(chunk.getBundleIds());
    }
}
