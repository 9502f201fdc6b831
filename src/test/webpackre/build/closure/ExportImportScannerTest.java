package webpackre.build.closure;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.rhino.Node;
import org.junit.Before;
import org.junit.Test;

import static com.google.common.truth.Truth.assertThat;
import static webpackre.build.closure.ModuleFixtures.PARAMS;
import static webpackre.build.closure.ModuleFixtures.parse;

public class ExportImportScannerTest {

    ErrorCollector errors;
    Compiler cc;

    @Before
    public void setUp() {
        errors = new ErrorCollector();
        cc = ParserHelper.createCompiler(errors);
    }

    ScanResult scan(String code) {
        return ExportImportScanner.scan(cc, parse(cc, code), PARAMS, "1", "10");
    }

    @Test
    public void singleDefaultExport() {
        ScanResult result = scan("e.exports = function () { return 1; };");
        assertThat(result.isCommonJs()).isFalse();
        assertThat(result.hasDefaultExport()).isTrue();
    }

    @Test
    public void objectDefaultExportIsCommonJs() {
        ScanResult result = scan("e.exports = { a: 1 };");
        assertThat(result.isCommonJs()).isTrue();
        assertThat(result.hasDefaultExport()).isTrue();
    }

    @Test
    public void secondDefaultExportIsCommonJs() {
        ScanResult result = scan("e.exports = 1;\nif (x) { e.exports = 2; }");
        assertThat(result.isCommonJs()).isTrue();
    }

    @Test
    public void definerDefaultNextToModuleExportsIsCommonJs() {
        ScanResult result = scan("n.d(t, { default: () => u });\nvar u = 1;\ne.exports = 7;");
        assertThat(result.isCommonJs()).isTrue();
        assertThat(result.hasDefaultExport()).isTrue();
    }

    @Test
    public void definerDefaultAloneStaysEsm() {
        ScanResult result = scan("n.d(t, { default: () => u });\nvar u = 1;");
        assertThat(result.isCommonJs()).isFalse();
        assertThat(result.hasDefaultExport()).isTrue();
    }

    @Test
    public void compoundAssignmentIsNoExport() {
        ScanResult result = scan("e.exports += 1;");
        assertThat(result.hasDefaultExport()).isFalse();
        assertThat(result.isCommonJs()).isFalse();
        assertThat(errors.hasDiagnostic(ChunkDiagnostics.INVALID_DEFAULT_EXPORT_OPERATOR)).isTrue();
    }

    @Test
    public void shadowedModuleIsNoExport() {
        ScanResult result = scan("function f(e) { e.exports = 1; }");
        assertThat(result.hasDefaultExport()).isFalse();
    }

    @Test
    public void definerWithDefault() {
        assertThat(scan("n.d(t, { default: () => a, b: () => c });").hasDefaultExport()).isTrue();
        assertThat(scan("n.d(t, \"default\", function () { return a; });").hasDefaultExport()).isTrue();
        assertThat(scan("n.d(t, { b: () => c });").hasDefaultExport()).isFalse();
    }

    @Test
    public void referencesInOrderOfFirstUse() {
        ScanResult result = scan(
                "var a = n(5);\n"
                        + "var b = n(\"./src/b.js\").foo;\n"
                        + "function f() { return n(7) + n(5); }\n"
                        + "n(9);");

        assertThat(result.getReferences()).containsExactly("5", "./src/b.js", "7", "9").inOrder();
    }

    @Test
    public void shadowedRequireIsNoReference() {
        ScanResult result = scan("function f(n) { return n(5); }\nvar x = n(6);");
        assertThat(result.getReferences()).containsExactly("6");
    }

    @Test
    public void invalidRequireArguments() {
        ScanResult result = scan("n(a);\nn(1, 2);\nn();");
        assertThat(result.getReferences()).isEmpty();
        assertThat(errors.getDiagnostics(ChunkDiagnostics.INVALID_IMPORT_ARGUMENT)).hasSize(1);
        assertThat(errors.getDiagnostics(ChunkDiagnostics.INVALID_IMPORT_ARGUMENTS)).hasSize(2);
    }

    @Test
    public void classificationSurvivesRewrite() {
        String code = "n.r(t);\n"
                + "n.d(t, { foo: () => bar });\n"
                + "var r = n(5);\n"
                + "var bar = r.x + 1;";

        ScanResult before = scan(code);
        assertThat(before.isCommonJs()).isFalse();
        assertThat(before.hasDefaultExport()).isFalse();

        Node script = parse(cc, code);
        RewriteContext context = new RewriteContext("1", "10", PARAMS, true, key -> new ImportTarget("./" + key, false));
        ModuleRewriter.rewrite(cc, script, context);
        String rewritten = ParserHelper.toSource(cc, script);

        Node reparsed = ParserHelper.parse(cc, "rewritten.js", rewritten);
        assertThat(reparsed).isNotNull();

        ScanResult after = ExportImportScanner.scan(cc, reparsed, PARAMS, "1", "10");
        assertThat(after.isCommonJs()).isEqualTo(before.isCommonJs());
        assertThat(after.hasDefaultExport()).isEqualTo(before.hasDefaultExport());
    }
}
