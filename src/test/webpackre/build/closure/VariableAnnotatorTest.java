package webpackre.build.closure;

import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.rhino.Node;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static webpackre.build.closure.ModuleFixtures.findCallsTo;
import static webpackre.build.closure.ModuleFixtures.parse;

public class VariableAnnotatorTest {

    static final String CODE = "var a = 1;\n"
            + "function f(b) {\n"
            + "  var c = a;\n"
            + "  return c + b;\n"
            + "}\n"
            + "f(a);";

    ErrorCollector errors;
    Compiler cc;
    Node script;
    ModuleSymbols symbols;

    @Before
    public void setUp() {
        errors = new ErrorCollector();
        cc = ParserHelper.createCompiler(errors);
        script = parse(cc, CODE);
        symbols = ModuleSymbols.build(cc, script);
    }

    VariableAnnotator annotator() {
        return new VariableAnnotator(cc, symbols, "1", "10");
    }

    @Test
    public void numbersBindingsOnFirstOccurrence() {
        List<BindingAnnotation> annotations = annotator().annotate(ImmutableMap.of());

        assertThat(annotations).hasSize(4);
        assertThat(annotations.get(0).name).isEqualTo("a");
        assertThat(annotations.get(1).name).isEqualTo("f");
        assertThat(annotations.get(2).name).isEqualTo("b");
        assertThat(annotations.get(3).name).isEqualTo("c");
        assertThat(annotations.get(3).ordinal).isEqualTo(4);
        assertThat(annotations.get(3).line).isEqualTo(3);
    }

    @Test
    public void numberingIsStable() {
        List<ModuleSymbols.Binding> first = annotator().number();
        List<ModuleSymbols.Binding> second = annotator().number();

        assertThat(second).containsExactlyElementsIn(first).inOrder();
    }

    @Test
    public void renamesByOrdinal() {
        List<BindingAnnotation> annotations = annotator().annotate(ImmutableMap.of(2, "helper"));

        assertThat(annotations.get(1).name).isEqualTo("helper");
        assertThat(annotations.get(1).originalName).isEqualTo("f");
        assertThat(findCallsTo(script, "helper")).hasSize(1);
        assertThat(errors.getDiagnostics()).isEmpty();
    }

    @Test
    public void unknownOrdinalAndCollision() {
        List<BindingAnnotation> annotations = annotator().annotate(ImmutableMap.of(9, "nine", 1, "c"));

        assertThat(errors.getDiagnostics(ChunkDiagnostics.UNKNOWN_ORDINAL)).hasSize(1);
        assertThat(errors.getDiagnostics(ChunkDiagnostics.RENAME_COLLISION)).hasSize(1);
        assertThat(annotations.get(0).name).isEqualTo("a");
    }

    @Test
    public void asMap() {
        BindingAnnotation annotation = annotator().annotate(ImmutableMap.of()).get(0);

        assertThat(annotation.asMap().valAt(BindingAnnotation.KW_NAME)).isEqualTo("a");
        assertThat(annotation.asMap().valAt(BindingAnnotation.KW_ORDINAL)).isEqualTo(1);
    }
}
