package webpackre.build.closure;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.rhino.Node;
import org.junit.Before;
import org.junit.Test;

import static com.google.common.truth.Truth.assertThat;
import static webpackre.build.closure.ModuleFixtures.findNames;
import static webpackre.build.closure.ModuleFixtures.parse;
import static webpackre.build.closure.ModuleFixtures.strip;

public class ModuleSymbolsTest {

    Compiler cc;

    @Before
    public void setUp() {
        cc = ParserHelper.createCompiler(new ErrorCollector());
    }

    static ModuleSymbols.Binding binding(ModuleSymbols symbols, Node script, String name) {
        return symbols.getBinding(findNames(script, name).get(0));
    }

    @Test
    public void referencesShareOneBinding() {
        Node script = parse(cc, "var a = 1;\nfunction f(b) { return a + b; }\nf(a);");
        ModuleSymbols symbols = ModuleSymbols.build(cc, script);

        ModuleSymbols.Binding a = binding(symbols, script, "a");
        assertThat(a.getNodes()).hasSize(3);
        assertThat(a.getRegion()).isSameInstanceAs(script);

        ModuleSymbols.Binding b = binding(symbols, script, "b");
        assertThat(b.getRegion().isFunction()).isTrue();
        assertThat(symbols.getBinding(script)).isNull();
    }

    @Test
    public void renameCollisionLeavesNamesUnchanged() {
        Node script = parse(cc, "var a = 1;\nvar b = 2;\nfunction f(c) { return a + c + b; }");
        ModuleSymbols symbols = ModuleSymbols.build(cc, script);
        String before = ParserHelper.toSource(cc, script);

        ModuleSymbols.Binding a = binding(symbols, script, "a");
        assertThat(symbols.tryRename(a, "b")).isFalse();
        // c is declared inside f where a is referenced
        assertThat(symbols.tryRename(a, "c")).isFalse();
        assertThat(a.getName()).isEqualTo("a");
        assertThat(ParserHelper.toSource(cc, script)).isEqualTo(before);
    }

    @Test
    public void renameCollisionWithFreeName() {
        Node script = parse(cc, "var a = 1;\nconsole.log(a);");
        ModuleSymbols symbols = ModuleSymbols.build(cc, script);

        assertThat(symbols.tryRename(binding(symbols, script, "a"), "console")).isFalse();
    }

    @Test
    public void renameReachesEveryReference() {
        Node script = parse(cc, "var a = 1;\nfunction f(c) { return a + c; }\nvar o = { a };");
        ModuleSymbols symbols = ModuleSymbols.build(cc, script);

        ModuleSymbols.Binding a = binding(symbols, script, "a");
        assertThat(symbols.tryRename(a, "z")).isTrue();
        assertThat(a.getName()).isEqualTo("z");
        assertThat(a.getOriginalName()).isEqualTo("a");
        assertThat(findNames(script, "a")).isEmpty();

        String source = strip(ParserHelper.toSource(cc, script));
        assertThat(source).contains("varz=1;");
        assertThat(source).contains("returnz+c;");
        assertThat(source).contains("{a:z}");
    }

    @Test
    public void innerNamesDoNotBlockOtherFunctions() {
        Node script = parse(cc, "function f(x) { return x; }\nfunction g(y) { return y; }");
        ModuleSymbols symbols = ModuleSymbols.build(cc, script);

        assertThat(symbols.tryRename(binding(symbols, script, "y"), "x")).isTrue();
    }

    @Test
    public void uniqueNameReserves() {
        Node script = parse(cc, "var tmp = 1;");
        ModuleSymbols symbols = ModuleSymbols.build(cc, script);

        assertThat(symbols.uniqueName("tmp")).isEqualTo("tmp$1");
        assertThat(symbols.uniqueName("tmp")).isEqualTo("tmp$2");
        assertThat(symbols.uniqueName("other")).isEqualTo("other");
        assertThat(symbols.isNameInUse("other", script)).isTrue();
    }

    @Test
    public void safeNames() {
        assertThat(ModuleSymbols.safeName("useState")).isEqualTo("useState");
        assertThat(ModuleSymbols.safeName("default")).isEqualTo("_default");
        assertThat(ModuleSymbols.safeName("arguments")).isEqualTo("_arguments");
        assertThat(ModuleSymbols.safeName("foo-bar")).isEqualTo("_foo_bar");
    }
}
