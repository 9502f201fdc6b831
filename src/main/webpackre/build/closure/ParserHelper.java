package webpackre.build.closure;

import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.ErrorManager;
import com.google.javascript.jscomp.JsAst;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * one compiler per chunk, never shared between threads.
 */
public class ParserHelper {

    private ParserHelper() {
    }

    public static CompilerOptions createOptions() {
        CompilerOptions co = new CompilerOptions();
        co.setLanguageIn(CompilerOptions.LanguageMode.UNSTABLE);
        co.setLanguageOut(CompilerOptions.LanguageMode.NO_TRANSPILE);
        co.setPrettyPrint(true);
        co.setEmitUseStrict(false);
        return co;
    }

    public static Compiler createCompiler(ErrorManager errors) {
        Compiler cc = new Compiler(errors);
        cc.initOptions(createOptions());
        return cc;
    }

    /**
     * @return the SCRIPT node, null if the parser reported errors
     */
    public static @Nullable Node parse(Compiler cc, String name, String code) {
        int errorsBefore = cc.getErrorCount();

        JsAst ast = new JsAst(SourceFile.fromCode(name, code));
        Node root = ast.getAstRoot(cc);

        // closure hands back an empty SCRIPT on parse errors, the errors went to the ErrorManager
        if (cc.getErrorCount() > errorsBefore) {
            return null;
        }
        return root;
    }

    public static String toSource(AbstractCompiler cc, Node node) {
        return ((Compiler) cc).toSource(node);
    }
}
