package webpackre.build.closure;

import com.google.common.base.Preconditions;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import webpackre.build.FactoryParams;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * module bodies parsed on their own, e t n are free just like after factory validation
 */
class ModuleFixtures {

    static final FactoryParams PARAMS = FactoryParams.of("e", "t", "n");

    static Node parse(Compiler cc, String code) {
        Node script = ParserHelper.parse(cc, "module.js", code);
        Preconditions.checkNotNull(script, "does not parse: %s", code);
        return script;
    }

    static List<Node> find(Node root, Predicate<Node> pred) {
        List<Node> result = new ArrayList<>();
        NodeUtil.visitPreOrder(root, n -> {
            if (pred.test(n)) {
                result.add(n);
            }
        });
        return result;
    }

    static List<Node> findNames(Node root, String name) {
        return find(root, n -> n.isName() && n.getString().equals(name));
    }

    static List<Node> findCallsTo(Node root, String name) {
        return find(root, n -> n.isCall() && n.getFirstChild().isName() && n.getFirstChild().getString().equals(name));
    }

    static String strip(String source) {
        return source.replaceAll("\\s", "");
    }
}
