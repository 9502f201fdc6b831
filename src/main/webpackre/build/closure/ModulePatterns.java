package webpackre.build.closure;

import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;
import webpackre.build.FactoryParams;

/**
 * shapes of the webpack loader convention, shared by the scan and the rewrite.
 */
public class ModulePatterns {

    private ModulePatterns() {
    }

    /**
     * n is a NAME equal to name that does not resolve to a declaration of the module
     */
    public static boolean isFreeName(NodeTraversal t, Node n, @Nullable String name) {
        return name != null
                && n.isName()
                && n.getString().equals(name)
                && t.getScope().getVar(name) == null;
    }

    /**
     * module.exports as an assignment target, module being the free module slot
     */
    public static boolean isDefaultExportTarget(NodeTraversal t, Node target, FactoryParams params) {
        return target.isGetProp()
                && target.getString().equals("exports")
                && isFreeName(t, target.getFirstChild(), params.getModuleName());
    }

    /**
     * a call of the free require slot, the arguments are not checked
     */
    public static boolean isRequireCall(NodeTraversal t, Node call, FactoryParams params) {
        return call.isCall() && isFreeName(t, call.getFirstChild(), params.getRequireName());
    }

    /**
     * @return the raw module key a require call refers to, null if it isn't a single literal
     */
    public static @Nullable String getRequireArgument(Node call) {
        if (!call.hasTwoChildren()) {
            return null;
        }

        Node arg = call.getSecondChild();
        if (arg.isStringLit()) {
            return arg.getString();
        }

        if (arg.isNumber()) {
            double num = arg.getDouble();
            if (num >= 0 && num == Math.rint(num) && num < 0x1p53) {
                return Long.toString((long) num);
            }
            return null;
        }

        return null;
    }

    /**
     * require.d(...), the exports definer
     */
    public static boolean isExportsDefinerCall(NodeTraversal t, Node call, FactoryParams params) {
        if (!call.isCall()) {
            return false;
        }
        Node callee = call.getFirstChild();
        return callee.isGetProp()
                && callee.getString().equals("d")
                && isFreeName(t, callee.getFirstChild(), params.getRequireName());
    }

    /**
     * the statement directly below the module SCRIPT containing n, null when n is not in one
     */
    public static @Nullable Node getTopLevelStatement(Node n) {
        Node current = n;
        while (current.getParent() != null) {
            if (current.getParent().isScript()) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }
}
