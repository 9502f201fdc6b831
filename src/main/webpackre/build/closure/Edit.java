package webpackre.build.closure;

import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;

import java.util.function.Supplier;

/**
 * a tree mutation decided during traversal but applied once the traversal is done.
 * <p>
 * replacement nodes are only built when the edit is applied so they pick up
 * whatever earlier edits did to the nodes they reuse.
 */
public abstract class Edit {

    final Node site;

    Edit(Node site) {
        this.site = site;
    }

    public Node getSite() {
        return site;
    }

    /**
     * @return false if the site is no longer part of the tree, nothing was changed
     */
    public boolean apply(Node root) {
        if (!ModuleSymbols.isAncestor(root, site) || site == root) {
            return false;
        }
        perform();
        return true;
    }

    abstract void perform();

    public abstract String describe();

    public static Edit replace(Node site, Supplier<Node> replacement) {
        return new Edit(site) {
            @Override
            void perform() {
                Node node = replacement.get();
                node.srcrefTreeIfMissing(site);
                site.replaceWith(node);
            }

            @Override
            public String describe() {
                return "replace " + site.getToken();
            }
        };
    }

    public static Edit insertBefore(Node anchor, Supplier<Node> statement) {
        return new Edit(anchor) {
            @Override
            void perform() {
                Node node = statement.get();
                node.srcrefTreeIfMissing(anchor);
                node.insertBefore(anchor);
            }

            @Override
            public String describe() {
                return "insert before " + anchor.getToken();
            }
        };
    }

    /**
     * removes one NAME of a var/let/const, the whole declaration once it is empty
     */
    public static Edit removeDeclarator(Node declarator) {
        return new Edit(declarator) {
            @Override
            void perform() {
                Node declaration = declarator.getParent();
                declarator.detach();
                if (!declaration.hasChildren()) {
                    declaration.detach();
                }
            }

            @Override
            public String describe() {
                return "remove declarator " + declarator.getString();
            }
        };
    }

    /**
     * removes an expression, its statement if it is the whole statement
     */
    public static Edit removeExpression(Node expr) {
        return new Edit(expr) {
            @Override
            void perform() {
                Node parent = expr.getParent();
                if (parent.isExprResult()) {
                    parent.detach();
                } else if (parent.isComma()) {
                    Node other = expr == parent.getFirstChild() ? parent.getLastChild() : parent.getFirstChild();
                    other.detach();
                    parent.replaceWith(other);
                } else {
                    expr.replaceWith(IR.voidNode(IR.number(0)).srcrefTree(expr));
                }
            }

            @Override
            public String describe() {
                return "remove " + expr.getToken();
            }
        };
    }

    public static Edit renameFree(ModuleSymbols symbols, Node name, String newName) {
        return new Edit(name) {
            @Override
            void perform() {
                symbols.renameFree(name, newName);
            }

            @Override
            public String describe() {
                return "rename " + name.getString() + " to " + newName;
            }
        };
    }
}
