package webpackre.build.closure;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.Var;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.TokenStream;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * symbol table of one module, built once from the untouched tree.
 * <p>
 * closure scopes can't be asked again once nodes were moved around, so every binding
 * remembers its own name nodes. nodes created by the rewrite are registered here
 * so later renames reach them too.
 */
public class ModuleSymbols {

    // valid identifiers that still can't be used as a binding in a module
    static final ImmutableSet<String> RESERVED = ImmutableSet.of(
            "arguments", "eval", "await", "yield", "let", "static", "enum",
            "implements", "interface", "package", "private", "protected", "public",
            "undefined", "NaN", "Infinity");

    public static class Binding {
        String name;
        final String originalName;
        final Node region;
        final List<Node> nodes = new ArrayList<>();

        Binding(String name, Node region) {
            this.name = name;
            this.originalName = name;
            this.region = region;
        }

        public String getName() {
            return name;
        }

        public String getOriginalName() {
            return originalName;
        }

        /**
         * the SCRIPT or FUNCTION the binding is declared in
         */
        public Node getRegion() {
            return region;
        }

        public List<Node> getNodes() {
            return Collections.unmodifiableList(nodes);
        }

        @Override
        public String toString() {
            return name.equals(originalName) ? "Binding{" + name + "}" : "Binding{" + originalName + "->" + name + "}";
        }
    }

    private final Node script;
    private final List<Binding> bindings = new ArrayList<>();
    private final Map<Node, Binding> bindingsByNode = new IdentityHashMap<>();
    private final Map<String, List<Node>> freeNames = new HashMap<>();
    private final Set<String> reserved = new HashSet<>();

    ModuleSymbols(Node script) {
        this.script = script;
    }

    public Node getScript() {
        return script;
    }

    public List<Binding> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    public @Nullable Binding getBinding(Node n) {
        return bindingsByNode.get(n);
    }

    public Binding addBinding(String name, Node region) {
        Binding binding = new Binding(name, region);
        bindings.add(binding);
        return binding;
    }

    public void addReference(Binding binding, Node n) {
        Preconditions.checkArgument(n.isName() || n.isImportStar(), "not a name node: %s", n);
        Preconditions.checkArgument(n.getString().equals(binding.name), "%s is not a reference to %s", n, binding);
        binding.nodes.add(n);
        bindingsByNode.put(n, binding);
    }

    public void addFreeName(Node n) {
        freeNames.computeIfAbsent(n.getString(), k -> new ArrayList<>()).add(n);
    }

    public void renameFree(Node n, String newName) {
        List<Node> nodes = freeNames.get(n.getString());
        if (nodes != null) {
            nodes.remove(n);
        }
        n.setString(newName);
        addFreeName(n);
    }

    /**
     * true if declaring or renaming something to name inside region could change
     * what any reference resolves to.
     */
    public boolean isNameInUse(String name, Node region) {
        if (reserved.contains(name)) {
            return true;
        }

        for (Binding binding : bindings) {
            if (binding.name.equals(name)
                    && (isAncestor(binding.region, region) || isAncestor(region, binding.region))) {
                return true;
            }
        }

        List<Node> free = freeNames.get(name);
        if (free != null) {
            for (Node n : free) {
                if (isAncestor(region, n)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * reserves a name that is not in use anywhere in the module
     */
    public String uniqueName(String base) {
        String name = base;
        int idx = 1;
        while (isNameInUse(name, script)) {
            name = base + "$" + idx;
            idx++;
        }
        reserved.add(name);
        return name;
    }

    /**
     * renames every node of the binding or nothing at all.
     */
    public boolean tryRename(Binding binding, String newName) {
        if (binding.name.equals(newName)) {
            return true;
        }

        if (!TokenStream.isJSIdentifier(newName) || isNameInUse(newName, binding.region)) {
            return false;
        }

        for (Node n : binding.nodes) {
            n.setString(newName);
            fixShorthand(n);
        }
        binding.name = newName;
        return true;
    }

    static void fixShorthand(Node n) {
        Node parent = n.getParent();
        if (parent == null) {
            return;
        }

        if (parent.isStringKey()) {
            // {a} with a renamed must print as {a: b}
            parent.setShorthandProperty(parent.getString().equals(n.getString()) && parent.isShorthandProperty());
        } else if (parent.isImportSpec() || parent.isExportSpec()) {
            parent.setShorthandProperty(parent.getFirstChild().getString().equals(parent.getLastChild().getString()));
        }
    }

    public static String safeName(String name) {
        if (!TokenStream.isJSIdentifier(name)) {
            return "_" + name.replaceAll("[^A-Za-z0-9_$]", "_");
        }
        if (TokenStream.isKeyword(name) || RESERVED.contains(name)) {
            return "_" + name;
        }
        return name;
    }

    static boolean isAncestor(Node ancestor, Node n) {
        for (Node current = n; current != null; current = current.getParent()) {
            if (current == ancestor) {
                return true;
            }
        }
        return false;
    }

    static Node regionOf(Var var) {
        Node root = var.getScopeRoot();
        // vars of a function body live in the BLOCK scope, params in the FUNCTION one
        if (root.isBlock() && root.getParent() != null && root.getParent().isFunction()) {
            return root.getParent();
        }
        return root;
    }

    public static ModuleSymbols build(AbstractCompiler compiler, Node script) {
        final ModuleSymbols symbols = new ModuleSymbols(script);
        final Map<Node, Binding> byDeclaration = new IdentityHashMap<>();

        NodeTraversal.traverse(compiler, script, new NodeTraversal.AbstractPostOrderCallback() {
            @Override
            public void visit(NodeTraversal t, Node n, Node parent) {
                if (!n.isName() || n.getString().isEmpty()) {
                    return;
                }

                Var var = t.getScope().getVar(n.getString());
                if (var == null || var.isArguments() || var.getNameNode() == null) {
                    symbols.addFreeName(n);
                    return;
                }

                Binding binding = byDeclaration.get(var.getNameNode());
                if (binding == null) {
                    binding = symbols.addBinding(n.getString(), regionOf(var));
                    byDeclaration.put(var.getNameNode(), binding);
                }
                symbols.addReference(binding, n);
            }
        });

        return symbols;
    }
}
