package webpackre.build.closure;

import com.google.common.collect.Sets;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import com.google.javascript.rhino.TokenStream;
import org.jspecify.annotations.Nullable;
import webpackre.build.FactoryParams;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * pass 2, turns the webpack loader calls of one module into import/export or require/module.exports.
 * <p>
 * the traversal only decides, all mutations are collected as {@link Edit}s and applied
 * in order once it is done. renames of bindings go last since they may touch nodes
 * the edits created.
 */
public class ModuleRewriter implements NodeTraversal.Callback {

    private static final Logger LOG = Logger.getLogger(ModuleRewriter.class.getName());

    public static final String DEFAULT_EXPORT_NAME = "__WEBPACK_DEFAULT_EXPORT__";
    public static final String REQUIRE_NAME = "__webpack_require__";

    static class PendingRename {
        final ModuleSymbols.Binding binding;
        final String name;

        PendingRename(ModuleSymbols.Binding binding, String name) {
            this.binding = binding;
            this.name = name;
        }
    }

    static class ExportedName {
        final String key;
        final Node local;

        ExportedName(String key, Node local) {
            this.key = key;
            this.local = local;
        }
    }

    final AbstractCompiler compiler;
    final RewriteContext context;
    final FactoryParams params;
    final ModuleSymbols symbols;

    final List<Edit> edits = new ArrayList<>();
    final List<PendingRename> renames = new ArrayList<>();
    final Set<ModuleSymbols.Binding> renamed = Sets.newIdentityHashSet();

    public ModuleRewriter(AbstractCompiler compiler, RewriteContext context, ModuleSymbols symbols) {
        this.compiler = compiler;
        this.context = context;
        this.params = context.params;
        this.symbols = symbols;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
        return true;
    }

    @Override
    public void visit(NodeTraversal t, Node n, Node parent) {
        switch (n.getToken()) {
            case CALL:
                if (ModulePatterns.isRequireCall(t, n, params)) {
                    visitRequire(n);
                } else if (ModulePatterns.isExportsDefinerCall(t, n, params)) {
                    visitExportsDefiner(t, n);
                }
                break;
            case ASSIGN:
                if (ModulePatterns.isDefaultExportTarget(t, n.getFirstChild(), params)) {
                    visitDefaultExport(n);
                }
                break;
            case NAME:
                visitName(t, n);
                break;
            default:
                break;
        }
    }

    // require

    void visitRequire(Node call) {
        String key = ModulePatterns.getRequireArgument(call);
        if (key == null) {
            // pass 1 already complained
            return;
        }

        ImportTarget target = context.resolve(key);
        Node parent = call.getParent();

        if (context.esmOutput && NodeUtil.getEnclosingFunction(call) == null) {
            if (parent.isExprResult() && parent.getParent().isScript()) {
                edits.add(Edit.replace(parent, () -> importNode(IR.empty(), IR.empty(), target.path)));
                return;
            }

            if (isTopLevelDeclarator(parent)) {
                importDeclarator(parent, target);
                return;
            }

            if (parent.isGetProp() && isTopLevelDeclarator(parent.getParent())) {
                importMember(parent.getParent(), parent.getString(), target);
                return;
            }

            if (parent.isDestructuringLhs() && parent.getParent().getParent().isScript()) {
                report(call, ChunkDiagnostics.NOT_IMPLEMENTED_DESTRUCTURED_IMPORT, key);
            }
        }

        edits.add(Edit.replace(call, () -> requireExpression(call, target)));
    }

    Node requireExpression(Node call, ImportTarget target) {
        Node fn = NodeUtil.getEnclosingFunction(call);
        if (context.esmOutput && fn != null && fn.isAsyncFunction()) {
            return new Node(Token.AWAIT, new Node(Token.DYNAMIC_IMPORT, IR.string(target.path)));
        }
        return IR.call(freeName("require"), IR.string(target.path));
    }

    static boolean isTopLevelDeclarator(Node n) {
        return n.isName()
                && NodeUtil.isNameDeclaration(n.getParent())
                && n.getParent().getParent().isScript();
    }

    void importDeclarator(Node declarator, ImportTarget target) {
        ModuleSymbols.Binding binding = symbols.getBinding(declarator);
        String local = declarator.getString();

        edits.add(Edit.insertBefore(declarator.getParent(), () -> {
            if (target.hasDefaultExport) {
                return importNode(boundName(binding, local), IR.empty(), target.path);
            }
            Node star = IR.importStar(local);
            if (binding != null) {
                symbols.addReference(binding, star);
            }
            return importNode(IR.empty(), star, target.path);
        }));
        edits.add(Edit.removeDeclarator(declarator));
    }

    void importMember(Node declarator, String member, ImportTarget target) {
        ModuleSymbols.Binding binding = symbols.getBinding(declarator);
        String local = declarator.getString();

        if (member.equals("default")) {
            edits.add(Edit.insertBefore(declarator.getParent(), () -> importNode(boundName(binding, local), IR.empty(), target.path)));
        } else {
            edits.add(Edit.insertBefore(declarator.getParent(), () -> {
                Node spec = new Node(Token.IMPORT_SPEC, IR.name(member), boundName(binding, local));
                spec.setShorthandProperty(member.equals(local));
                return importNode(IR.empty(), new Node(Token.IMPORT_SPECS, spec), target.path);
            }));
            scheduleRename(binding, member);
        }
        edits.add(Edit.removeDeclarator(declarator));
    }

    static Node importNode(Node name, Node specs, String path) {
        return new Node(Token.IMPORT, name, specs, IR.string(path));
    }

    // exports

    void visitExportsDefiner(NodeTraversal t, Node call) {
        List<ExportedName> exports = collectExports(t, call);
        if (exports == null) {
            return;
        }

        Node statement = ModulePatterns.getTopLevelStatement(call);
        if (statement == null || NodeUtil.getEnclosingFunction(call) != null) {
            report(call, ChunkDiagnostics.EXPORTS_NOT_TOP_LEVEL);
            return;
        }

        if (context.esmOutput) {
            for (ExportedName export : exports) {
                edits.add(Edit.insertBefore(statement, () -> exportNode(export)));
                if (!export.key.equals("default")) {
                    scheduleRename(symbols.getBinding(export.local), export.key);
                }
            }
        } else if (!exports.isEmpty()) {
            edits.add(Edit.insertBefore(statement, () -> defineProperties(exports)));
        }

        edits.add(Edit.removeExpression(call));
    }

    /**
     * @return null if the call is not usable at all, otherwise the valid exports it declares
     */
    @Nullable List<ExportedName> collectExports(NodeTraversal t, Node call) {
        int args = call.getChildCount() - 1;
        Node target = call.getSecondChild();

        boolean objectForm = args == 2 && target.getNext().isObjectLit();
        // webpack 4, n.d(t, "key", function() { return x; })
        boolean propertyForm = args == 3 && target.getNext().isStringLit();
        if (!objectForm && !propertyForm) {
            report(call, ChunkDiagnostics.INVALID_EXPORT_ARGUMENTS, Integer.toString(args));
            return null;
        }

        if (!ModulePatterns.isFreeName(t, target, params.getExportsName())) {
            report(target, ChunkDiagnostics.INVALID_EXPORT_TARGET, target.getToken().toString());
            return null;
        }

        List<ExportedName> exports = new ArrayList<>();
        if (objectForm) {
            for (Node prop = target.getNext().getFirstChild(); prop != null; prop = prop.getNext()) {
                if (!prop.isStringKey()) {
                    report(prop, ChunkDiagnostics.INVALID_EXPORT, prop.getToken().toString());
                    continue;
                }
                addExport(exports, prop, prop.getString(), prop.getFirstChild());
            }
        } else {
            Node key = target.getNext();
            addExport(exports, key, key.getString(), key.getNext());
        }
        return exports;
    }

    void addExport(List<ExportedName> exports, Node keyNode, String key, Node value) {
        if (!TokenStream.isJSIdentifier(key)) {
            report(keyNode, ChunkDiagnostics.INVALID_EXPORT_KEY, key);
            return;
        }

        if (!value.isFunction() || value.getSecondChild().hasChildren()) {
            report(value, ChunkDiagnostics.INVALID_EXPORT_VALUE, key);
            return;
        }

        Node body = value.getLastChild();
        Node local = null;
        if (body.isName()) {
            local = body;
        } else if (body.isBlock()) {
            if (!body.hasChildren()) {
                report(value, ChunkDiagnostics.NOT_IMPLEMENTED_VOID_EXPORT, key);
                return;
            }
            Node ret = body.getFirstChild();
            if (body.hasOneChild() && ret.isReturn() && ret.hasOneChild() && ret.getFirstChild().isName()) {
                local = ret.getFirstChild();
            }
        }

        if (local == null) {
            report(value, ChunkDiagnostics.INVALID_EXPORT_BODY, key);
            return;
        }

        exports.add(new ExportedName(key, local));
    }

    Node exportNode(ExportedName export) {
        ModuleSymbols.Binding binding = symbols.getBinding(export.local);
        String local = export.local.getString();

        if (export.key.equals("default")) {
            Node node = new Node(Token.EXPORT, boundName(binding, local));
            node.putBooleanProp(Node.EXPORT_DEFAULT, true);
            return node;
        }

        Node spec = new Node(Token.EXPORT_SPEC, boundName(binding, local), IR.name(export.key));
        spec.setShorthandProperty(local.equals(export.key));
        return new Node(Token.EXPORT, new Node(Token.EXPORT_SPECS, spec));
    }

    Node defineProperties(List<ExportedName> exports) {
        Node props = IR.objectlit();
        for (ExportedName export : exports) {
            ModuleSymbols.Binding binding = symbols.getBinding(export.local);
            Node getter = IR.function(
                    IR.name(""),
                    IR.paramList(),
                    IR.block(IR.returnNode(boundName(binding, export.local.getString()))));

            props.addChildToBack(
                    IR.stringKey(export.key,
                            IR.objectlit(
                                    IR.stringKey("enumerable", IR.trueNode()),
                                    IR.stringKey("get", getter))));
        }

        return IR.exprResult(
                IR.call(
                        NodeUtil.newQName(compiler, "Object.defineProperties"),
                        freeName("exports"),
                        props));
    }

    // module.exports = ...

    void visitDefaultExport(Node assign) {
        Node parent = assign.getParent();

        if (!context.esmOutput) {
            edits.add(Edit.replace(assign.getFirstChild(), this::moduleExports));
            return;
        }

        if (parent.isExprResult() && parent.getParent().isScript()) {
            edits.add(Edit.replace(parent, () -> {
                Node node = new Node(Token.EXPORT, assign.getLastChild().detach());
                node.putBooleanProp(Node.EXPORT_DEFAULT, true);
                return node;
            }));
            return;
        }

        Node statement = NodeUtil.getEnclosingStatement(assign);
        if (statement == null || !statement.getParent().isScript() || NodeUtil.getEnclosingFunction(assign) != null) {
            // hoisting the value would take it out of its scope or make it unconditional
            report(assign, ChunkDiagnostics.NESTED_DEFAULT_EXPORT);
            edits.add(Edit.replace(assign.getFirstChild(), this::moduleExports));
            return;
        }

        String tmp = symbols.uniqueName(DEFAULT_EXPORT_NAME);
        ModuleSymbols.Binding binding = symbols.addBinding(tmp, symbols.getScript());

        edits.add(Edit.insertBefore(statement, () -> IR.constNode(boundName(binding, tmp), assign.getLastChild().detach())));
        edits.add(Edit.insertBefore(statement, () -> {
            Node node = new Node(Token.EXPORT, boundName(binding, tmp));
            node.putBooleanProp(Node.EXPORT_DEFAULT, true);
            return node;
        }));
        edits.add(Edit.replace(assign, () -> boundName(binding, tmp)));
    }

    Node moduleExports() {
        return IR.getprop(freeName("module"), "exports");
    }

    // slots

    void visitName(NodeTraversal t, Node n) {
        String name = n.getString();
        String replacement = slotReplacement(name);
        if (replacement == null || replacement.equals(name)) {
            return;
        }

        if (t.getScope().getVar(name) != null) {
            return;
        }

        if (t.getScope().getVar(replacement) != null) {
            LOG.fine("[chunk-" + context.chunkId + "] [module-" + context.moduleKey + "] " + replacement + " is bound, keeping " + name);
            return;
        }

        edits.add(Edit.renameFree(symbols, n, replacement));
    }

    @Nullable String slotReplacement(String name) {
        if (name.equals(params.getExportsName())) {
            return "exports";
        }
        if (name.equals(params.getModuleName())) {
            return "module";
        }
        if (name.equals(params.getRequireName())) {
            return REQUIRE_NAME;
        }
        return null;
    }

    // helpers

    Node freeName(String name) {
        Node n = IR.name(name);
        symbols.addFreeName(n);
        return n;
    }

    Node boundName(ModuleSymbols.@Nullable Binding binding, String name) {
        Node n = IR.name(binding != null ? binding.getName() : name);
        if (binding != null) {
            symbols.addReference(binding, n);
        } else {
            symbols.addFreeName(n);
        }
        return n;
    }

    void scheduleRename(ModuleSymbols.@Nullable Binding binding, String externalName) {
        if (binding == null || !renamed.add(binding)) {
            return;
        }
        String target = ModuleSymbols.safeName(externalName);
        if (!target.equals(binding.getName())) {
            renames.add(new PendingRename(binding, target));
        }
    }

    void report(Node node, DiagnosticType type, String... args) {
        String[] all = new String[args.length + 2];
        all[0] = context.chunkId;
        all[1] = context.moduleKey;
        System.arraycopy(args, 0, all, 2, args.length);
        compiler.report(JSError.make(node, type, all));
    }

    void apply() {
        Node script = symbols.getScript();
        for (Edit edit : edits) {
            if (!edit.apply(script)) {
                report(edit.getSite(), ChunkDiagnostics.DETACHED_REWRITE_SITE, edit.describe());
            }
        }

        for (PendingRename rename : renames) {
            if (!symbols.tryRename(rename.binding, rename.name)) {
                Node site = rename.binding.getNodes().isEmpty() ? script : rename.binding.getNodes().get(0);
                report(site, ChunkDiagnostics.RENAME_COLLISION, rename.binding.getName(), rename.name);
            }
        }
    }

    /**
     * @return the symbols of the rewritten module, pass 3 continues with them
     */
    public static ModuleSymbols rewrite(AbstractCompiler compiler, Node script, RewriteContext context) {
        ModuleSymbols symbols = ModuleSymbols.build(compiler, script);

        ModuleRewriter rewriter = new ModuleRewriter(compiler, context, symbols);
        NodeTraversal.traverse(compiler, script, rewriter);
        rewriter.apply();

        LOG.fine("[chunk-" + context.chunkId + "] [module-" + context.moduleKey + "] applied " + rewriter.edits.size() + " edits");
        return symbols;
    }
}
