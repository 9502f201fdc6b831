package webpackre.build.closure;

import com.google.common.collect.ImmutableList;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import webpackre.build.FactoryParams;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * pass 1, looks at one module without touching it.
 * <p>
 * decides whether the module is CommonJS and whether it has a default export and
 * collects the raw keys of every module it requires. other modules of the chunk
 * need this before any of them can be rewritten.
 */
public class ExportImportScanner implements NodeTraversal.Callback {

    private static final Logger LOG = Logger.getLogger(ExportImportScanner.class.getName());

    final AbstractCompiler compiler;
    final FactoryParams params;
    final String chunkId;
    final String moduleKey;

    int defaultExports = 0;
    boolean objectDefaultExport = false;
    boolean definesDefault = false;
    final Set<String> references = new LinkedHashSet<>();

    public ExportImportScanner(AbstractCompiler compiler, FactoryParams params, String chunkId, String moduleKey) {
        this.compiler = compiler;
        this.params = params;
        this.chunkId = chunkId;
        this.moduleKey = moduleKey;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node node, Node parent) {
        return true;
    }

    @Override
    public void visit(NodeTraversal t, Node node, Node parent) {
        if (node.isCall()) {
            if (ModulePatterns.isRequireCall(t, node, params)) {
                visitRequire(node);
            } else if (ModulePatterns.isExportsDefinerCall(t, node, params)) {
                visitExportsDefiner(t, node);
            }
        } else if (NodeUtil.isAssignmentOp(node) && ModulePatterns.isDefaultExportTarget(t, node.getFirstChild(), params)) {
            if (!node.isAssign()) {
                report(node, ChunkDiagnostics.INVALID_DEFAULT_EXPORT_OPERATOR, node.getToken().toString());
                return;
            }

            defaultExports++;
            if (node.getLastChild().isObjectLit()) {
                objectDefaultExport = true;
            }
        }
    }

    void visitRequire(Node call) {
        int args = call.getChildCount() - 1;
        if (args != 1) {
            report(call, ChunkDiagnostics.INVALID_IMPORT_ARGUMENTS, Integer.toString(args));
            return;
        }

        String key = ModulePatterns.getRequireArgument(call);
        if (key == null) {
            report(call.getSecondChild(), ChunkDiagnostics.INVALID_IMPORT_ARGUMENT, call.getSecondChild().getToken().toString());
            return;
        }

        references.add(key);
    }

    void visitExportsDefiner(NodeTraversal t, Node call) {
        // only need to know about default, the rewrite validates the rest
        if (call.getChildCount() < 3 || !ModulePatterns.isFreeName(t, call.getSecondChild(), params.getExportsName())) {
            return;
        }

        Node props = call.getChildAtIndex(2);

        if (props.isObjectLit()) {
            for (Node prop = props.getFirstChild(); prop != null; prop = prop.getNext()) {
                if (prop.isStringKey() && prop.getString().equals("default")) {
                    definesDefault = true;
                }
            }
        } else if (props.isStringLit() && props.getString().equals("default")) {
            definesDefault = true;
        }
    }

    void report(Node node, DiagnosticType type, String arg) {
        compiler.report(JSError.make(node, type, chunkId, moduleKey, arg));
    }

    public boolean isCommonJs() {
        // a definer default next to module.exports is a second candidate as well
        int candidates = defaultExports + (definesDefault && defaultExports > 0 ? 1 : 0);
        return candidates > 1 || objectDefaultExport;
    }

    public ScanResult getResult() {
        return new ScanResult(
                isCommonJs(),
                defaultExports > 0 || definesDefault,
                ImmutableList.copyOf(references));
    }

    public static ScanResult scan(AbstractCompiler compiler, Node script, FactoryParams params, String chunkId, String moduleKey) {
        ExportImportScanner scanner = new ExportImportScanner(compiler, params, chunkId, moduleKey);
        NodeTraversal.traverse(compiler, script, scanner);

        ScanResult result = scanner.getResult();
        LOG.fine("[chunk-" + chunkId + "] [module-" + moduleKey + "] " + result);
        return result;
    }
}
