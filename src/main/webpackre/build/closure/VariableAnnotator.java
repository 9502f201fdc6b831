package webpackre.build.closure;

import com.google.common.collect.Sets;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * pass 3, numbers the bindings of a rewritten module in the order they first show up.
 * <p>
 * the numbers only depend on the printed shape of the module, so renames keyed by them
 * stay valid as long as the input chunk doesn't change.
 */
public class VariableAnnotator {

    private static final Logger LOG = Logger.getLogger(VariableAnnotator.class.getName());

    final AbstractCompiler compiler;
    final ModuleSymbols symbols;
    final String chunkId;
    final String moduleKey;

    public VariableAnnotator(AbstractCompiler compiler, ModuleSymbols symbols, String chunkId, String moduleKey) {
        this.compiler = compiler;
        this.symbols = symbols;
        this.chunkId = chunkId;
        this.moduleKey = moduleKey;
    }

    /**
     * @return bindings by ordinal, the first is 1
     */
    public List<ModuleSymbols.Binding> number() {
        final List<ModuleSymbols.Binding> ordered = new ArrayList<>();
        collect(ordered, new ArrayList<>());
        return ordered;
    }

    void collect(final List<ModuleSymbols.Binding> ordered, final List<Node> firstNodes) {
        final Set<ModuleSymbols.Binding> seen = Sets.newIdentityHashSet();

        NodeUtil.visitPreOrder(symbols.getScript(), n -> {
            ModuleSymbols.Binding binding = symbols.getBinding(n);
            if (binding != null && seen.add(binding)) {
                ordered.add(binding);
                firstNodes.add(n);
            }
        });
    }

    public List<BindingAnnotation> annotate(Map<Integer, String> renames) {
        List<ModuleSymbols.Binding> ordered = new ArrayList<>();
        List<Node> firstNodes = new ArrayList<>();
        collect(ordered, firstNodes);

        for (Map.Entry<Integer, String> rename : renames.entrySet()) {
            int ordinal = rename.getKey();
            String name = rename.getValue();

            if (ordinal < 1 || ordinal > ordered.size()) {
                compiler.report(JSError.make(symbols.getScript(), ChunkDiagnostics.UNKNOWN_ORDINAL, chunkId, moduleKey, Integer.toString(ordinal), name));
                continue;
            }

            ModuleSymbols.Binding binding = ordered.get(ordinal - 1);
            if (!symbols.tryRename(binding, name)) {
                compiler.report(JSError.make(firstNodes.get(ordinal - 1), ChunkDiagnostics.RENAME_COLLISION, chunkId, moduleKey, binding.getName(), name));
            }
        }

        List<BindingAnnotation> annotations = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ModuleSymbols.Binding binding = ordered.get(i);
            Node first = firstNodes.get(i);
            annotations.add(new BindingAnnotation(i + 1, binding.getName(), binding.getOriginalName(), first.getLineno(), first.getCharno()));
        }

        LOG.fine("[chunk-" + chunkId + "] [module-" + moduleKey + "] " + annotations.size() + " bindings");
        return annotations;
    }

    /**
     * comment block listing every binding by ordinal, printed in front of the module source
     */
    public static String toHeader(List<BindingAnnotation> annotations) {
        StringBuilder sb = new StringBuilder("/*\n * bindings\n");
        for (BindingAnnotation annotation : annotations) {
            sb.append(" * ").append(annotation.describe()).append('\n');
        }
        return sb.append(" */\n").toString();
    }
}
