package webpackre.build;

import com.google.common.base.Preconditions;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.InputId;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;
import webpackre.build.closure.ChunkDiagnostics;

import java.util.logging.Logger;

/**
 * validates the factories of one chunk and unifies their parameter names.
 * <p>
 * a rejected factory never changes the unified names, so later factories
 * are judged exactly as if the rejected one had not been in the table.
 */
public class FactoryValidator {

    private static final Logger LOG = Logger.getLogger(FactoryValidator.class.getName());

    static final String[] SLOT_NAMES = new String[]{"module", "exports", "require"};

    private final AbstractCompiler compiler;
    private final String chunkId;

    private FactoryParams params = FactoryParams.EMPTY;

    public FactoryValidator(AbstractCompiler compiler, String chunkId) {
        this.compiler = compiler;
        this.chunkId = chunkId;
    }

    public FactoryValidator(AbstractCompiler compiler, String chunkId, FactoryParams params) {
        this(compiler, chunkId);
        this.params = params;
    }

    public FactoryParams getParams() {
        return params;
    }

    public @Nullable ModuleFactory validate(ModuleEntry entry) {
        Node fn = entry.factory;
        Preconditions.checkArgument(fn.isFunction(), "not a factory: %s", entry);

        Node paramList = fn.getSecondChild();
        int count = paramList.getChildCount();
        if (count > FactoryParams.MAX_SLOTS) {
            report(paramList, ChunkDiagnostics.TOO_MANY_PARAMS, entry.key, Integer.toString(count));
            return null;
        }

        String[] names = new String[count];
        int idx = 0;
        for (Node param = paramList.getFirstChild(); param != null; param = param.getNext()) {
            // defaults, patterns and rest all wrap the name
            if (!param.isName()) {
                report(param, ChunkDiagnostics.INVALID_PARAM, entry.key, param.getToken().toString());
                return null;
            }
            names[idx++] = param.getString();
        }

        FactoryParams declared = FactoryParams.of(names);
        int conflict = params.findConflict(declared);
        if (conflict != -1) {
            report(paramList, ChunkDiagnostics.PARAM_MISMATCH,
                    entry.key,
                    SLOT_NAMES[conflict],
                    declared.get(conflict),
                    params.get(conflict));
            return null;
        }

        Node body = fn.getLastChild();
        if (!body.isBlock()) {
            report(body, ChunkDiagnostics.INVALID_BODY, entry.key);
            return null;
        }

        // only commit once nothing can reject the module anymore
        params = params.unify(declared);

        Node script = IR.script();
        script.srcref(body);
        script.setInputId(new InputId(chunkId + "/" + entry.key));
        while (body.hasChildren()) {
            script.addChildToBack(body.removeFirstChild());
        }

        LOG.fine("[chunk-" + chunkId + "] [module-" + entry.key + "] factory " + declared);
        return new ModuleFactory(entry.key, script, params.limit(count));
    }

    private void report(Node node, DiagnosticType type, String moduleKey, String... args) {
        String[] all = new String[args.length + 2];
        all[0] = chunkId;
        all[1] = moduleKey;
        System.arraycopy(args, 0, all, 2, args.length);
        compiler.report(JSError.make(node, type, all));
    }
}
