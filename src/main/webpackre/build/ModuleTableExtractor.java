package webpackre.build;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;
import webpackre.build.closure.ChunkDiagnostics;
import webpackre.build.closure.ParserHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ModuleTableExtractor {

    private static final Logger LOG = Logger.getLogger(ModuleTableExtractor.class.getName());

    static final Pattern FUSION_KEY = Pattern.compile("^__fusion__(\\d+)$");

    private final Compiler cc;
    private final String chunkId;

    public ModuleTableExtractor(Compiler cc, String chunkId) {
        this.cc = cc;
        this.chunkId = chunkId;
    }

    /**
     * @return entries in source order, null when the table is not a module table at all
     */
    public @Nullable List<ModuleEntry> extract(String sourceName, String tableSource) {
        // the table may be followed by the runtime callback, the sequence keeps it a single expression
        Node script = ParserHelper.parse(cc, sourceName, "(" + tableSource + ", 0)");
        if (script == null) {
            LOG.fine("[chunk-" + chunkId + "] module table does not parse");
            return null;
        }

        Node table = findTable(script);
        if (table == null) {
            LOG.fine("[chunk-" + chunkId + "] module table is not an object or array literal");
            return null;
        }

        List<ModuleEntry> entries = new ArrayList<>();
        if (table.isObjectLit()) {
            for (Node prop = table.getFirstChild(); prop != null; prop = prop.getNext()) {
                ModuleEntry entry = fromProperty(prop);
                if (entry != null) {
                    entries.add(entry);
                }
            }
        } else {
            int idx = 0;
            for (Node element = table.getFirstChild(); element != null; element = element.getNext(), idx++) {
                // holes are ids webpack did not put into this chunk
                if (!element.isEmpty() && isFactory(Integer.toString(idx), element)) {
                    entries.add(new ModuleEntry(Integer.toString(idx), element, element));
                }
            }
        }
        return entries;
    }

    private @Nullable ModuleEntry fromProperty(Node prop) {
        // numeric, quoted and identifier keys all end up as STRING_KEY, methods as MEMBER_FUNCTION_DEF
        String key = null;
        if ((prop.isStringKey() && !prop.isShorthandProperty()) || prop.isMemberFunctionDef()) {
            key = prop.getString();
        } else if (prop.isComputedProp() && prop.getBooleanProp(Node.COMPUTED_PROP_METHOD)) {
            // 12() {} parses as a method with a literal computed key
            key = literalKey(prop.getFirstChild());
        }

        if (key == null) {
            cc.report(JSError.make(prop, ChunkDiagnostics.INVALID_TABLE_ENTRY, chunkId, prop.getToken().toString()));
            return null;
        }

        Matcher fusion = FUSION_KEY.matcher(key);
        if (fusion.matches() && !prop.isQuotedStringKey() && !prop.isComputedProp()) {
            cc.report(JSError.make(prop, ChunkDiagnostics.NOT_IMPLEMENTED_FUSION_MODULE, chunkId, fusion.group(1)));
            return null;
        }

        Node value = prop.getLastChild();
        if (!isFactory(key, value)) {
            return null;
        }
        return new ModuleEntry(key, prop, value);
    }

    static @Nullable String literalKey(Node key) {
        if (key.isStringLit()) {
            return key.getString();
        }
        if (key.isNumber() && key.getDouble() >= 0 && key.getDouble() == Math.rint(key.getDouble())) {
            return Long.toString((long) key.getDouble());
        }
        return null;
    }

    private boolean isFactory(String key, Node value) {
        if (value.isFunction()) {
            return true;
        }
        cc.report(JSError.make(value, ChunkDiagnostics.INVALID_MODULE_VALUE, chunkId, key, value.getToken().toString()));
        return false;
    }

    static @Nullable Node findTable(Node script) {
        if (!script.hasOneChild() || !script.getFirstChild().isExprResult()) {
            return null;
        }

        Node expr = script.getFirstFirstChild();
        while (expr.isComma()) {
            expr = expr.getFirstChild();
        }

        if (expr.isObjectLit() || expr.isArrayLit()) {
            return expr;
        }
        return null;
    }
}
