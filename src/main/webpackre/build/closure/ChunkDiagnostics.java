package webpackre.build.closure;

import com.google.common.collect.ImmutableSet;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;

/**
 * all problems found while splitting a chunk are reported as closure JSErrors with these types.
 * <p>
 * none of them abort the chunk, they only drop one table entry, one module, one export
 * or leave one rewrite site untouched. the NOT_IMPLEMENTED ones are shapes we recognize
 * but don't handle yet, they must stay distinguishable from actual validation failures.
 */
public class ChunkDiagnostics {

    public static final DiagnosticType INVALID_TABLE_ENTRY =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_TABLE_ENTRY", "[chunk-{0}] chunk module is not a plain property: {1}");

    public static final DiagnosticType INVALID_MODULE_VALUE =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_MODULE_VALUE", "[chunk-{0}] [module-{1}] invalid chunk module value: {2}");

    public static final DiagnosticType TOO_MANY_PARAMS =
            DiagnosticType.warning("JSC_WEBPACK_TOO_MANY_PARAMS", "[chunk-{0}] [module-{1}] too many chunk module function params: {2}");

    public static final DiagnosticType INVALID_PARAM =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_PARAM", "[chunk-{0}] [module-{1}] invalid chunk module function param: {2}");

    public static final DiagnosticType PARAM_MISMATCH =
            DiagnosticType.warning("JSC_WEBPACK_PARAM_MISMATCH", "[chunk-{0}] [module-{1}] chunk module function param {2} is {3} but the chunk uses {4}");

    public static final DiagnosticType INVALID_BODY =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_BODY", "[chunk-{0}] [module-{1}] invalid chunk module function body");

    public static final DiagnosticType INVALID_DEFAULT_EXPORT_OPERATOR =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_DEFAULT_EXPORT_OPERATOR", "[chunk-{0}] [module-{1}] invalid default export operator: {2}");

    public static final DiagnosticType INVALID_IMPORT_ARGUMENTS =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_IMPORT_ARGUMENTS", "[chunk-{0}] [module-{1}] invalid number of import arguments: {2}");

    public static final DiagnosticType INVALID_IMPORT_ARGUMENT =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_IMPORT_ARGUMENT", "[chunk-{0}] [module-{1}] invalid import argument: {2}");

    public static final DiagnosticType INVALID_EXPORT_ARGUMENTS =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_EXPORT_ARGUMENTS", "[chunk-{0}] [module-{1}] invalid export arguments: {2}");

    public static final DiagnosticType INVALID_EXPORT_TARGET =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_EXPORT_TARGET", "[chunk-{0}] [module-{1}] invalid export first argument: {2}");

    public static final DiagnosticType INVALID_EXPORT =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_EXPORT", "[chunk-{0}] [module-{1}] invalid export: {2}");

    public static final DiagnosticType INVALID_EXPORT_KEY =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_EXPORT_KEY", "[chunk-{0}] [module-{1}] invalid export property key: {2}");

    public static final DiagnosticType INVALID_EXPORT_VALUE =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_EXPORT_VALUE", "[chunk-{0}] [module-{1}] invalid export property value for {2}");

    public static final DiagnosticType INVALID_EXPORT_BODY =
            DiagnosticType.warning("JSC_WEBPACK_INVALID_EXPORT_BODY", "[chunk-{0}] [module-{1}] invalid export property value body for {2}");

    public static final DiagnosticType EXPORTS_NOT_TOP_LEVEL =
            DiagnosticType.warning("JSC_WEBPACK_EXPORTS_NOT_TOP_LEVEL", "[chunk-{0}] [module-{1}] exports are not declared by a top level statement");

    public static final DiagnosticType NESTED_DEFAULT_EXPORT =
            DiagnosticType.warning("JSC_WEBPACK_NESTED_DEFAULT_EXPORT", "[chunk-{0}] [module-{1}] default export inside a function is kept as module.exports");

    public static final DiagnosticType DETACHED_REWRITE_SITE =
            DiagnosticType.warning("JSC_WEBPACK_DETACHED_REWRITE_SITE", "[chunk-{0}] [module-{1}] rewrite site is no longer attached: {2}");

    public static final DiagnosticType RENAME_COLLISION =
            DiagnosticType.warning("JSC_WEBPACK_RENAME_COLLISION", "[chunk-{0}] [module-{1}] cannot rename {2} to {3}, the name is already in use");

    public static final DiagnosticType UNKNOWN_ORDINAL =
            DiagnosticType.warning("JSC_WEBPACK_UNKNOWN_ORDINAL", "[chunk-{0}] [module-{1}] no variable with ordinal {2}, cannot rename it to {3}");

    public static final DiagnosticType NOT_IMPLEMENTED_FUSION_MODULE =
            DiagnosticType.warning("JSC_WEBPACK_NOT_IMPLEMENTED_FUSION_MODULE", "[chunk-{0}] fusion sub-module {1} is not implemented");

    public static final DiagnosticType NOT_IMPLEMENTED_VOID_EXPORT =
            DiagnosticType.warning("JSC_WEBPACK_NOT_IMPLEMENTED_VOID_EXPORT", "[chunk-{0}] [module-{1}] void export {2} is not implemented");

    public static final DiagnosticType NOT_IMPLEMENTED_DESTRUCTURED_IMPORT =
            DiagnosticType.warning("JSC_WEBPACK_NOT_IMPLEMENTED_DESTRUCTURED_IMPORT", "[chunk-{0}] [module-{1}] non-identifier import of {2} is not implemented, kept as require");

    static final ImmutableSet<DiagnosticType> NOT_IMPLEMENTED = ImmutableSet.of(
            NOT_IMPLEMENTED_FUSION_MODULE,
            NOT_IMPLEMENTED_VOID_EXPORT,
            NOT_IMPLEMENTED_DESTRUCTURED_IMPORT);

    public static boolean isNotImplemented(JSError error) {
        return NOT_IMPLEMENTED.contains(error.getType());
    }
}
