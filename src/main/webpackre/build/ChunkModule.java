package webpackre.build;

import clojure.lang.IPersistentMap;
import clojure.lang.ITransientCollection;
import clojure.lang.Keyword;
import clojure.lang.PersistentVector;
import clojure.lang.RT;
import com.google.common.collect.ImmutableList;
import com.google.javascript.rhino.Node;
import webpackre.build.closure.BindingAnnotation;

/**
 * one module recovered from a chunk, owns its rewritten tree.
 */
public class ChunkModule {

    public static final Keyword KW_ID = RT.keyword(null, "id");
    public static final Keyword KW_RAW_KEY = RT.keyword(null, "raw-key");
    public static final Keyword KW_IMPORT_PATH = RT.keyword(null, "import-path");
    public static final Keyword KW_CHUNK_ID = RT.keyword(null, "chunk-id");
    public static final Keyword KW_COMMONJS = RT.keyword(null, "commonjs");
    public static final Keyword KW_DEFAULT_EXPORT = RT.keyword(null, "default-export");
    public static final Keyword KW_IMPORTS = RT.keyword(null, "imports");
    public static final Keyword KW_SOURCE = RT.keyword(null, "source");
    public static final Keyword KW_ANNOTATIONS = RT.keyword(null, "annotations");

    final String rawKey;
    final ModuleId moduleId;
    final String chunkId;
    final Node tree;
    final boolean commonJs;
    final boolean hasDefaultExport;
    final ImmutableList<String> imports;
    final String source;
    final ImmutableList<BindingAnnotation> annotations;

    public ChunkModule(
            String rawKey,
            ModuleId moduleId,
            String chunkId,
            Node tree,
            boolean commonJs,
            boolean hasDefaultExport,
            ImmutableList<String> imports,
            String source,
            ImmutableList<BindingAnnotation> annotations) {
        this.rawKey = rawKey;
        this.moduleId = moduleId;
        this.chunkId = chunkId;
        this.tree = tree;
        this.commonJs = commonJs;
        this.hasDefaultExport = hasDefaultExport;
        this.imports = imports;
        this.source = source;
        this.annotations = annotations;
    }

    public String getId() {
        return moduleId.getId();
    }

    public String getRawKey() {
        return rawKey;
    }

    public ModuleId getModuleId() {
        return moduleId;
    }

    public String getChunkId() {
        return chunkId;
    }

    public Node getTree() {
        return tree;
    }

    public boolean isCommonJs() {
        return commonJs;
    }

    public boolean hasDefaultExport() {
        return hasDefaultExport;
    }

    /**
     * ids of the required modules, in order of first reference
     */
    public ImmutableList<String> getImports() {
        return imports;
    }

    public String getSource() {
        return source;
    }

    public ImmutableList<BindingAnnotation> getAnnotations() {
        return annotations;
    }

    public IPersistentMap asMap() {
        ITransientCollection annotationMaps = PersistentVector.EMPTY.asTransient();
        for (BindingAnnotation annotation : annotations) {
            annotationMaps = annotationMaps.conj(annotation.asMap());
        }

        return RT.map(
                KW_ID, getId(),
                KW_RAW_KEY, rawKey,
                KW_IMPORT_PATH, moduleId.getImportPath(),
                KW_CHUNK_ID, chunkId,
                KW_COMMONJS, commonJs,
                KW_DEFAULT_EXPORT, hasDefaultExport,
                KW_IMPORTS, PersistentVector.create(imports),
                KW_SOURCE, source,
                KW_ANNOTATIONS, annotationMaps.persistent());
    }

    @Override
    public String toString() {
        return "ChunkModule{" + moduleId + ", chunk=" + chunkId + (commonJs ? ", commonjs" : "") + "}";
    }
}
