package webpackre.build;

import clojure.lang.IPersistentMap;
import clojure.lang.ITransientMap;
import clojure.lang.Keyword;
import clojure.lang.PersistentArrayMap;
import clojure.lang.PersistentVector;
import clojure.lang.RT;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashSet;
import java.util.Set;

public class Chunk {

    public static final Keyword KW_ID = RT.keyword(null, "id");
    public static final Keyword KW_BUNDLE_IDS = RT.keyword(null, "bundle-ids");
    public static final Keyword KW_GLOBAL = RT.keyword(null, "global");
    public static final Keyword KW_MODULES = RT.keyword(null, "modules");

    final String id;
    final ImmutableList<String> bundleIds;
    final String globalName;
    final ImmutableMap<String, ChunkModule> modules;

    public Chunk(String id, ImmutableList<String> bundleIds, String globalName, ImmutableMap<String, ChunkModule> modules) {
        this.id = id;
        this.bundleIds = bundleIds;
        this.globalName = globalName;
        this.modules = modules;
    }

    public String getId() {
        return id;
    }

    public ImmutableList<String> getBundleIds() {
        return bundleIds;
    }

    /**
     * name of the chunk loading global, self.webpackChunk_app
     */
    public String getGlobalName() {
        return globalName;
    }

    /**
     * modules by final id, in table order
     */
    public ImmutableMap<String, ChunkModule> getModules() {
        return modules;
    }

    public Set<String> getImportedModules() {
        Set<String> imported = new LinkedHashSet<>();
        for (ChunkModule module : modules.values()) {
            imported.addAll(module.getImports());
        }
        return imported;
    }

    public IPersistentMap asMap() {
        ITransientMap moduleMaps = PersistentArrayMap.EMPTY.asTransient();
        for (ChunkModule module : modules.values()) {
            moduleMaps = moduleMaps.assoc(module.getId(), module.asMap());
        }

        return RT.map(
                KW_ID, id,
                KW_BUNDLE_IDS, PersistentVector.create(bundleIds),
                KW_GLOBAL, globalName,
                KW_MODULES, moduleMaps.persistent());
    }

    @Override
    public String toString() {
        return "Chunk{" + id + ", modules=" + modules.keySet() + "}";
    }
}
