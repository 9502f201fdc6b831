package webpackre.build;

import clojure.lang.IPersistentMap;
import clojure.lang.ITransientCollection;
import clojure.lang.Keyword;
import clojure.lang.PersistentVector;
import clojure.lang.RT;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * importer -> imported edges between final module ids, shared by all chunks.
 * <p>
 * every method holds the graph monitor so chunks split on different threads
 * can add to it without further coordination.
 */
public class DependencyGraph {

    public static final Keyword KW_OPTIONS = RT.keyword(null, "options");
    public static final Keyword KW_TYPE = RT.keyword(null, "type");
    public static final Keyword KW_MULTI = RT.keyword(null, "multi");
    public static final Keyword KW_ALLOW_SELF_LOOPS = RT.keyword(null, "allowSelfLoops");
    public static final Keyword KW_NODES = RT.keyword(null, "nodes");
    public static final Keyword KW_EDGES = RT.keyword(null, "edges");
    public static final Keyword KW_KEY = RT.keyword(null, "key");
    public static final Keyword KW_ATTRIBUTES = RT.keyword(null, "attributes");
    public static final Keyword KW_SOURCE = RT.keyword(null, "source");
    public static final Keyword KW_TARGET = RT.keyword(null, "target");
    public static final Keyword KW_CHUNK_ID = RT.keyword(null, "chunkId");
    public static final Keyword KW_COMMONJS = RT.keyword(null, "commonjs");
    public static final Keyword KW_DECLARED = RT.keyword(null, "declared");

    public static class ModuleNode {
        final String id;
        @Nullable String chunkId;
        boolean commonJs;
        boolean declared;
        @Nullable ChunkModule module;

        ModuleNode(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }

        public @Nullable String getChunkId() {
            return chunkId;
        }

        public boolean isCommonJs() {
            return commonJs;
        }

        public boolean isDeclared() {
            return declared;
        }

        public @Nullable ChunkModule getModule() {
            return module;
        }
    }

    private final MutableGraph<String> graph = GraphBuilder.directed()
            .allowsSelfLoops(true)
            .incidentEdgeOrder(ElementOrder.stable())
            .build();
    private final Map<String, ModuleNode> nodes = new HashMap<>();

    private ModuleNode node(String id) {
        ModuleNode node = nodes.get(id);
        if (node == null) {
            node = new ModuleNode(id);
            nodes.put(id, node);
            graph.addNode(id);
        }
        return node;
    }

    /**
     * declares a module, merging into the node if it was referenced before
     */
    public synchronized void addModule(String id, String chunkId, boolean commonJs) {
        ModuleNode node = node(id);
        node.chunkId = chunkId;
        node.commonJs = commonJs;
        node.declared = true;
    }

    public synchronized void addModule(ChunkModule module) {
        addModule(module.getId(), module.getChunkId(), module.isCommonJs());
        nodes.get(module.getId()).module = module;
    }

    public synchronized void addDependency(String from, String to) {
        node(from);
        node(to);
        graph.putEdge(from, to);
    }

    public synchronized @Nullable ModuleNode getNode(String id) {
        return nodes.get(id);
    }

    public synchronized ImmutableSet<String> getModuleIds() {
        return ImmutableSet.copyOf(graph.nodes());
    }

    public synchronized ImmutableSet<String> getDependencies(String id) {
        return graph.nodes().contains(id) ? ImmutableSet.copyOf(graph.successors(id)) : ImmutableSet.of();
    }

    public synchronized ImmutableSet<String> getDependents(String id) {
        return graph.nodes().contains(id) ? ImmutableSet.copyOf(graph.predecessors(id)) : ImmutableSet.of();
    }

    public synchronized boolean hasDependency(String from, String to) {
        return graph.hasEdgeConnecting(from, to);
    }

    public synchronized int getEdgeCount() {
        return graph.edges().size();
    }

    /**
     * ids some module requires but no processed chunk declared
     */
    public synchronized Set<String> getUndeclaredModules() {
        Set<String> undeclared = new LinkedHashSet<>();
        for (String id : graph.nodes()) {
            if (!nodes.get(id).declared) {
                undeclared.add(id);
            }
        }
        return undeclared;
    }

    /**
     * the graph in the layout graphology imports
     */
    public synchronized IPersistentMap export() {
        ITransientCollection nodeMaps = PersistentVector.EMPTY.asTransient();
        for (String id : graph.nodes()) {
            ModuleNode node = nodes.get(id);
            nodeMaps = nodeMaps.conj(
                    RT.map(
                            KW_KEY, id,
                            KW_ATTRIBUTES, RT.map(
                                    KW_CHUNK_ID, node.chunkId,
                                    KW_COMMONJS, node.commonJs,
                                    KW_DECLARED, node.declared)));
        }

        ITransientCollection edgeMaps = PersistentVector.EMPTY.asTransient();
        for (EndpointPair<String> edge : graph.edges()) {
            edgeMaps = edgeMaps.conj(RT.map(KW_SOURCE, edge.source(), KW_TARGET, edge.target()));
        }

        return RT.map(
                KW_OPTIONS, RT.map(
                        KW_TYPE, "directed",
                        KW_MULTI, false,
                        KW_ALLOW_SELF_LOOPS, true),
                KW_NODES, nodeMaps.persistent(),
                KW_EDGES, edgeMaps.persistent());
    }
}
