package webpackre.build;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;
import webpackre.build.closure.BindingAnnotation;
import webpackre.build.closure.ErrorCollector;
import webpackre.build.closure.ExportImportScanner;
import webpackre.build.closure.ImportTarget;
import webpackre.build.closure.ModuleRewriter;
import webpackre.build.closure.ModuleSymbols;
import webpackre.build.closure.ParserHelper;
import webpackre.build.closure.RewriteContext;
import webpackre.build.closure.ScanResult;
import webpackre.build.closure.VariableAnnotator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * splits a webpack chunk into its modules.
 * <p>
 * every module of a chunk is scanned before the first one is rewritten, whether a
 * require becomes a default or a namespace import depends on the required module.
 */
public class ChunkSplitter {

    private static final Logger LOG = Logger.getLogger(ChunkSplitter.class.getName());

    final SplitOptions options;

    public ChunkSplitter(SplitOptions options) {
        this.options = options;
    }

    public ChunkSplitter() {
        this(new SplitOptions());
    }

    /**
     * @return null if the source is not a webpack chunk
     */
    public @Nullable Chunk split(String name, String source) {
        return split(name, source, new ErrorCollector());
    }

    public @Nullable Chunk split(String name, String source, ErrorCollector errors) {
        ChunkMatch match = ChunkMatcher.match(source);
        if (match == null) {
            return null;
        }

        String chunkId = match.chunkId;
        Compiler cc = ParserHelper.createCompiler(errors);

        List<ModuleEntry> entries = new ModuleTableExtractor(cc, chunkId).extract(name, match.tableSource);
        if (entries == null) {
            return null;
        }

        FactoryValidator validator = new FactoryValidator(cc, chunkId);
        Map<String, ModuleFactory> factories = new LinkedHashMap<>();
        for (ModuleEntry entry : entries) {
            ModuleFactory factory = validator.validate(entry);
            if (factory != null) {
                factories.put(entry.key, factory);
            }
        }

        DependencyGraph graph = options.getGraph();

        // pass 1
        Map<String, ScanResult> scans = new LinkedHashMap<>();
        for (ModuleFactory factory : factories.values()) {
            ScanResult scan = ExportImportScanner.scan(cc, factory.script, factory.params, chunkId, factory.key);
            scans.put(factory.key, scan);

            if (graph != null) {
                String id = resolve(factory.key).getId();
                graph.addModule(id, chunkId, scan.isCommonJs());
                for (String reference : scan.getReferences()) {
                    graph.addDependency(id, resolve(reference).getId());
                }
            }
        }

        // pass 2 and 3
        Map<String, ChunkModule> modules = new LinkedHashMap<>();
        for (ModuleFactory factory : factories.values()) {
            ChunkModule module = rewrite(cc, chunkId, factory, scans);
            if (modules.containsKey(module.getId())) {
                LOG.warning("[chunk-" + chunkId + "] [module-" + factory.key + "] replaces module " + module.getId());
            }
            modules.put(module.getId(), module);

            if (graph != null) {
                graph.addModule(module);
            }
        }

        LOG.fine("[chunk-" + chunkId + "] " + modules.size() + " of " + entries.size() + " modules");
        return new Chunk(chunkId, match.bundleIds, match.globalName, ImmutableMap.copyOf(modules));
    }

    ChunkModule rewrite(Compiler cc, String chunkId, ModuleFactory factory, Map<String, ScanResult> scans) {
        ScanResult scan = scans.get(factory.key);
        ModuleId moduleId = resolve(factory.key);

        RewriteContext context = new RewriteContext(
                chunkId,
                factory.key,
                factory.params,
                options.isEsm() && !scan.isCommonJs(),
                rawKey -> importTarget(rawKey, scans));

        Node script = factory.script;
        ModuleSymbols symbols = ModuleRewriter.rewrite(cc, script, context);

        ModuleOverride override = options.getOverrides().get(factory.key);
        ImmutableList<BindingAnnotation> annotations = ImmutableList.of();
        if (options.isAnnotateVariables() || (override != null && !override.getVariableRenames().isEmpty())) {
            VariableAnnotator annotator = new VariableAnnotator(cc, symbols, chunkId, factory.key);
            annotations = ImmutableList.copyOf(
                    annotator.annotate(override != null ? override.getVariableRenames() : ImmutableMap.of()));
        }

        String source = ParserHelper.toSource(cc, script);
        if (options.isAnnotateVariables() && !annotations.isEmpty()) {
            source = VariableAnnotator.toHeader(annotations) + source;
        }

        Set<String> imports = new LinkedHashSet<>();
        for (String reference : scan.getReferences()) {
            imports.add(resolve(reference).getId());
        }

        return new ChunkModule(
                factory.key,
                moduleId,
                chunkId,
                script,
                scan.isCommonJs(),
                scan.hasDefaultExport(),
                ImmutableList.copyOf(imports),
                source,
                annotations);
    }

    ImportTarget importTarget(String rawKey, Map<String, ScanResult> scans) {
        ScanResult scan = scans.get(rawKey);
        // modules of other chunks are unknown, a namespace import works either way
        return new ImportTarget(resolve(rawKey).getImportPath(), scan != null && scan.hasDefaultExport());
    }

    ModuleId resolve(String rawKey) {
        return ModuleIds.resolve(rawKey, options.getOverrides());
    }

    /**
     * splits every source on the executor, the results keep the order of sources.
     * sources that are not chunks are missing from the result.
     */
    public Map<String, Chunk> splitAll(Map<String, String> sources, ExecutorService executor)
            throws InterruptedException, ExecutionException {
        Map<String, Future<Chunk>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            futures.put(source.getKey(), executor.submit(() -> split(source.getKey(), source.getValue())));
        }

        Map<String, Chunk> chunks = new LinkedHashMap<>();
        for (Map.Entry<String, Future<Chunk>> future : futures.entrySet()) {
            Chunk chunk = future.getValue().get();
            if (chunk != null) {
                chunks.put(future.getKey(), chunk);
            }
        }
        return chunks;
    }

    /**
     * ids required by any of the chunks but declared by none of them, each reported once
     */
    public static Set<String> findUndeclaredModules(Collection<Chunk> chunks) {
        Set<String> declared = new LinkedHashSet<>();
        Set<String> imported = new LinkedHashSet<>();
        for (Chunk chunk : chunks) {
            declared.addAll(chunk.getModules().keySet());
            imported.addAll(chunk.getImportedModules());
        }

        List<String> undeclared = new ArrayList<>(imported);
        undeclared.removeAll(declared);
        return new LinkedHashSet<>(undeclared);
    }
}
