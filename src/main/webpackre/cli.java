package webpackre;

import clojure.lang.RT;
import webpackre.build.Chunk;
import webpackre.build.ChunkModule;
import webpackre.build.ChunkSplitter;
import webpackre.build.DependencyGraph;
import webpackre.build.SplitOptions;
import webpackre.util.FS;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * cli [--commonjs] [--annotate] outdir chunk-file-or-dir...
 * <p>
 * writes one file per module and the dependency graph as graph.edn into outdir.
 */
public class cli {

    private static final Logger LOG = Logger.getLogger("webpackre");

    static void usage() {
        System.err.println("usage: cli [--commonjs] [--annotate] <outdir> <chunk-file-or-dir>...");
        System.exit(1);
    }

    public static void main(String[] args) throws Exception {
        SplitOptions options = new SplitOptions();
        List<String> rest = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("--commonjs")) {
                options.setEsm(false);
            } else if (arg.equals("--annotate")) {
                options.setAnnotateVariables(true);
            } else if (arg.startsWith("--")) {
                usage();
            } else {
                rest.add(arg);
            }
        }

        if (rest.size() < 2) {
            usage();
        }

        Path outdir = Paths.get(rest.get(0));

        Map<String, String> sources = new LinkedHashMap<>();
        for (String input : rest.subList(1, rest.size())) {
            Path path = Paths.get(input);
            List<Path> files = Files.isDirectory(path) ? FS.findFilesByExt(path, "js") : Collections.singletonList(path);
            for (Path file : files) {
                sources.put(file.toString(), new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            }
        }

        DependencyGraph graph = new DependencyGraph();
        options.setGraph(graph);

        Map<String, Chunk> chunks;
        ExecutorService executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors());
        try {
            chunks = new ChunkSplitter(options).splitAll(sources, executor);
        } finally {
            executor.shutdown();
        }

        for (String name : sources.keySet()) {
            if (!chunks.containsKey(name)) {
                LOG.warning("Invalid chunk: " + name);
            }
        }

        Files.createDirectories(outdir);
        int written = 0;
        for (Chunk chunk : chunks.values()) {
            for (ChunkModule module : chunk.getModules().values()) {
                Path file = FS.outputFile(outdir, module.getId(), "js");
                Files.createDirectories(file.getParent());
                Files.write(file, module.getSource().getBytes(StandardCharsets.UTF_8));
                written++;
            }
        }

        for (String id : graph.getUndeclaredModules()) {
            LOG.warning("Undeclared module: " + id);
        }

        Files.write(outdir.resolve("graph.edn"), RT.printString(graph.export()).getBytes(StandardCharsets.UTF_8));
        LOG.info("wrote " + written + " modules of " + chunks.size() + " chunks to " + outdir);
    }
}
