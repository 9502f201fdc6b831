package webpackre.build.closure;

import webpackre.build.FactoryParams;

import java.util.function.Function;

/**
 * everything the rewrite of one module needs to know about the rest of the chunk.
 */
public class RewriteContext {

    public final String chunkId;
    public final String moduleKey;
    public final FactoryParams params;
    public final boolean esmOutput;

    private final Function<String, ImportTarget> targets;

    public RewriteContext(String chunkId, String moduleKey, FactoryParams params, boolean esmOutput, Function<String, ImportTarget> targets) {
        this.chunkId = chunkId;
        this.moduleKey = moduleKey;
        this.params = params;
        this.esmOutput = esmOutput;
        this.targets = targets;
    }

    /**
     * @param rawKey the key as used in the require call
     */
    public ImportTarget resolve(String rawKey) {
        return targets.apply(rawKey);
    }
}
