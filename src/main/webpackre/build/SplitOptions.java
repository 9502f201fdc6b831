package webpackre.build;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

public class SplitOptions {

    boolean esm = true;
    boolean annotateVariables = false;
    final Map<String, ModuleOverride> overrides = new HashMap<>();
    @Nullable DependencyGraph graph = null;

    public boolean isEsm() {
        return esm;
    }

    /**
     * false emits require/module.exports for every module, CommonJS modules always get them
     */
    public SplitOptions setEsm(boolean esm) {
        this.esm = esm;
        return this;
    }

    public boolean isAnnotateVariables() {
        return annotateVariables;
    }

    public SplitOptions setAnnotateVariables(boolean annotateVariables) {
        this.annotateVariables = annotateVariables;
        return this;
    }

    public Map<String, ModuleOverride> getOverrides() {
        return overrides;
    }

    public SplitOptions setOverride(String rawKey, ModuleOverride override) {
        overrides.put(Preconditions.checkNotNull(rawKey), Preconditions.checkNotNull(override));
        return this;
    }

    public SplitOptions setOverrides(Map<String, ModuleOverride> overrides) {
        this.overrides.clear();
        this.overrides.putAll(overrides);
        return this;
    }

    public @Nullable DependencyGraph getGraph() {
        return graph;
    }

    /**
     * shared by all chunks split with these options
     */
    public SplitOptions setGraph(@Nullable DependencyGraph graph) {
        this.graph = graph;
        return this;
    }
}
