package webpackre.build;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * user supplied changes for one module, keyed by the raw module key.
 */
public class ModuleOverride {

    final @Nullable String renameTo;
    final boolean absolute;
    final ImmutableMap<Integer, String> variableRenames;

    public ModuleOverride(@Nullable String renameTo, boolean absolute, Map<Integer, String> variableRenames) {
        this.renameTo = renameTo;
        this.absolute = absolute;
        this.variableRenames = ImmutableMap.copyOf(variableRenames);
    }

    public static ModuleOverride rename(String renameTo) {
        return new ModuleOverride(renameTo, false, ImmutableMap.of());
    }

    public static ModuleOverride absolute(String renameTo) {
        return new ModuleOverride(renameTo, true, ImmutableMap.of());
    }

    public static ModuleOverride variables(Map<Integer, String> renames) {
        return new ModuleOverride(null, false, renames);
    }

    public @Nullable String getRenameTo() {
        return renameTo;
    }

    public boolean isAbsolute() {
        return absolute;
    }

    /**
     * new names by binding ordinal, see {@link webpackre.build.closure.VariableAnnotator}
     */
    public ImmutableMap<Integer, String> getVariableRenames() {
        return variableRenames;
    }
}
