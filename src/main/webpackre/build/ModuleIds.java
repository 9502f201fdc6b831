package webpackre.build;

import org.jspecify.annotations.Nullable;

import java.util.Map;

public class ModuleIds {

    static final String RELATIVE_PREFIX = "./";

    private ModuleIds() {
    }

    public static ModuleId resolve(String rawKey, @Nullable ModuleOverride override) {
        if (override == null) {
            return new ModuleId(rawKey, RELATIVE_PREFIX + rawKey);
        }

        String id = override.renameTo != null ? override.renameTo : rawKey;
        return new ModuleId(id, override.absolute ? id : RELATIVE_PREFIX + id);
    }

    public static ModuleId resolve(String rawKey, Map<String, ModuleOverride> overrides) {
        return resolve(rawKey, overrides.get(rawKey));
    }
}
