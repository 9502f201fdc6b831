package webpackre.build;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;

/**
 * the parameter names webpack module factories use, by position.
 * <p>
 * slot 0 is the module object, slot 1 the exports object and slot 2 the internal
 * require function. a chunk minifies them the same way in every factory, so the
 * first factory declaring a slot fixes its name for the whole chunk.
 */
public final class FactoryParams {

    public static final int MODULE = 0;
    public static final int EXPORTS = 1;
    public static final int REQUIRE = 2;

    public static final int MAX_SLOTS = 3;

    public static final FactoryParams EMPTY = new FactoryParams(new String[0]);

    private final String[] names;

    private FactoryParams(String[] names) {
        this.names = names;
    }

    public static FactoryParams of(String... names) {
        Preconditions.checkArgument(names.length <= MAX_SLOTS, "too many slots: %s", names.length);
        for (String name : names) {
            Preconditions.checkNotNull(name);
        }
        return new FactoryParams(names.clone());
    }

    public int size() {
        return names.length;
    }

    public boolean has(int slot) {
        return slot < names.length;
    }

    public @Nullable String get(int slot) {
        return slot < names.length ? names[slot] : null;
    }

    public @Nullable String getModuleName() {
        return get(MODULE);
    }

    public @Nullable String getExportsName() {
        return get(EXPORTS);
    }

    public @Nullable String getRequireName() {
        return get(REQUIRE);
    }

    /**
     * @return first slot both declare with different names, -1 if they agree
     */
    public int findConflict(FactoryParams other) {
        int shared = Math.min(names.length, other.names.length);
        for (int i = 0; i < shared; i++) {
            if (!names[i].equals(other.names[i])) {
                return i;
            }
        }
        return -1;
    }

    /**
     * slots already fixed keep their names, new slots are taken from other.
     */
    public FactoryParams unify(FactoryParams other) {
        if (other.names.length <= names.length) {
            return this;
        }
        String[] unified = Arrays.copyOf(other.names, other.names.length);
        System.arraycopy(names, 0, unified, 0, names.length);
        return new FactoryParams(unified);
    }

    public FactoryParams limit(int count) {
        if (count >= names.length) {
            return this;
        }
        return new FactoryParams(Arrays.copyOf(names, count));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactoryParams)) return false;
        return Arrays.equals(names, ((FactoryParams) o).names);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(names);
    }

    @Override
    public String toString() {
        return "FactoryParams" + Arrays.toString(names);
    }
}
