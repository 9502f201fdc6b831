package webpackre.build;

import java.util.Objects;

public final class ModuleId {
    private final String id;
    private final String importPath;

    public ModuleId(String id, String importPath) {
        this.id = id;
        this.importPath = importPath;
    }

    /**
     * the id used for graph nodes and output files
     */
    public String getId() {
        return id;
    }

    public String getImportPath() {
        return importPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleId)) return false;
        ModuleId other = (ModuleId) o;
        return id.equals(other.id) && importPath.equals(other.importPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, importPath);
    }

    @Override
    public String toString() {
        return id + " (" + importPath + ")";
    }
}
