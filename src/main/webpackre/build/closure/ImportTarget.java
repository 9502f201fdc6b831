package webpackre.build.closure;

/**
 * a required module as seen by the module requiring it.
 */
public class ImportTarget {
    public final String path;
    public final boolean hasDefaultExport;

    public ImportTarget(String path, boolean hasDefaultExport) {
        this.path = path;
        this.hasDefaultExport = hasDefaultExport;
    }
}
