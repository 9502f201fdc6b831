package webpackre.build.closure;

import com.google.common.collect.ImmutableList;

/**
 * what pass 1 learned about one module, never changed once the scan is done.
 */
public final class ScanResult {

    private final boolean commonJs;
    private final boolean hasDefaultExport;
    private final ImmutableList<String> references;

    public ScanResult(boolean commonJs, boolean hasDefaultExport, ImmutableList<String> references) {
        this.commonJs = commonJs;
        this.hasDefaultExport = hasDefaultExport;
        this.references = references;
    }

    public boolean isCommonJs() {
        return commonJs;
    }

    public boolean hasDefaultExport() {
        return hasDefaultExport;
    }

    /**
     * raw keys of required modules, in order of first reference
     */
    public ImmutableList<String> getReferences() {
        return references;
    }

    @Override
    public String toString() {
        return "ScanResult{commonJs=" + commonJs + ", hasDefaultExport=" + hasDefaultExport + ", references=" + references + "}";
    }
}
