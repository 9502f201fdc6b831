package webpackre.build.closure;

import com.google.javascript.jscomp.BasicErrorManager;
import com.google.javascript.jscomp.CheckLevel;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * keeps every reported diagnostic around so callers (and tests) can look at them later
 * and logs them as they come in, warnings at WARNING and errors at SEVERE.
 */
public class ErrorCollector extends BasicErrorManager {

    private static final Logger LOG = Logger.getLogger("webpackre");

    private final List<JSError> diagnostics = new ArrayList<>();

    @Override
    public synchronized void report(CheckLevel level, JSError error) {
        super.report(level, error);
        diagnostics.add(error);
        println(level, error);
    }

    @Override
    public void println(CheckLevel level, JSError error) {
        Level logLevel = level == CheckLevel.ERROR ? Level.SEVERE : Level.WARNING;
        if (level != CheckLevel.OFF && LOG.isLoggable(logLevel)) {
            LOG.log(logLevel, format(error));
        }
    }

    @Override
    protected void printSummary() {
        if (getErrorCount() + getWarningCount() > 0) {
            LOG.log(Level.INFO, "{0} error(s), {1} warning(s)", new Object[]{getErrorCount(), getWarningCount()});
        }
    }

    public static String format(JSError error) {
        String source = error.getSourceName();
        if (source == null) {
            return error.getDescription();
        }
        return String.format("%s:%d:%d %s", source, error.getLineno(), error.getCharno(), error.getDescription());
    }

    public synchronized List<JSError> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public synchronized List<JSError> getDiagnostics(DiagnosticType type) {
        List<JSError> result = new ArrayList<>();
        for (JSError error : diagnostics) {
            if (error.getType().equals(type)) {
                result.add(error);
            }
        }
        return result;
    }

    public boolean hasDiagnostic(DiagnosticType type) {
        return !getDiagnostics(type).isEmpty();
    }
}
