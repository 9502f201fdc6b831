package webpackre.build;

import com.google.javascript.rhino.Node;

/**
 * a validated factory, its body statements moved into a SCRIPT of their own.
 */
public class ModuleFactory {
    public final String key;
    public final Node script;
    public final FactoryParams params;

    public ModuleFactory(String key, Node script, FactoryParams params) {
        this.key = key;
        this.script = script;
        this.params = params;
    }
}
