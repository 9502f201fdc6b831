package webpackre.build;

import com.google.javascript.rhino.Node;

/**
 * one key/factory pair of a module table, the factory is not validated yet.
 */
public class ModuleEntry {
    public final String key;
    public final Node keyNode;
    public final Node factory;

    public ModuleEntry(String key, Node keyNode, Node factory) {
        this.key = key;
        this.keyNode = keyNode;
        this.factory = factory;
    }

    @Override
    public String toString() {
        return "ModuleEntry{" + key + "}";
    }
}
