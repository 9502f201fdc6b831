package webpackre.build.closure;

import clojure.lang.IPersistentMap;
import clojure.lang.Keyword;
import clojure.lang.RT;

public class BindingAnnotation {

    public static final Keyword KW_ORDINAL = RT.keyword(null, "ordinal");
    public static final Keyword KW_NAME = RT.keyword(null, "name");
    public static final Keyword KW_ORIGINAL_NAME = RT.keyword(null, "original-name");
    public static final Keyword KW_LINE = RT.keyword(null, "line");
    public static final Keyword KW_COLUMN = RT.keyword(null, "column");

    public final int ordinal;
    public final String name;
    public final String originalName;
    public final int line;
    public final int column;

    public BindingAnnotation(int ordinal, String name, String originalName, int line, int column) {
        this.ordinal = ordinal;
        this.name = name;
        this.originalName = originalName;
        this.line = line;
        this.column = column;
    }

    public IPersistentMap asMap() {
        return RT.map(
                KW_ORDINAL, ordinal,
                KW_NAME, name,
                KW_ORIGINAL_NAME, originalName,
                KW_LINE, line,
                KW_COLUMN, column);
    }

    public String describe() {
        String was = name.equals(originalName) ? "" : " was " + originalName;
        return "#" + ordinal + " " + name + was + " at " + line + ":" + column;
    }

    @Override
    public String toString() {
        return ordinal + ":" + (name.equals(originalName) ? name : originalName + "->" + name) + "@" + line + ":" + column;
    }
}
