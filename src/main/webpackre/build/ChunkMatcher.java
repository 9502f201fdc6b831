package webpackre.build;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * recognizes the jsonp wrapper webpack puts around every chunk
 * <p>
 * (self.webpackChunk_app = self.webpackChunk_app || []).push([[179], {...}]);
 */
public class ChunkMatcher {

    static final Pattern CHUNK = Pattern.compile(
            "^\\s*(?:(['\"])use strict\\1\\s*;?\\s*)?"
                    + "\\(\\s*((?:(?:self|this|window|globalThis)\\s*\\.\\s*)?[A-Za-z_$][\\w$]*)\\s*=\\s*\\2\\s*\\|\\|\\s*\\[\\s*\\]\\s*\\)"
                    + "\\s*\\.\\s*push\\s*\\(\\s*\\[\\s*(\\[[^\\[\\]]*\\]|\\d+)\\s*,\\s*([\\[{].*[\\]}])\\s*\\]\\s*\\)"
                    + "\\s*;?(?:\\s*//[^\\n]*)*\\s*$",
            Pattern.DOTALL);

    static final Pattern ID_LITERAL = Pattern.compile("\\s*(\\d+|\"([^\"\\\\]*)\"|'([^'\\\\]*)')\\s*");

    private ChunkMatcher() {
    }

    public static @Nullable ChunkMatch match(String source) {
        Matcher m = CHUNK.matcher(source);
        if (!m.matches()) {
            return null;
        }

        ImmutableList<String> ids = parseIds(m.group(3));
        if (ids == null) {
            return null;
        }

        String globalName = m.group(2).replaceAll("\\s", "");
        return new ChunkMatch(ids.get(0), ids, globalName, m.group(4));
    }

    static @Nullable ImmutableList<String> parseIds(String literal) {
        if (!literal.startsWith("[")) {
            return ImmutableList.of(literal);
        }

        String inner = literal.substring(1, literal.length() - 1);
        if (inner.trim().isEmpty()) {
            return null;
        }

        ImmutableList.Builder<String> ids = ImmutableList.builder();
        for (String part : inner.split(",", -1)) {
            Matcher m = ID_LITERAL.matcher(part);
            if (!m.matches()) {
                return null;
            }
            if (m.group(2) != null) {
                ids.add(m.group(2));
            } else if (m.group(3) != null) {
                ids.add(m.group(3));
            } else {
                ids.add(m.group(1));
            }
        }
        return ids.build();
    }
}
