package webpackre.build;

import org.junit.Test;

import static com.google.common.truth.Truth.assertThat;

public class ChunkMatcherTest {

    static final String TABLE = "{10: function(e, t, n) { n.r(t); }, 11: (e) => { e.exports = 1; }}";

    @Test
    public void webpack5Chunk() {
        ChunkMatch match = ChunkMatcher.match("(self.webpackChunk_app = self.webpackChunk_app || []).push([[179], " + TABLE + "]);");

        assertThat(match).isNotNull();
        assertThat(match.chunkId).isEqualTo("179");
        assertThat(match.bundleIds).containsExactly("179");
        assertThat(match.globalName).isEqualTo("self.webpackChunk_app");
        assertThat(match.tableSource).isEqualTo(TABLE);
    }

    @Test
    public void multipleIds() {
        ChunkMatch match = ChunkMatcher.match("(self.c = self.c || []).push([[\"main\", 4], " + TABLE + "]);");

        assertThat(match).isNotNull();
        assertThat(match.chunkId).isEqualTo("main");
        assertThat(match.bundleIds).containsExactly("main", "4").inOrder();
    }

    @Test
    public void numericIdAndRuntime() {
        ChunkMatch match = ChunkMatcher.match(
                "\"use strict\";\n(window.webpackJsonp = window.webpackJsonp || []).push([7, "
                        + TABLE + ", [[10, 1]]]);\n//# sourceMappingURL=7.js.map\n");

        assertThat(match).isNotNull();
        assertThat(match.chunkId).isEqualTo("7");
        assertThat(match.globalName).isEqualTo("window.webpackJsonp");
        assertThat(match.tableSource).startsWith("{10:");
        assertThat(match.tableSource).endsWith("]]");
    }

    @Test
    public void bareGlobal() {
        assertThat(ChunkMatcher.match("(webpackJsonp = webpackJsonp || []).push([[1], [function(){}]])")).isNotNull();
    }

    @Test
    public void rejectsCorruptedGuard() {
        assertThat(ChunkMatcher.match("(self.c = self.c && []).push([[1], " + TABLE + "]);")).isNull();
        assertThat(ChunkMatcher.match("(self.c = self.d || []).push([[1], " + TABLE + "]);")).isNull();
        assertThat(ChunkMatcher.match("(self.c = []).push([[1], " + TABLE + "]);")).isNull();
        assertThat(ChunkMatcher.match("self.c.push([[1], " + TABLE + "]);")).isNull();
    }

    @Test
    public void rejectsNonLiteralIds() {
        assertThat(ChunkMatcher.match("(self.c = self.c || []).push([[a], " + TABLE + "]);")).isNull();
        assertThat(ChunkMatcher.match("(self.c = self.c || []).push([a, " + TABLE + "]);")).isNull();
        assertThat(ChunkMatcher.match("(self.c = self.c || []).push([[], " + TABLE + "]);")).isNull();
    }

    @Test
    public void rejectsOtherCode() {
        assertThat(ChunkMatcher.match("")).isNull();
        assertThat(ChunkMatcher.match("console.log(1);")).isNull();
        assertThat(ChunkMatcher.match("foo();\n(self.c = self.c || []).push([[1], " + TABLE + "]);")).isNull();
        assertThat(ChunkMatcher.match("(self.c = self.c || []).push([[1]]);")).isNull();
    }
}
