package webpackre.build;

import com.google.common.collect.ImmutableList;

public class ChunkMatch {
    public final String chunkId;
    public final ImmutableList<String> bundleIds;
    public final String globalName;
    public final String tableSource;

    public ChunkMatch(String chunkId, ImmutableList<String> bundleIds, String globalName, String tableSource) {
        this.chunkId = chunkId;
        this.bundleIds = bundleIds;
        this.globalName = globalName;
        this.tableSource = tableSource;
    }
}
