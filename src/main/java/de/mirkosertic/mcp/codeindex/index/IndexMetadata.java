package de.mirkosertic.mcp.codeindex.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-root bookkeeping of which relative paths were indexed with which content hash.
 * Loaded once per build, mutated in memory, written back in full at the end.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IndexMetadata {

    /**
     * State of one indexed file.
     *
     * @param sha256    content fingerprint at indexing time
     * @param indexedAt ISO-8601 UTC timestamp of the indexing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileRecord(
            @JsonProperty("sha256") String sha256,
            @JsonProperty("indexed_at") String indexedAt
    ) {
    }

    private String root;
    private final TreeMap<String, FileRecord> files;

    @JsonCreator
    public IndexMetadata(@JsonProperty("root") final String root,
                         @JsonProperty("files") final @Nullable Map<String, FileRecord> files) {
        this.root = root;
        this.files = files != null ? new TreeMap<>(files) : new TreeMap<>();
    }

    public static IndexMetadata empty(final String root) {
        return new IndexMetadata(root, null);
    }

    @JsonGetter("root")
    public String getRoot() {
        return root;
    }

    public void setRoot(final String root) {
        this.root = root;
    }

    @JsonGetter("files")
    public Map<String, FileRecord> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    public @Nullable FileRecord fileRecord(final String path) {
        return files.get(path);
    }

    /**
     * @return {@code true} if the stored hash for {@code path} equals {@code sha256}
     */
    public boolean isUnchanged(final String path, final String sha256) {
        final FileRecord record = files.get(path);
        return record != null && sha256.equals(record.sha256());
    }

    public void recordFile(final String path, final String sha256, final String indexedAt) {
        files.put(path, new FileRecord(sha256, indexedAt));
    }

    public void removeFile(final String path) {
        files.remove(path);
    }

    public Set<String> paths() {
        return Collections.unmodifiableSet(files.keySet());
    }
}
