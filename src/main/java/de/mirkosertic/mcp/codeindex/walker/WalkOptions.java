package de.mirkosertic.mcp.codeindex.walker;

import org.jspecify.annotations.Nullable;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Immutable options for a single directory walk.
 *
 * @param extensions       allowed file extensions, or {@code null} to allow all
 * @param includeGlobs     gitignore-style globs a file must match (if any are given)
 * @param excludeGlobs     gitignore-style globs that drop a file
 * @param respectGitignore honour the root level {@code .gitignore}
 * @param includeHidden    keep dot files and dot directories
 * @param followSymlinks   descend into symlinked directories
 * @param maxFileBytes     per file size cap, or {@code null} for none
 * @param maxTotalBytes    global byte budget for the whole walk, or {@code null} for none
 * @param binaryPolicy     what to do with binary files
 * @param excludeLockfiles drop files ending in {@code .lock}
 * @param encoding         charset used to decode file content
 */
public record WalkOptions(
        @Nullable List<String> extensions,
        List<String> includeGlobs,
        List<String> excludeGlobs,
        boolean respectGitignore,
        boolean includeHidden,
        boolean followSymlinks,
        @Nullable Long maxFileBytes,
        @Nullable Long maxTotalBytes,
        BinaryPolicy binaryPolicy,
        boolean excludeLockfiles,
        Charset encoding
) {

    public WalkOptions {
        extensions = extensions != null ? List.copyOf(extensions) : null;
        includeGlobs = includeGlobs != null ? List.copyOf(includeGlobs) : List.of();
        excludeGlobs = excludeGlobs != null ? List.copyOf(excludeGlobs) : List.of();
        binaryPolicy = binaryPolicy != null ? binaryPolicy : BinaryPolicy.SKIP;
        encoding = encoding != null ? encoding : StandardCharsets.UTF_8;
    }

    /**
     * Options with no filtering beyond the built-in exclusions.
     */
    public static WalkOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .extensions(extensions)
                .includeGlobs(includeGlobs)
                .excludeGlobs(excludeGlobs)
                .respectGitignore(respectGitignore)
                .includeHidden(includeHidden)
                .followSymlinks(followSymlinks)
                .maxFileBytes(maxFileBytes)
                .maxTotalBytes(maxTotalBytes)
                .binaryPolicy(binaryPolicy)
                .excludeLockfiles(excludeLockfiles)
                .encoding(encoding);
    }

    public static final class Builder {

        private @Nullable List<String> extensions;
        private List<String> includeGlobs = List.of();
        private List<String> excludeGlobs = List.of();
        private boolean respectGitignore = true;
        private boolean includeHidden;
        private boolean followSymlinks;
        private @Nullable Long maxFileBytes;
        private @Nullable Long maxTotalBytes;
        private BinaryPolicy binaryPolicy = BinaryPolicy.SKIP;
        private boolean excludeLockfiles;
        private Charset encoding = StandardCharsets.UTF_8;

        private Builder() {
        }

        public Builder extensions(final @Nullable List<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        public Builder includeGlobs(final List<String> includeGlobs) {
            this.includeGlobs = includeGlobs;
            return this;
        }

        public Builder excludeGlobs(final List<String> excludeGlobs) {
            this.excludeGlobs = excludeGlobs;
            return this;
        }

        public Builder respectGitignore(final boolean respectGitignore) {
            this.respectGitignore = respectGitignore;
            return this;
        }

        public Builder includeHidden(final boolean includeHidden) {
            this.includeHidden = includeHidden;
            return this;
        }

        public Builder followSymlinks(final boolean followSymlinks) {
            this.followSymlinks = followSymlinks;
            return this;
        }

        public Builder maxFileBytes(final @Nullable Long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
            return this;
        }

        public Builder maxTotalBytes(final @Nullable Long maxTotalBytes) {
            this.maxTotalBytes = maxTotalBytes;
            return this;
        }

        public Builder binaryPolicy(final BinaryPolicy binaryPolicy) {
            this.binaryPolicy = binaryPolicy;
            return this;
        }

        public Builder excludeLockfiles(final boolean excludeLockfiles) {
            this.excludeLockfiles = excludeLockfiles;
            return this;
        }

        public Builder encoding(final Charset encoding) {
            this.encoding = encoding;
            return this;
        }

        public WalkOptions build() {
            return new WalkOptions(extensions, includeGlobs, excludeGlobs, respectGitignore, includeHidden,
                    followSymlinks, maxFileBytes, maxTotalBytes, binaryPolicy, excludeLockfiles, encoding);
        }
    }
}
