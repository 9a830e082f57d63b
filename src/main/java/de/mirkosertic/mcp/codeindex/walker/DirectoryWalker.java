package de.mirkosertic.mcp.codeindex.walker;

import de.mirkosertic.mcp.codeindex.error.InputException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a directory tree depth-first and collects readable text files.
 * <p>
 * Excluded directories are pruned before descending. Each remaining file passes these
 * checks in order: default excluded file name, lockfile suffix, hidden name, extension
 * allow-list, include globs, exclude globs, root {@code .gitignore}. Survivors are checked
 * against the per-file and total byte caps, sniffed for binary content and decoded with
 * the configured charset, replacing undecodable bytes.
 * <p>
 * Per-file I/O failures become warnings. Only a binary file under
 * {@link BinaryPolicy#ERROR} aborts the walk.
 */
public class DirectoryWalker {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWalker.class);

    static final Set<String> DEFAULT_EXCLUDE_DIRS = Set.of(
            ".git", ".hg", ".svn",
            "__pycache__",
            "node_modules",
            ".venv", "venv",
            "dist", "build"
    );

    static final Set<String> DEFAULT_EXCLUDE_FILES = Set.of(
            ".DS_Store",
            "Thumbs.db"
    );

    static final String LOCKFILE_SUFFIX = ".lock";
    static final String TOTAL_LIMIT_WARNING = "Total byte limit reached; remaining files skipped.";

    /**
     * Collect all eligible files below {@code root}.
     *
     * @throws InputException if the root is not a directory, or a binary file is found
     *                        under {@link BinaryPolicy#ERROR}
     */
    public WalkResult collect(final Path root, final WalkOptions options) throws InputException {
        if (!Files.isDirectory(root)) {
            throw new InputException("Input path is not a directory.",
                    "'" + root + "' does not exist or is not a directory.",
                    "Point to an existing folder.");
        }

        final Path resolvedRoot;
        try {
            resolvedRoot = root.toRealPath();
        } catch (final IOException e) {
            throw new InputException("Input path cannot be resolved.",
                    "'" + root + "': " + e.getMessage(),
                    "Check the permissions of the directory.");
        }

        final Collector collector = new Collector(resolvedRoot, options);
        final Set<FileVisitOption> visitOptions = options.followSymlinks()
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);
        try {
            Files.walkFileTree(resolvedRoot, visitOptions, Integer.MAX_VALUE, collector);
        } catch (final IOException e) {
            collector.warnings.add("Failed to walk " + resolvedRoot + ": " + e.getMessage());
        }

        if (collector.fatal != null) {
            throw collector.fatal;
        }

        collector.files.sort(Comparator.comparing(FileEntry::path));
        logger.debug("Collected {} files ({} bytes, {} warnings, truncated={}) below {}",
                collector.files.size(), collector.totalBytes, collector.warnings.size(),
                collector.truncated, resolvedRoot);
        return new WalkResult(collector.files, collector.warnings, collector.truncated, collector.totalBytes);
    }

    static @Nullable Set<String> normalizeExtensions(final @Nullable List<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return null;
        }
        final Set<String> normalized = new HashSet<>();
        for (final String extension : extensions) {
            String value = extension.toLowerCase(Locale.ROOT);
            if (!value.startsWith(".")) {
                value = "." + value;
            }
            normalized.add(value);
        }
        return normalized;
    }

    /**
     * Last suffix of the file name including the dot, or an empty string.
     */
    static String suffix(final String fileName) {
        final int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(lastDot);
    }

    static String toPosix(final Path relative) {
        final StringBuilder result = new StringBuilder();
        for (final Path element : relative) {
            if (!result.isEmpty()) {
                result.append('/');
            }
            result.append(element);
        }
        return result.toString();
    }

    private static final class Collector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final WalkOptions options;
        private final @Nullable Set<String> extensions;
        private final @Nullable GitWildMatcher includes;
        private final @Nullable GitWildMatcher excludes;
        private final @Nullable GitWildMatcher gitignore;

        private final List<FileEntry> files = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private long totalBytes;
        private boolean truncated;
        private @Nullable InputException fatal;

        Collector(final Path root, final WalkOptions options) {
            this.root = root;
            this.options = options;
            this.extensions = normalizeExtensions(options.extensions());
            this.includes = options.includeGlobs().isEmpty() ? null : GitWildMatcher.fromPatterns(options.includeGlobs());
            this.excludes = options.excludeGlobs().isEmpty() ? null : GitWildMatcher.fromPatterns(options.excludeGlobs());
            this.gitignore = options.respectGitignore() ? GitWildMatcher.fromGitignore(root) : null;
        }

        @Override
        public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            final String name = dir.getFileName().toString();
            if (DEFAULT_EXCLUDE_DIRS.contains(name)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (!options.includeHidden() && name.startsWith(".")) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (gitignore != null && gitignore.matchesDirectory(relative(dir))) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
            if (!attrs.isRegularFile() && !(attrs.isSymbolicLink() && Files.isRegularFile(file))) {
                return FileVisitResult.CONTINUE;
            }

            final String relativePath = relative(file);
            if (shouldSkip(relativePath, file.getFileName().toString())) {
                return FileVisitResult.CONTINUE;
            }

            final long size;
            try {
                size = Files.size(file);
            } catch (final IOException e) {
                warnings.add("Failed to stat " + relativePath + ": " + e.getMessage());
                return FileVisitResult.CONTINUE;
            }

            final Long maxFileBytes = options.maxFileBytes();
            if (maxFileBytes != null && size > maxFileBytes) {
                warnings.add("Skipping " + relativePath + " (size " + size + " > max " + maxFileBytes + ")");
                return FileVisitResult.CONTINUE;
            }

            final Long maxTotalBytes = options.maxTotalBytes();
            if (maxTotalBytes != null && totalBytes + size > maxTotalBytes) {
                warnings.add(TOTAL_LIMIT_WARNING);
                truncated = true;
                return FileVisitResult.TERMINATE;
            }

            if (BinaryContentDetector.isBinary(file)) {
                if (options.binaryPolicy() == BinaryPolicy.ERROR) {
                    fatal = new InputException("Binary file detected.",
                            "'" + relativePath + "' appears to be binary.",
                            "Remove the file or adjust binary handling.");
                    return FileVisitResult.TERMINATE;
                }
                warnings.add("Skipping binary file " + relativePath + ".");
                return FileVisitResult.CONTINUE;
            }

            final String content;
            try {
                content = decode(Files.readAllBytes(file), options.encoding());
            } catch (final IOException e) {
                warnings.add("Failed to read " + relativePath + ": " + e.getMessage());
                return FileVisitResult.CONTINUE;
            }

            files.add(new FileEntry(relativePath, size, content));
            totalBytes += size;
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
            warnings.add("Failed to access " + relative(file) + ": " + exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(final Path dir, final @Nullable IOException exc) {
            if (exc != null) {
                warnings.add("Failed to list " + relative(dir) + ": " + exc.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        private boolean shouldSkip(final String relativePath, final String name) {
            if (DEFAULT_EXCLUDE_FILES.contains(name)) {
                return true;
            }
            if (options.excludeLockfiles() && name.endsWith(LOCKFILE_SUFFIX)) {
                return true;
            }
            if (!options.includeHidden() && name.startsWith(".")) {
                return true;
            }
            if (extensions != null && !extensions.contains(suffix(name).toLowerCase(Locale.ROOT))) {
                return true;
            }
            if (includes != null && !includes.matchesFile(relativePath)) {
                return true;
            }
            if (excludes != null && excludes.matchesFile(relativePath)) {
                return true;
            }
            return gitignore != null && gitignore.matchesFile(relativePath);
        }

        private String relative(final Path path) {
            return toPosix(root.relativize(path));
        }
    }

    private static String decode(final byte[] bytes, final Charset charset) throws CharacterCodingException {
        final CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }
}
