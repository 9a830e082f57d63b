package de.mirkosertic.mcp.codeindex.index;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Maps an indexed root to its storage directory.
 * <p>
 * The directory name is the first 16 hex characters of the SHA-256 of the root's
 * absolute path, so the same root always reopens the same index and different
 * roots never share one.
 */
public final class IndexPaths {

    static final int ROOT_HASH_LENGTH = 16;

    private IndexPaths() {
    }

    /**
     * Canonical form of a root: the real path if it exists, otherwise the normalized absolute path.
     */
    public static Path normalizeRoot(final Path root) {
        try {
            return root.toRealPath();
        } catch (final IOException e) {
            return root.toAbsolutePath().normalize();
        }
    }

    public static String rootHash(final Path root) {
        return ContentFingerprinter.fingerprint(normalizeRoot(root).toString()).substring(0, ROOT_HASH_LENGTH);
    }

    public static Path indexPathFor(final Path indexDirectory, final Path root) {
        return indexDirectory.resolve(rootHash(root));
    }
}
