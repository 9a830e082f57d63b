package de.mirkosertic.mcp.codeindex.index;

import org.jspecify.annotations.Nullable;

/**
 * One ranked hit.
 *
 * @param path      relative POSIX path
 * @param score     relevance, higher is better
 * @param language  language tag derived from the extension
 * @param docId     sequential id assigned when the document was written
 * @param sha256    content fingerprint at indexing time
 * @param bytesSize file size at indexing time
 * @param snippet   always {@code null}, content is not stored
 */
public record SearchResult(
        String path,
        float score,
        String language,
        String docId,
        String sha256,
        long bytesSize,
        @Nullable String snippet
) {
}
