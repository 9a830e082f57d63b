package de.mirkosertic.mcp.codeindex.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes {@code metadata.json} inside an index directory.
 * <p>
 * A missing, unreadable or malformed file loads as empty metadata so that a corrupt
 * file only costs a re-index, never a failure. Saves always write the full structure
 * through a temporary file that is moved into place.
 * <p>
 * Not safe for concurrent writers on the same index path.
 */
public class IndexMetadataStore {

    private static final Logger logger = LoggerFactory.getLogger(IndexMetadataStore.class);

    public static final String METADATA_FILE = "metadata.json";

    private final ObjectMapper objectMapper;

    public IndexMetadataStore() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public IndexMetadata load(final Path indexPath, final String root) {
        final Path metadataPath = indexPath.resolve(METADATA_FILE);
        if (!Files.exists(metadataPath)) {
            return IndexMetadata.empty(root);
        }
        try {
            final IndexMetadata metadata = objectMapper.readValue(metadataPath.toFile(), IndexMetadata.class);
            if (metadata == null) {
                return IndexMetadata.empty(root);
            }
            if (metadata.getRoot() == null) {
                metadata.setRoot(root);
            }
            return metadata;
        } catch (final IOException e) {
            logger.warn("Ignoring unreadable index metadata {}: {}", metadataPath, e.getMessage());
            return IndexMetadata.empty(root);
        }
    }

    public void save(final Path indexPath, final IndexMetadata metadata) throws IOException {
        Files.createDirectories(indexPath);
        final Path metadataPath = indexPath.resolve(METADATA_FILE);
        final Path tempPath = indexPath.resolve(METADATA_FILE + ".tmp");
        objectMapper.writeValue(tempPath.toFile(), metadata);
        try {
            Files.move(tempPath, metadataPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(tempPath, metadataPath, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Saved metadata for {} files to {}", metadata.paths().size(), metadataPath);
    }
}
