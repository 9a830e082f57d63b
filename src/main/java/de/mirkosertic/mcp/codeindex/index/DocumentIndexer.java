package de.mirkosertic.mcp.codeindex.index;

import de.mirkosertic.mcp.codeindex.walker.FileEntry;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Creates and writes Lucene documents with a consistent field schema.
 */
public class DocumentIndexer {

    private static final Logger logger = LoggerFactory.getLogger(DocumentIndexer.class);

    /**
     * Schema version for the index.
     * MUST be incremented whenever fields or analyzers change.
     * Version 1: path, path_stem, content with SourceCodeAnalyzer; language, doc_id, sha256, bytes_size stored.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_PATH = "path";
    public static final String FIELD_PATH_ID = "path_id";
    public static final String FIELD_PATH_STEM = "path_stem";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_DOC_ID = "doc_id";
    public static final String FIELD_SHA256 = "sha256";
    public static final String FIELD_BYTES_SIZE = "bytes_size";

    public static String docId(final int sequence) {
        return String.format("doc-%04d", sequence);
    }

    public Document createDocument(final FileEntry entry, final String docId, final String sha256) {
        final Document doc = new Document();

        // path - analyzed and stored, path_id - exact key for delete-by-path
        doc.add(new TextField(FIELD_PATH, entry.path(), Field.Store.YES));
        doc.add(new StringField(FIELD_PATH_ID, entry.path(), Field.Store.NO));

        doc.add(new TextField(FIELD_PATH_STEM, entry.stem(), Field.Store.NO));

        // content is searchable only, the file on disk is the source of truth
        doc.add(new TextField(FIELD_CONTENT, entry.content(), Field.Store.NO));

        doc.add(new StringField(FIELD_LANGUAGE, Languages.fromPath(entry.path()), Field.Store.YES));
        doc.add(new StringField(FIELD_DOC_ID, docId, Field.Store.YES));
        doc.add(new StringField(FIELD_SHA256, sha256, Field.Store.YES));

        doc.add(new LongPoint(FIELD_BYTES_SIZE, entry.size()));
        doc.add(new StoredField(FIELD_BYTES_SIZE, entry.size()));

        return doc;
    }

    /**
     * Writes a document. With {@code replace} every earlier document of the same path is
     * removed atomically, otherwise the document is appended next to older versions.
     */
    public void indexDocument(final IndexWriter writer, final Document document, final boolean replace) throws IOException {
        final String path = document.get(FIELD_PATH);
        if (replace && path != null) {
            writer.updateDocument(new Term(FIELD_PATH_ID, path), document);
        } else {
            writer.addDocument(document);
        }
        logger.debug("Indexed {} (replace={})", path, replace);
    }

    public void deleteDocument(final IndexWriter writer, final String path) throws IOException {
        writer.deleteDocuments(new Term(FIELD_PATH_ID, path));
    }
}
