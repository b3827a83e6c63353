package eu.virtualparadox.docsearch.util;

public class LuceneConstants {
    public static final String FIELD_ID = "id";
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_SOURCE_FILE = "sourceFile";
    public static final String FIELD_FILE_TYPE = "fileType";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_SEQUENCE = "sequence";
    public static final String FIELD_START_OFFSET = "startOffset";
    public static final String FIELD_END_OFFSET = "endOffset";

    private LuceneConstants() {
        // prevent instantiation
    }
}
