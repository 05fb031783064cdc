package eu.virtualparadox.lexqa.util;

public class LuceneConstants {
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_TOKENS = "tokens";

    /** Commit user-data key holding the embedding model version of the dense index. */
    public static final String COMMIT_MODEL_VERSION = "lexqa.modelVersion";
    /** Commit user-data key holding the vector dimension of the dense index. */
    public static final String COMMIT_DIMENSION = "lexqa.dimension";

    private LuceneConstants() {
        // prevent instantiation
    }
}
