package ch.so.arp.courserag;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning of ingestion, retrieval and conversation memory.
 */
@ConfigurationProperties(prefix = "rag")
public class CourseRagProperties {

    /**
     * Maximum number of characters per content chunk.
     */
    private int chunkSize = 800;

    /**
     * Number of characters repeated between consecutive chunks.
     */
    private int chunkOverlap = 100;

    /**
     * Number of chunks returned per search.
     */
    private int maxResults = 5;

    /**
     * Number of exchanges remembered per session.
     */
    private int maxHistory = 2;

    private String embeddingModel = "all-MiniLM-L6-v2";

    private int embeddingDimensions = 384;

    /**
     * Catalog matches further away than this cosine distance do not resolve a
     * course name. Unset accepts the closest course unconditionally.
     */
    private Double maxResolutionDistance;

    /**
     * Folder with course documents ingested at start-up.
     */
    private String docsPath;

    /**
     * Create the PostgreSQL tables on start-up.
     */
    private boolean initializeSchema;

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }

    public Double getMaxResolutionDistance() {
        return maxResolutionDistance;
    }

    public void setMaxResolutionDistance(Double maxResolutionDistance) {
        this.maxResolutionDistance = maxResolutionDistance;
    }

    public String getDocsPath() {
        return docsPath;
    }

    public void setDocsPath(String docsPath) {
        this.docsPath = docsPath;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }
}
