package ch.so.arp.courserag.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.CourseChunk;

/**
 * In-process {@link VectorIndex} performing an exhaustive cosine distance scan.
 * It keeps the application and the tests independent of a running database and
 * loses its content when the process ends.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final EmbeddingProvider embeddingProvider;
    private final Map<String, CatalogRecord> catalog = new LinkedHashMap<>();
    private final Map<String, ContentRecord> content = new LinkedHashMap<>();

    public InMemoryVectorIndex(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
    }

    @Override
    public void upsertCatalog(Course course) {
        catalog.put(course.title(), new CatalogRecord(course, embeddingProvider.embed(course.title())));
    }

    @Override
    public void upsertContent(List<CourseChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<float[]> embeddings = embeddingProvider.embedAll(chunks.stream().map(CourseChunk::content).toList());
        for (int i = 0; i < chunks.size(); i++) {
            CourseChunk chunk = chunks.get(i);
            content.put(chunk.courseTitle() + "_" + chunk.chunkIndex(), new ContentRecord(chunk, embeddings.get(i)));
        }
        LOGGER.debug("Stored {} chunks, content collection now holds {}", chunks.size(), content.size());
    }

    @Override
    public Optional<CatalogMatch> queryCatalog(String nameHint) {
        float[] query = embeddingProvider.embed(nameHint);
        return catalog.values().stream()
                .map(record -> new CatalogMatch(record.course(), cosineDistance(query, record.embedding())))
                .min(Comparator.comparingDouble(CatalogMatch::distance));
    }

    @Override
    public SearchResults queryContent(String query, MetadataFilter filter, int topK) {
        try {
            float[] embedding = embeddingProvider.embed(query);
            List<SearchHit> hits = new ArrayList<>();
            for (ContentRecord record : content.values()) {
                Map<String, Object> metadata = record.chunk().metadata();
                if (filter.matches(metadata)) {
                    hits.add(new SearchHit(record.chunk().content(), metadata,
                            cosineDistance(embedding, record.embedding())));
                }
            }
            hits.sort(Comparator.comparingDouble(SearchHit::distance));
            return SearchResults.of(hits.subList(0, Math.min(topK, hits.size())));
        } catch (RuntimeException ex) {
            LOGGER.warn("Content query '{}' failed: {}", query, ex.getMessage(), ex);
            return SearchResults.failed("Search error: " + ex.getMessage());
        }
    }

    @Override
    public Optional<Course> findCourse(String title) {
        return Optional.ofNullable(catalog.get(title)).map(CatalogRecord::course);
    }

    @Override
    public void clear() {
        catalog.clear();
        content.clear();
        LOGGER.info("Cleared catalog and content collections");
    }

    @Override
    public int countCourses() {
        return catalog.size();
    }

    @Override
    public List<String> listTitles() {
        return List.copyOf(catalog.keySet());
    }

    @Override
    public List<Course> listAllCatalogMetadata() {
        return catalog.values().stream().map(CatalogRecord::course).toList();
    }

    static double cosineDistance(float[] left, float[] right) {
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 1.0d;
        }
        return 1.0d - dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private record CatalogRecord(Course course, float[] embedding) {
    }

    private record ContentRecord(CourseChunk chunk, float[] embedding) {
    }
}
