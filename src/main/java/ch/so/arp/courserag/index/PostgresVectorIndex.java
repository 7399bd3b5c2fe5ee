package ch.so.arp.courserag.index;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.CourseChunk;
import ch.so.arp.courserag.course.Lesson;

/**
 * PostgreSQL backed {@link VectorIndex} using the pgvector extension. The
 * catalog and the content live in two tables, both searched by cosine distance.
 * The lesson list of a course is stored as JSON next to its title embedding.
 */
public class PostgresVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresVectorIndex.class);

    private static final String UPSERT_CATALOG_SQL = """
            INSERT INTO course_catalog (title, instructor, course_link, lessons, embedding)
            VALUES (:title, :instructor, :courseLink, :lessons::jsonb, :embedding::vector)
            ON CONFLICT (title) DO UPDATE SET
              instructor = EXCLUDED.instructor,
              course_link = EXCLUDED.course_link,
              lessons = EXCLUDED.lessons,
              embedding = EXCLUDED.embedding
            """;

    private static final String UPSERT_CONTENT_SQL = """
            INSERT INTO course_content (course_title, lesson_number, chunk_index, content, embedding)
            VALUES (:courseTitle, :lessonNumber, :chunkIndex, :content, :embedding::vector)
            ON CONFLICT (course_title, chunk_index) DO UPDATE SET
              lesson_number = EXCLUDED.lesson_number,
              content = EXCLUDED.content,
              embedding = EXCLUDED.embedding
            """;

    private static final String CATALOG_COLUMNS = "title, instructor, course_link, lessons::text AS lessons";

    private static final String QUERY_CATALOG_SQL = """
            SELECT %s, (embedding <=> :embedding::vector) AS distance
            FROM course_catalog
            ORDER BY embedding <=> :embedding::vector
            LIMIT 1
            """.formatted(CATALOG_COLUMNS);

    private static final String QUERY_CONTENT_SQL = """
            SELECT content, course_title, lesson_number, chunk_index,
              (embedding <=> :embedding::vector) AS distance
            FROM course_content
            %s
            ORDER BY embedding <=> :embedding::vector
            LIMIT :limit
            """;

    private static final Map<String, String> FILTER_COLUMNS = Map.of(
            CourseChunk.COURSE_TITLE, "course_title",
            CourseChunk.LESSON_NUMBER, "lesson_number",
            CourseChunk.CHUNK_INDEX, "chunk_index");

    private static final TypeReference<List<Lesson>> LESSON_LIST = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final EmbeddingProvider embeddingProvider;
    private final ObjectMapper objectMapper;

    public PostgresVectorIndex(JdbcClient jdbcClient, EmbeddingProvider embeddingProvider, ObjectMapper objectMapper) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Create the pgvector extension and both tables if they are missing.
     */
    public void initializeSchema() {
        int dimensions = embeddingProvider.dimensions();
        jdbcClient.sql("CREATE EXTENSION IF NOT EXISTS vector").update();
        jdbcClient.sql("""
                CREATE TABLE IF NOT EXISTS course_catalog (
                  title TEXT PRIMARY KEY,
                  instructor TEXT,
                  course_link TEXT,
                  lessons JSONB NOT NULL DEFAULT '[]'::jsonb,
                  embedding vector(%d) NOT NULL
                )
                """.formatted(dimensions)).update();
        jdbcClient.sql("""
                CREATE TABLE IF NOT EXISTS course_content (
                  id BIGSERIAL PRIMARY KEY,
                  course_title TEXT NOT NULL,
                  lesson_number INTEGER,
                  chunk_index INTEGER NOT NULL,
                  content TEXT NOT NULL,
                  embedding vector(%d) NOT NULL,
                  UNIQUE (course_title, chunk_index)
                )
                """.formatted(dimensions)).update();
        LOGGER.info("Vector index schema ready ({} dimensions, model {})", dimensions, embeddingProvider.modelName());
    }

    @Override
    public void upsertCatalog(Course course) {
        jdbcClient.sql(UPSERT_CATALOG_SQL)
                .param("title", course.title())
                .param("instructor", course.instructor())
                .param("courseLink", course.courseLink())
                .param("lessons", writeLessons(course.lessons()))
                .param("embedding", toPgVectorLiteral(embeddingProvider.embed(course.title())))
                .update();
    }

    @Override
    public void upsertContent(List<CourseChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<float[]> embeddings = embeddingProvider.embedAll(chunks.stream().map(CourseChunk::content).toList());
        for (int i = 0; i < chunks.size(); i++) {
            CourseChunk chunk = chunks.get(i);
            jdbcClient.sql(UPSERT_CONTENT_SQL)
                    .param("courseTitle", chunk.courseTitle())
                    .param("lessonNumber", chunk.lessonNumber())
                    .param("chunkIndex", chunk.chunkIndex())
                    .param("content", chunk.content())
                    .param("embedding", toPgVectorLiteral(embeddings.get(i)))
                    .update();
        }
        LOGGER.debug("Stored {} chunks", chunks.size());
    }

    @Override
    public Optional<CatalogMatch> queryCatalog(String nameHint) {
        return jdbcClient.sql(QUERY_CATALOG_SQL)
                .param("embedding", toPgVectorLiteral(embeddingProvider.embed(nameHint)))
                .query((rs, rowNum) -> new CatalogMatch(mapCourse(rs), rs.getDouble("distance")))
                .optional();
    }

    @Override
    public SearchResults queryContent(String query, MetadataFilter filter, int topK) {
        try {
            Map<String, Object> params = new HashMap<>();
            String where = renderFilter(filter, params);
            params.put("embedding", toPgVectorLiteral(embeddingProvider.embed(query)));
            params.put("limit", topK);
            List<SearchHit> hits = jdbcClient.sql(QUERY_CONTENT_SQL.formatted(where.isEmpty() ? "" : "WHERE " + where))
                    .params(params)
                    .query(SearchHitRowMapper.INSTANCE)
                    .list();
            LOGGER.debug("Content query returned {} hits (filter={}, limit={})", hits.size(), filter, topK);
            return SearchResults.of(hits);
        } catch (DataAccessException ex) {
            LOGGER.warn("Content query '{}' failed: {}", query, ex.getMessage(), ex);
            return SearchResults.failed("Search error: " + ex.getMessage());
        }
    }

    @Override
    public Optional<Course> findCourse(String title) {
        return jdbcClient.sql("SELECT " + CATALOG_COLUMNS + " FROM course_catalog WHERE title = :title")
                .param("title", title)
                .query((rs, rowNum) -> mapCourse(rs))
                .optional();
    }

    @Override
    public void clear() {
        jdbcClient.sql("TRUNCATE course_catalog, course_content").update();
        LOGGER.info("Cleared catalog and content tables");
    }

    @Override
    public int countCourses() {
        return jdbcClient.sql("SELECT count(*) FROM course_catalog").query(Integer.class).single();
    }

    @Override
    public List<String> listTitles() {
        return jdbcClient.sql("SELECT title FROM course_catalog ORDER BY title").query(String.class).list();
    }

    @Override
    public List<Course> listAllCatalogMetadata() {
        return jdbcClient.sql("SELECT " + CATALOG_COLUMNS + " FROM course_catalog ORDER BY title")
                .query((rs, rowNum) -> mapCourse(rs))
                .list();
    }

    static String renderFilter(MetadataFilter filter, Map<String, Object> params) {
        if (filter instanceof MetadataFilter.Equals equals) {
            String column = FILTER_COLUMNS.get(equals.field());
            if (column == null) {
                throw new IllegalArgumentException("Unsupported filter field: " + equals.field());
            }
            String name = "p" + params.size();
            params.put(name, equals.value());
            return column + " = :" + name;
        }
        if (filter instanceof MetadataFilter.And and) {
            StringBuilder builder = new StringBuilder("(");
            for (MetadataFilter operand : and.operands()) {
                if (builder.length() > 1) {
                    builder.append(" AND ");
                }
                builder.append(renderFilter(operand, params));
            }
            return builder.append(')').toString();
        }
        return "";
    }

    private Course mapCourse(ResultSet rs) throws SQLException {
        return new Course(rs.getString("title"), rs.getString("course_link"), rs.getString("instructor"),
                readLessons(rs.getString("lessons")));
    }

    private String writeLessons(List<Lesson> lessons) {
        try {
            return objectMapper.writeValueAsString(lessons);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialise lessons", ex);
        }
    }

    private List<Lesson> readLessons(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LESSON_LIST);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored lessons are not valid JSON", ex);
        }
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    private enum SearchHitRowMapper implements RowMapper<SearchHit> {
        INSTANCE;

        @Override
        public SearchHit mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put(CourseChunk.COURSE_TITLE, rs.getString("course_title"));
            int lessonNumber = rs.getInt("lesson_number");
            if (!rs.wasNull()) {
                metadata.put(CourseChunk.LESSON_NUMBER, lessonNumber);
            }
            metadata.put(CourseChunk.CHUNK_INDEX, rs.getInt("chunk_index"));
            return new SearchHit(rs.getString("content"), metadata, rs.getDouble("distance"));
        }
    }
}
