package ch.so.arp.courserag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.courserag.course.Course;
import ch.so.arp.courserag.course.CourseChunk;
import ch.so.arp.courserag.course.Lesson;

/**
 * Parses plain text course transcripts. A document starts with
 * {@code Course Title:}, {@code Course Link:} and {@code Course Instructor:}
 * lines, followed by lessons introduced with {@code Lesson <n>: <title>} and an
 * optional {@code Lesson Link:} line. Lesson text is split into sentence
 * aligned chunks that overlap by a few sentences.
 */
public class CourseDocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(CourseDocumentParser.class);

    private static final Pattern COURSE_TITLE = Pattern.compile("^Course Title:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COURSE_LINK = Pattern.compile("^Course Link:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COURSE_INSTRUCTOR = Pattern.compile("^Course Instructor:\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LESSON_HEADING = Pattern.compile("^Lesson\\s+(\\d+):\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LESSON_LINK = Pattern.compile("^Lesson Link:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private final int chunkSize;
    private final int chunkOverlap;

    /**
     * @param chunkSize    maximum number of characters per chunk, a single longer
     *                     sentence still becomes one chunk
     * @param chunkOverlap number of characters of trailing sentences repeated at
     *                     the start of the next chunk
     */
    public CourseDocumentParser(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be between 0 and chunkSize");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    /**
     * Parse a course document from disk.
     *
     * @throws NoSuchFileException              if the file does not exist
     * @throws MalformedCourseDocumentException if the course title is missing or a
     *                                          lesson number is out of range
     */
    public ParsedCourseDocument parse(Path file) throws IOException, MalformedCourseDocumentException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public ParsedCourseDocument parse(String text) throws MalformedCourseDocumentException {
        String[] lines = text.split("\\R", -1);
        String title = null;
        String courseLink = null;
        String instructor = null;

        int position = 0;
        for (; position < lines.length; position++) {
            String line = lines[position].trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher matcher;
            if ((matcher = COURSE_TITLE.matcher(line)).matches()) {
                title = emptyToNull(matcher.group(1));
            } else if ((matcher = COURSE_LINK.matcher(line)).matches()) {
                courseLink = emptyToNull(matcher.group(1));
            } else if ((matcher = COURSE_INSTRUCTOR.matcher(line)).matches()) {
                instructor = emptyToNull(matcher.group(1));
            } else {
                break;
            }
        }
        if (title == null) {
            throw new MalformedCourseDocumentException("Document has no 'Course Title:' line");
        }

        List<Lesson> lessons = new ArrayList<>();
        List<CourseChunk> chunks = new ArrayList<>();
        LessonBuilder current = null;
        StringBuilder loose = new StringBuilder();
        for (; position < lines.length; position++) {
            String line = lines[position].trim();
            if (line.isEmpty()) {
                continue;
            }
            Matcher heading = LESSON_HEADING.matcher(line);
            if (heading.matches()) {
                if (current != null) {
                    current.finish(title, lessons, chunks);
                }
                current = new LessonBuilder(lessonNumber(heading.group(1), line), heading.group(2).trim());
                continue;
            }
            if (current == null) {
                loose.append(line).append('\n');
                continue;
            }
            Matcher link = LESSON_LINK.matcher(line);
            if (current.text.isEmpty() && current.link == null && link.matches()) {
                current.link = emptyToNull(link.group(1));
            } else {
                current.text.append(line).append('\n');
            }
        }
        if (current != null) {
            current.finish(title, lessons, chunks);
        } else {
            for (String chunk : chunkText(loose.toString())) {
                chunks.add(new CourseChunk(chunk, title, null, chunks.size()));
            }
        }

        LOGGER.debug("Parsed course '{}' with {} lessons into {} chunks", title, lessons.size(), chunks.size());
        return new ParsedCourseDocument(new Course(title, courseLink, instructor, lessons), chunks);
    }

    /**
     * Split text into chunks of whole sentences.
     */
    List<String> chunkText(String text) {
        String normalized = text.replaceAll("\\s+", " ").trim();
        if (normalized.isEmpty()) {
            return List.of();
        }
        String[] sentences = SENTENCE_BOUNDARY.split(normalized);
        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < sentences.length) {
            int end = start;
            int length = 0;
            while (end < sentences.length) {
                int added = sentences[end].length() + (end > start ? 1 : 0);
                if (end > start && length + added > chunkSize) {
                    break;
                }
                length += added;
                end++;
            }
            chunks.add(String.join(" ", List.of(sentences).subList(start, end)));
            if (end >= sentences.length) {
                break;
            }
            int next = end;
            int overlap = 0;
            while (next > start + 1) {
                int added = sentences[next - 1].length() + 1;
                if (overlap + added > chunkOverlap) {
                    break;
                }
                overlap += added;
                next--;
            }
            start = next;
        }
        return chunks;
    }

    private static int lessonNumber(String digits, String line) throws MalformedCourseDocumentException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new MalformedCourseDocumentException("Lesson number out of range in '" + line + "'", ex);
        }
    }

    private static String emptyToNull(String value) {
        String trimmed = value == null ? "" : value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private final class LessonBuilder {

        private final int number;
        private final String title;
        private final StringBuilder text = new StringBuilder();
        private String link;

        private LessonBuilder(int number, String title) {
            this.number = number;
            this.title = title;
        }

        private void finish(String courseTitle, List<Lesson> lessons, List<CourseChunk> chunks) {
            lessons.add(new Lesson(number, title, link));
            List<String> lessonChunks = chunkText(text.toString());
            for (int i = 0; i < lessonChunks.size(); i++) {
                String content = i == 0 ? "Lesson " + number + " content: " + lessonChunks.get(i) : lessonChunks.get(i);
                chunks.add(new CourseChunk(content, courseTitle, number, chunks.size()));
            }
        }
    }
}
