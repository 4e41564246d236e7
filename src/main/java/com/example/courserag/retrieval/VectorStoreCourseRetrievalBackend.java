package com.example.courserag.retrieval;

import com.example.courserag.config.AiProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Course retrieval over a single Spring AI {@link VectorStore}.
 *
 * <p>The store holds two kinds of documents, told apart by the {@code doc_type} metadata key:
 * <ul>
 *     <li>{@code course}: one per course; the text is the course title, metadata carries
 *     {@code course_title}, {@code course_link}, {@code instructor} and {@code lessons_json}
 *     (a JSON array of {@code lesson_number}, {@code lesson_title}, {@code lesson_link});</li>
 *     <li>{@code content}: one per chunk, with {@code course_title} and {@code lesson_number}.</li>
 * </ul>
 * Course names given by the model are resolved to a title by similarity over the
 * {@code course} documents.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorStoreCourseRetrievalBackend implements CourseRetrievalBackend {

    static final String DOC_TYPE = "doc_type";
    static final String TYPE_COURSE = "course";
    static final String TYPE_CONTENT = "content";
    static final String COURSE_TITLE = "course_title";
    static final String LESSON_NUMBER = "lesson_number";

    // a similarity query needs text; catalog listing matches every course document instead
    private static final String CATALOG_QUERY = "course";
    private static final int CATALOG_LIMIT = 10_000;

    private static final TypeReference<List<Map<String, Object>>> LESSON_LIST_TYPE = new TypeReference<>() {};

    private final VectorStore vectorStore;
    private final ObjectMapper mapper;
    private final AiProperties properties;

    @Override
    public SearchResults search(String query, @Nullable String courseName, @Nullable Integer lessonNumber) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        FilterExpressionBuilder.Op filter = b.eq(DOC_TYPE, TYPE_CONTENT);

        if (StringUtils.hasText(courseName)) {
            Optional<String> title;
            try {
                title = resolveCourseTitle(courseName);
            } catch (RuntimeException ex) {
                log.warn("Course resolution failed course={}", courseName, ex);
                return SearchResults.empty("Search error: " + ex.getMessage());
            }
            if (title.isEmpty()) {
                return SearchResults.empty("No course found matching '" + courseName + "'");
            }
            filter = b.and(filter, b.eq(COURSE_TITLE, title.get()));
        }
        if (lessonNumber != null) {
            filter = b.and(filter, b.eq(LESSON_NUMBER, lessonNumber));
        }

        List<Document> hits;
        try {
            hits = vectorStore.similaritySearch(SearchRequest.builder()
                    .query(query)
                    .topK(properties.getRetrieval().getMaxResults())
                    .filterExpression(filter.build())
                    .build());
        } catch (RuntimeException ex) {
            log.warn("Content search failed course={} lesson={}", courseName, lessonNumber, ex);
            return SearchResults.empty("Search error: " + ex.getMessage());
        }

        List<String> documents = new ArrayList<>();
        List<Map<String, Object>> metadata = new ArrayList<>();
        List<Double> distances = new ArrayList<>();
        for (Document hit : hits == null ? List.<Document>of() : hits) {
            documents.add(Objects.toString(hit.getText(), ""));
            metadata.add(new HashMap<>(hit.getMetadata()));
            distances.add(distance(hit));
        }
        log.debug("Content search returned {} hit(s) course={} lesson={}", documents.size(), courseName, lessonNumber);
        return SearchResults.of(documents, metadata, distances);
    }

    @Override
    public Optional<String> getLessonLink(String courseTitle, int lessonNumber) {
        try {
            return findCourseByTitle(courseTitle)
                    .flatMap(course -> lessons(course).stream()
                            .filter(lesson -> lesson.lessonNumber() == lessonNumber)
                            .map(LessonOutline::lessonLink)
                            .filter(StringUtils::hasText)
                            .findFirst());
        } catch (RuntimeException ex) {
            log.warn("Lesson link lookup failed course='{}' lesson={}; citing without link", courseTitle, lessonNumber, ex);
            return Optional.empty();
        }
    }

    @Override
    public List<String> getCourseTitles() {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        List<Document> catalog = vectorStore.similaritySearch(SearchRequest.builder()
                .query(CATALOG_QUERY)
                .topK(CATALOG_LIMIT)
                .similarityThresholdAll()
                .filterExpression(b.eq(DOC_TYPE, TYPE_COURSE).build())
                .build());
        Set<String> titles = new TreeSet<>();
        for (Document course : catalog == null ? List.<Document>of() : catalog) {
            Object title = course.getMetadata().get(COURSE_TITLE);
            if (title != null && StringUtils.hasText(title.toString())) {
                titles.add(title.toString());
            }
        }
        log.debug("Course catalog lists {} course(s)", titles.size());
        return List.copyOf(titles);
    }

    @Override
    public Optional<CourseOutline> getCourseOutline(String courseName) {
        return resolveCourse(courseName).map(course -> {
            Map<String, Object> meta = course.getMetadata();
            return new CourseOutline(
                    Objects.toString(meta.get(COURSE_TITLE), courseName),
                    stringOrNull(meta.get("course_link")),
                    stringOrNull(meta.get("instructor")),
                    lessons(course));
        });
    }

    private Optional<String> resolveCourseTitle(String courseName) {
        return resolveCourse(courseName).map(course -> Objects.toString(course.getMetadata().get(COURSE_TITLE), null));
    }

    private Optional<Document> resolveCourse(String courseName) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        return first(SearchRequest.builder()
                .query(courseName)
                .topK(1)
                .filterExpression(b.eq(DOC_TYPE, TYPE_COURSE).build())
                .build());
    }

    private Optional<Document> findCourseByTitle(String courseTitle) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        return first(SearchRequest.builder()
                .query(courseTitle)
                .topK(1)
                .filterExpression(b.and(b.eq(DOC_TYPE, TYPE_COURSE), b.eq(COURSE_TITLE, courseTitle)).build())
                .build());
    }

    private Optional<Document> first(SearchRequest request) {
        List<Document> hits = vectorStore.similaritySearch(request);
        if (hits == null || hits.isEmpty()) {
            log.debug("Catalog lookup '{}' found nothing", request.getQuery());
            return Optional.empty();
        }
        return Optional.of(hits.get(0));
    }

    private List<LessonOutline> lessons(Document course) {
        Object raw = course.getMetadata().get("lessons_json");
        if (!(raw instanceof String json) || json.isBlank()) {
            return List.of();
        }
        List<Map<String, Object>> entries;
        try {
            entries = mapper.readValue(json, LESSON_LIST_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Malformed lessons_json for course '{}'; treating it as having no lessons",
                    course.getMetadata().get(COURSE_TITLE), ex);
            return List.of();
        }
        List<LessonOutline> lessons = new ArrayList<>(entries.size());
        for (Map<String, Object> entry : entries) {
            Object number = entry.get(LESSON_NUMBER);
            if (!(number instanceof Number n)) {
                continue;
            }
            lessons.add(new LessonOutline(
                    n.intValue(),
                    Objects.toString(entry.get("lesson_title"), ""),
                    stringOrNull(entry.get("lesson_link"))));
        }
        return lessons;
    }

    private static double distance(Document hit) {
        Double score = hit.getScore();
        if (score != null) {
            return 1.0 - score;
        }
        Object distance = hit.getMetadata().get("distance");
        return distance instanceof Number n ? n.doubleValue() : 0.0;
    }

    @Nullable
    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
