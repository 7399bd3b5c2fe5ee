package ch.so.arp.courserag.web;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.courserag.CourseAnalytics;
import ch.so.arp.courserag.CourseQueryService;
import ch.so.arp.courserag.QueryAnswer;
import jakarta.validation.Valid;

/**
 * REST endpoints to ask questions about the loaded courses and to inspect the
 * catalog.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class CourseQueryController {

    private final CourseQueryService courseQueryService;

    public CourseQueryController(CourseQueryService courseQueryService) {
        this.courseQueryService = courseQueryService;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QueryResponse query(@Valid @RequestBody QueryRequest request) {
        QueryAnswer answer = courseQueryService.query(request.query(), request.sessionId());
        return new QueryResponse(answer.answer(), answer.sources(), answer.sessionId());
    }

    @GetMapping("/courses")
    public CourseStatsResponse courses() {
        CourseAnalytics analytics = courseQueryService.courseAnalytics();
        return new CourseStatsResponse(analytics.totalCourses(), analytics.courseTitles());
    }

    @DeleteMapping("/session/{sessionId}")
    public ResponseEntity<Void> clearSession(@PathVariable String sessionId) {
        courseQueryService.clearSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}
