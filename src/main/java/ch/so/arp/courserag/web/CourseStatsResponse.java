package ch.so.arp.courserag.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CourseStatsResponse(
        @JsonProperty("total_courses") int totalCourses,
        @JsonProperty("course_titles") List<String> courseTitles) {
}
