package ch.so.arp.courserag;

import java.util.List;

public record CourseAnalytics(int totalCourses, List<String> courseTitles) {
}
