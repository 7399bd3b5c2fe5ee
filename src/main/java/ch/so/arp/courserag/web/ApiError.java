package ch.so.arp.courserag.web;

import java.time.Instant;

/**
 * Error body returned when a request cannot be answered.
 */
public record ApiError(String code, String message, String path, Instant timestamp) {
}
