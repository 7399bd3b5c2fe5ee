package ch.so.arp.courserag.web;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for course questions.
 */
public record QueryRequest(@NotBlank String query, @JsonProperty("session_id") String sessionId) {
}
