package ch.so.arp.courserag.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import ch.so.arp.courserag.retrieval.Source;

public record QueryResponse(String answer, List<Source> sources, @JsonProperty("session_id") String sessionId) {
}
