package ch.so.arp.courserag.index;

import java.util.Map;

/**
 * One content record returned by a nearest-neighbour query. Smaller distances
 * are closer.
 */
public record SearchHit(String document, Map<String, Object> metadata, double distance) {

    public SearchHit {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
