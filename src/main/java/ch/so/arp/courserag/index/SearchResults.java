package ch.so.arp.courserag.index;

import java.util.List;

/**
 * Ordered result of a content query, closest hit first. A result carrying an
 * error never carries hits; an empty result without error simply means nothing
 * matched.
 */
public record SearchResults(List<SearchHit> hits, String error) {

    private static final SearchResults EMPTY = new SearchResults(List.of(), null);

    public SearchResults {
        hits = List.copyOf(hits);
        if (error != null && !hits.isEmpty()) {
            throw new IllegalArgumentException("error results must not carry hits");
        }
    }

    public static SearchResults of(List<SearchHit> hits) {
        return new SearchResults(hits, null);
    }

    public static SearchResults empty() {
        return EMPTY;
    }

    public static SearchResults failed(String error) {
        return new SearchResults(List.of(), error);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public boolean hasError() {
        return error != null;
    }

    public List<String> documents() {
        return hits.stream().map(SearchHit::document).toList();
    }

    public List<Double> distances() {
        return hits.stream().map(SearchHit::distance).toList();
    }
}
