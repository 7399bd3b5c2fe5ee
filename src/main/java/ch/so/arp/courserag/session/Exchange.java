package ch.so.arp.courserag.session;

/**
 * One question and the answer given to it.
 */
public record Exchange(String query, String answer) {
}
