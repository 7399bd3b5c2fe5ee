package ch.so.arp.courserag;

/**
 * Number of courses and chunks added by a folder ingestion.
 */
public record FolderIngestionResult(int coursesAdded, int chunksAdded) {
}
