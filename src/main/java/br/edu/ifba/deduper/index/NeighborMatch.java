package br.edu.ifba.deduper.index;

/**
 * A file found within the query radius.
 *
 * @param fileId matching file
 * @param distance Hamming distance to the query code
 */
public record NeighborMatch(String fileId, int distance) {
}
