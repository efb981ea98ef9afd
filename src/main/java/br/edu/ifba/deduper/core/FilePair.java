package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;

/**
 * Unordered pair of file ids, normalized so that {@code first < second}.
 *
 * @param first lexicographically smaller id
 * @param second lexicographically larger id
 */
public record FilePair(@NotNull String first, @NotNull String second) {

    public FilePair {
        if (first == null || second == null) {
            throw new IllegalArgumentException("pair ids cannot be null");
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("a file cannot pair with itself: " + first);
        }
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static FilePair of(@NotNull String a, @NotNull String b) {
        return new FilePair(a, b);
    }

    public boolean contains(@NotNull String fileId) {
        return first.equals(fileId) || second.equals(fileId);
    }

    public String other(@NotNull String fileId) {
        return first.equals(fileId) ? second : first;
    }

    @Override
    public String toString() {
        return first + "|" + second;
    }
}
