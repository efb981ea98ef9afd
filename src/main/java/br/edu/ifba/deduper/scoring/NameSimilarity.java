package br.edu.ifba.deduper.scoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File name similarity on stems with extensions and copy markers removed.
 *
 * Similarity is the larger of normalized Levenshtein similarity and token
 * Jaccard similarity, except that stems with different number runs (camera
 * sequence numbers such as IMG_1234 / IMG_1235) only get the token overlap.
 */
@ApplicationScoped
public class NameSimilarity {

    private static final Pattern VARIANT_SUFFIX = Pattern.compile("\\((\\d+)\\)|\\bcopy\\b(\\s*\\d+)?");
    private static final Pattern NUMBER_RUN = Pattern.compile("\\d+");

    /**
     * Similarity of two file names in [0.0, 1.0].
     */
    public double similarity(@NotNull String fileName1, @NotNull String fileName2) {
        if (fileName1 == null) {
            throw new IllegalArgumentException("fileName1 cannot be null");
        }
        if (fileName2 == null) {
            throw new IllegalArgumentException("fileName2 cannot be null");
        }

        String stem1 = stem(fileName1);
        String stem2 = stem(fileName2);
        if (stem1.isEmpty() || stem2.isEmpty()) {
            return 0.0;
        }
        if (stem1.equals(stem2)) {
            return 1.0;
        }

        double jaccard = jaccard(stem1, stem2);
        if (!numberRuns(stem1).equals(numberRuns(stem2))) {
            return jaccard;
        }
        return Math.max(levenshteinSimilarity(stem1, stem2), jaccard);
    }

    /**
     * Lower-case stem: extension, copy markers and punctuation removed, spaces collapsed.
     */
    public String stem(@NotNull String fileName) {
        String base = fileName;
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        String lower = base.toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        String withoutVariants = VARIANT_SUFFIX.matcher(lower).replaceAll(" ");
        return withoutVariants.replaceAll("[^a-z0-9\\s]", "")
            .trim()
            .replaceAll("\\s+", " ");
    }

    double jaccard(String stem1, String stem2) {
        Set<String> tokens1 = tokenize(stem1);
        Set<String> tokens2 = tokenize(stem2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        return (double) intersection.size() / union.size();
    }

    double levenshteinSimilarity(String s1, String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshteinDistance(s1, s2) / maxLength;
    }

    private int levenshteinDistance(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= s1.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(previous[j] + 1, current[j - 1] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[s2.length()];
    }

    private Set<String> tokenize(String stem) {
        Set<String> tokens = new HashSet<>();
        for (String token : stem.split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private Set<String> numberRuns(String stem) {
        Set<String> runs = new LinkedHashSet<>();
        Matcher matcher = NUMBER_RUN.matcher(stem);
        while (matcher.find()) {
            runs.add(matcher.group());
        }
        return runs;
    }
}
