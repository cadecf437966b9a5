package com.papertrail.core.similarity;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-set overlap, |intersection| / |union|. Used for contract titles,
 * where word order carries little meaning.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokenSet = new HashSet<>();
        for (String token : TOKEN_SEPARATOR.split(s)) {
            if (!token.isEmpty()) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }
}
