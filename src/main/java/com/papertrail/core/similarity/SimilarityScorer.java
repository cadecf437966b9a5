package com.papertrail.core.similarity;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.rules.Canonicalizer;

/**
 * Scores two raw strings after canonicalizing them.
 * Names use Jaro-Winkler; contract titles use token Jaccard.
 */
public class SimilarityScorer {

    private final Canonicalizer canonicalizer;
    private final SimilarityAlgorithm nameAlgorithm;
    private final SimilarityAlgorithm titleAlgorithm;

    public SimilarityScorer(Canonicalizer canonicalizer) {
        this(canonicalizer, new JaroWinklerSimilarity(), new JaccardSimilarity());
    }

    public SimilarityScorer(Canonicalizer canonicalizer, SimilarityAlgorithm nameAlgorithm,
                            SimilarityAlgorithm titleAlgorithm) {
        this.canonicalizer = canonicalizer;
        this.nameAlgorithm = nameAlgorithm;
        this.titleAlgorithm = titleAlgorithm;
    }

    /**
     * Similarity of two already canonical strings.
     */
    public double score(String canonicalA, String canonicalB) {
        return nameAlgorithm.compute(canonicalA, canonicalB);
    }

    public double scoreNames(String rawA, String rawB, EntityKind kind) {
        return score(canonicalizer.canonicalize(rawA, kind), canonicalizer.canonicalize(rawB, kind));
    }

    public double scoreAddresses(String rawA, String rawB) {
        return score(canonicalizer.canonicalizeAddress(rawA), canonicalizer.canonicalizeAddress(rawB));
    }

    /**
     * Scope similarity of two contract titles.
     */
    public double scoreTitles(String rawA, String rawB) {
        return titleAlgorithm.compute(canonicalizer.canonicalizeAddress(rawA), canonicalizer.canonicalizeAddress(rawB));
    }

    public Canonicalizer getCanonicalizer() {
        return canonicalizer;
    }
}
