package com.papertrail.core.similarity;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.rules.Canonicalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity")
class SimilarityAlgorithmTest {

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinkler {

        private final JaroWinklerSimilarity jw = new JaroWinklerSimilarity();

        @Test
        @DisplayName("Should score the textbook pair")
        void testMartha() {
            assertEquals(0.9611, jw.compute("martha", "marhta"), 1e-4);
        }

        @ParameterizedTest(name = "{0} / {1}")
        @CsvSource({"acme builders, acme bulders", "santos, santoz", "dela cruz, delacruz", "abc, xyz"})
        @DisplayName("Should be symmetric")
        void testSymmetric(String a, String b) {
            assertEquals(jw.compute(a, b), jw.compute(b, a));
        }

        @Test
        @DisplayName("Should score identical strings 1 and empty strings 0")
        void testBounds() {
            assertEquals(1.0, jw.compute("acme", "acme"));
            assertEquals(0.0, jw.compute("", "acme"));
            assertEquals(0.0, jw.compute(null, "acme"));
            assertEquals(0.0, jw.compute("abc", "xyz"));
        }

        @Test
        @DisplayName("Should reject scaling factors above 0.25")
        void testScalingFactor() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3));
        }
    }

    @Nested
    @DisplayName("Jaccard")
    class Jaccard {

        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Should divide shared tokens by all tokens")
        void testTokens() {
            assertEquals(0.5, jaccard.compute("road concreting phase 1", "road concreting phase 2 3"), 1e-9);
            assertEquals(1.0, jaccard.compute("a b", "b a"));
            assertEquals(0.0, jaccard.compute("", "a"));
        }
    }

    @Nested
    @DisplayName("Scorer")
    class Scorer {

        private final SimilarityScorer scorer = new SimilarityScorer(new Canonicalizer());

        @Test
        @DisplayName("Should compare canonical forms of raw names")
        void testScoreNames() {
            assertEquals(1.0, scorer.scoreNames("ACME Builders, Inc.", "Acme Builders Corporation",
                    EntityKind.CONTRACTOR));
            assertEquals(1.0, scorer.scoreAddresses("5 Rizal Street", "5 RIZAL ST."));
        }

        @Test
        @DisplayName("Should compare titles by shared tokens")
        void testScoreTitles() {
            assertEquals(5.0 / 7.0, scorer.scoreTitles("Repair of Barangay Road Phase 1", "Repair of Brgy. Road Phase 2"),
                    1e-9);
        }
    }

    @Nested
    @DisplayName("Blocking keys")
    class Blocking {

        private final DefaultBlockingKeyStrategy strategy = new DefaultBlockingKeyStrategy();

        @Test
        @DisplayName("Should key on first token, name prefix and registration prefix")
        void testKeys() {
            assertEquals(Set.of("tok:golden", "pfx:gold", "reg:CS2011"),
                    strategy.generateKeys("golden dragon construction", "CS-2011-00042"));
        }

        @Test
        @DisplayName("Should produce no registration key without a registration number")
        void testNoRegistration() {
            assertEquals(Set.of("tok:ab", "pfx:ab"), strategy.generateKeys("ab", null));
            assertTrue(strategy.generateKeys(" ", "").isEmpty());
        }

        @Test
        @DisplayName("Should normalize registration numbers to upper-case alphanumerics")
        void testNormalizeRegistration() {
            assertEquals("CS201100042", DefaultBlockingKeyStrategy.normalizeRegistration("cs-2011/00042"));
            assertEquals("", DefaultBlockingKeyStrategy.normalizeRegistration(null));
        }
    }
}
