package com.papertrail.core.resolution;

import com.papertrail.core.config.ResolutionOptions;
import com.papertrail.core.metrics.MicrometerMetricsService;
import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.MatchDecision;
import com.papertrail.core.model.MergeDecision;
import com.papertrail.core.model.RawRecord;
import com.papertrail.core.model.RecordPair;
import com.papertrail.core.review.InMemoryReviewQueue;
import com.papertrail.core.review.ReviewItem;
import com.papertrail.core.similarity.SimilarityAlgorithm;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityResolver")
class EntityResolverTest {

    private InMemoryReviewQueue reviewQueue;

    @BeforeEach
    void setUp() {
        reviewQueue = new InMemoryReviewQueue();
    }

    private static RawRecord record(String id, EntityKind kind, String name) {
        return RawRecord.builder().id(id).kind(kind).name(name).sourceSystem("PHILGEPS").build();
    }

    private static RawRecord contractor(String id, String name) {
        return record(id, EntityKind.CONTRACTOR, name);
    }

    /**
     * Similarity with scores fixed per canonical pair; unknown pairs score 0.
     */
    private static final class FixedScores implements SimilarityAlgorithm {
        private final Map<String, Double> scores = new HashMap<>();

        FixedScores with(String a, String b, double score) {
            scores.put(a + "|" + b, score);
            scores.put(b + "|" + a, score);
            return this;
        }

        @Override
        public double compute(String s1, String s2) {
            if (s1.equals(s2)) {
                return 1.0;
            }
            return scores.getOrDefault(s1 + "|" + s2, 0.0);
        }

        @Override
        public String getName() {
            return "fixed";
        }
    }

    private EntityResolver resolver(SimilarityAlgorithm similarity) {
        return EntityResolver.builder()
                .similarity(similarity)
                .reviewQueue(reviewQueue)
                .build();
    }

    private EntityResolver resolver() {
        return EntityResolver.builder().reviewQueue(reviewQueue).build();
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Should merge spellings that canonicalize identically")
        void testIdenticalCanonicalForms() {
            ResolutionResult result = resolver().resolve(List.of(
                    contractor("r1", "ACME Builders, Inc."),
                    contractor("r2", "Acme Builders Inc"),
                    contractor("r3", "ACME Builders, Inc.")));

            assertEquals(1, result.entities().size());
            CanonicalEntity entity = result.entities().get(0);
            assertEquals("ACME Builders, Inc.", entity.getDisplayName());
            assertEquals(EntityKind.CONTRACTOR, entity.getKind());
            assertTrue(entity.getId().startsWith("con-"));
            assertEquals(entity.getId(), result.entityIdFor("r2").orElseThrow());
        }

        @ParameterizedTest(name = "score {0} gives {1}")
        @CsvSource({"0.92, AUTO_MERGE", "0.95, AUTO_MERGE", "0.85, NEEDS_REVIEW", "0.9199, NEEDS_REVIEW",
                "0.8499, DISTINCT", "0.10, DISTINCT"})
        @DisplayName("Should apply the auto-merge and review thresholds inclusively")
        void testThresholds(double score, MatchDecision expected) {
            FixedScores scores = new FixedScores().with("santos construction", "santos constructions", score);

            ResolutionResult result = resolver(scores).resolve(List.of(
                    contractor("r1", "Santos Construction"),
                    contractor("r2", "Santos Constructions")));

            assertEquals(1, result.decisions().size());
            assertEquals(expected, result.decisions().get(0).decision());
            assertEquals(expected == MatchDecision.AUTO_MERGE ? 1 : 2, result.entities().size());
            assertEquals(expected == MatchDecision.NEEDS_REVIEW ? 1 : 0, result.newReviews().size());
        }

        @Test
        @DisplayName("Should merge transitively through a shared neighbour")
        void testTransitivity() {
            FixedScores scores = new FixedScores()
                    .with("delta works", "delta workz", 0.95)
                    .with("delta workz", "delta wrks", 0.95)
                    .with("delta works", "delta wrks", 0.40);

            ResolutionResult result = resolver(scores).resolve(List.of(
                    contractor("r1", "Delta Works"),
                    contractor("r2", "Delta Workz"),
                    contractor("r3", "Delta Wrks")));

            assertEquals(1, result.entities().size());
            assertEquals(3, result.entities().get(0).getSourceRecordIds().size());
        }

        @Test
        @DisplayName("Should never compare records of different kinds")
        void testKindsKeptApart() {
            ResolutionResult result = resolver().resolve(List.of(
                    record("r1", EntityKind.CONTRACTOR, "San Isidro"),
                    record("r2", EntityKind.MUNICIPALITY, "San Isidro")));

            assertEquals(2, result.entities().size());
            assertTrue(result.decisions().isEmpty());
            assertEquals(1, result.entitiesOfKind(EntityKind.MUNICIPALITY).size());
        }

        @Test
        @DisplayName("Should merge on a registration-number match despite different names")
        void testRegistrationMatch() {
            ResolutionResult result = resolver().resolve(List.of(
                    RawRecord.builder().id("r1").kind(EntityKind.CONTRACTOR).name("Omega Trading")
                            .registrationNumber("CS2011-0042").build(),
                    RawRecord.builder().id("r2").kind(EntityKind.CONTRACTOR).name("Zeta Supplies")
                            .registrationNumber("cs 2011 0042").build()));

            assertEquals(1, result.entities().size());
            MergeDecision decision = result.decisions().get(0);
            assertEquals(MatchDecision.AUTO_MERGE, decision.decision());
            assertEquals("registration-number match", decision.rationale());
        }

        @Test
        @DisplayName("Should not merge on registration numbers when disabled")
        void testRegistrationMatchDisabled() {
            EntityResolver strict = EntityResolver.builder()
                    .options(ResolutionOptions.builder().registrationMatchMerges(false).build())
                    .build();

            ResolutionResult result = strict.resolve(List.of(
                    RawRecord.builder().id("r1").kind(EntityKind.CONTRACTOR).name("Omega Trading")
                            .registrationNumber("CS2011-0042").build(),
                    RawRecord.builder().id("r2").kind(EntityKind.CONTRACTOR).name("Zeta Supplies")
                            .registrationNumber("CS2011-0042").build()));

            assertEquals(2, result.entities().size());
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        private List<RawRecord> batch() {
            List<RawRecord> records = new ArrayList<>();
            records.add(contractor("r1", "Golden Dragon Construction Corp."));
            records.add(contractor("r2", "GOLDEN DRAGON CONSTRUCTION CORPORATION"));
            records.add(contractor("r3", "Golden Dragon Constr."));
            records.add(contractor("r4", "Silver Moon Builders"));
            records.add(record("r5", EntityKind.POLITICIAN, "Hon. Juan de la Cruz Jr."));
            records.add(record("r6", EntityKind.POLITICIAN, "Juan Dela Cruz"));
            records.add(record("r7", EntityKind.AGENCY, "DPWH Region VII"));
            return records;
        }

        @Test
        @DisplayName("Should produce the same entities regardless of input order")
        void testOrderIndependence() {
            ResolutionResult expected = resolver().resolve(batch());
            List<RawRecord> shuffled = new ArrayList<>(batch());
            Collections.shuffle(shuffled, new Random(7));

            ResolutionResult actual = EntityResolver.builder().build().resolve(shuffled);

            assertEquals(expected.recordToEntity(), actual.recordToEntity());
            assertEquals(expected.entities().stream().map(CanonicalEntity::getId).toList(),
                    actual.entities().stream().map(CanonicalEntity::getId).toList());
        }

        @Test
        @DisplayName("Should derive entity ids from the sorted member record ids")
        void testStableIds() {
            ResolutionResult result = resolver().resolve(batch());

            String politician = result.entityIdFor("r5").orElseThrow();
            assertEquals(politician, result.entityIdFor("r6").orElseThrow());
            assertEquals(EntityResolver.entityId(EntityKind.POLITICIAN, List.of("r5", "r6")), politician);
            assertTrue(politician.startsWith("pol-"));
        }

        @Test
        @DisplayName("Should place every well-formed record in exactly one entity")
        void testNoRecordLost() {
            ResolutionResult result = resolver().resolve(batch());

            List<String> members = result.entities().stream()
                    .flatMap(e -> e.getSourceRecordIds().stream())
                    .sorted()
                    .toList();
            assertEquals(List.of("r1", "r2", "r3", "r4", "r5", "r6", "r7"), members);
        }

        @Test
        @DisplayName("Should produce the same result in parallel")
        void testParallel() {
            ResolutionResult sequential = resolver().resolve(batch());
            EntityResolver parallel = EntityResolver.builder()
                    .options(ResolutionOptions.builder().parallelism(4).build())
                    .build();

            assertEquals(sequential.recordToEntity(), parallel.resolve(batch()).recordToEntity());
        }
    }

    @Nested
    @DisplayName("Review")
    class Review {

        private final FixedScores scores = new FixedScores().with("bayanihan builders", "bayanihan bldrs", 0.88);

        private List<RawRecord> batch() {
            return List.of(contractor("r1", "Bayanihan Builders"), contractor("r2", "Bayanihan Bldrs"));
        }

        @Test
        @DisplayName("Should queue a review-band pair once across runs")
        void testQueuedOnce() {
            ResolutionResult first = resolver(scores).resolve(batch());
            ResolutionResult second = resolver(scores).resolve(batch());

            assertEquals(1, first.newReviews().size());
            assertTrue(second.newReviews().isEmpty());
            assertEquals(1, reviewQueue.countPending());
            ReviewItem item = first.newReviews().get(0);
            assertEquals(RecordPair.of("r1", "r2"), item.getPair());
            assertEquals(0.88, item.getSimilarityScore(), 1e-12);
        }

        @Test
        @DisplayName("Should merge a pair once a reviewer confirms it")
        void testConfirmed() {
            ReviewItem item = resolver(scores).resolve(batch()).newReviews().get(0);
            reviewQueue.confirm(item.getId(), "analyst", "same address");

            ResolutionResult result = resolver(scores).resolve(batch());

            assertEquals(1, result.entities().size());
            assertEquals("confirmed by reviewer", result.decisions().get(0).rationale());
        }

        @Test
        @DisplayName("Should keep a rejected pair apart even above the merge threshold")
        void testRejected() {
            ReviewItem item = resolver(scores).resolve(batch()).newReviews().get(0);
            reviewQueue.reject(item.getId(), "analyst", null);

            ResolutionResult result = resolver(scores.with("bayanihan builders", "bayanihan bldrs", 0.99))
                    .resolve(batch());

            assertEquals(2, result.entities().size());
            assertEquals(MatchDecision.DISTINCT, result.decisions().get(0).decision());
            assertEquals("rejected by reviewer", result.decisions().get(0).rationale());
        }
    }

    @Nested
    @DisplayName("Malformed records")
    class Malformed {

        @Test
        @DisplayName("Should warn about malformed records and skip those without a usable id or name")
        void testWarnings() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            EntityResolver resolver = EntityResolver.builder()
                    .metrics(new MicrometerMetricsService(registry))
                    .build();

            ResolutionResult result = resolver.resolve(List.of(
                    contractor("r1", "Valid Corp"),
                    contractor("r1", "Duplicate Corp"),
                    contractor("r2", null),
                    contractor("r3", "  "),
                    contractor("r4", "!!! ...")));

            assertEquals(2, result.entities().size());
            assertEquals(List.of("id", "name", "name", "name"),
                    result.warnings().stream().map(DataQualityWarning::field).toList());
            assertEquals(List.of("r1", "r2", "r3", "r4"),
                    result.warnings().stream().map(DataQualityWarning::recordId).toList());
            Counter counter = registry.find("papertrail.data.quality.warning").tag("stage", "RESOLVE").counter();
            assertNotNull(counter);
            assertEquals(4.0, counter.count());
        }

        @Test
        @DisplayName("Should keep names without comparable characters as unmatched singletons")
        void testUnmatchableNamesKept() {
            List<RawRecord> batch = List.of(
                    contractor("r1", "Valid Corp"),
                    contractor("r2", "***"),
                    contractor("r3", "..."),
                    contractor("r4", "Valid Corporation"));

            ResolutionResult result = resolver().resolve(batch);

            List<String> members = result.entities().stream()
                    .flatMap(e -> e.getSourceRecordIds().stream())
                    .sorted()
                    .toList();
            assertEquals(List.of("r1", "r2", "r3", "r4"), members);
            assertEquals(3, result.entities().size());
            assertNotEquals(result.entityIdFor("r2"), result.entityIdFor("r3"));
            assertEquals(result.entityIdFor("r1"), result.entityIdFor("r4"));
            assertEquals(List.of("r2", "r3"), result.warnings().stream().map(DataQualityWarning::recordId).toList());
        }

        @Test
        @DisplayName("Should merge an unmatchable name on an identical registration number")
        void testUnmatchableNameWithRegistration() {
            RawRecord symbols = RawRecord.builder().id("r2").kind(EntityKind.CONTRACTOR).name("###")
                    .registrationNumber("CS-2019-12345").build();
            RawRecord named = RawRecord.builder().id("r1").kind(EntityKind.CONTRACTOR).name("Valid Corp")
                    .registrationNumber("CS201912345").build();

            ResolutionResult result = resolver().resolve(List.of(named, symbols));

            assertEquals(1, result.entities().size());
            assertEquals("Valid Corp", result.entities().get(0).getDisplayName());
        }

        @Test
        @DisplayName("Should resolve an empty batch to nothing")
        void testEmpty() {
            ResolutionResult result = resolver().resolve(List.of());

            assertTrue(result.entities().isEmpty());
            assertTrue(result.warnings().isEmpty());
        }
    }
}
