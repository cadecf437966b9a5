package com.papertrail.core.redflag.detectors;

import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.derive.DerivationResult;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;
import com.papertrail.core.model.WinPattern;
import com.papertrail.core.redflag.DetectionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.papertrail.core.GraphFixtures.DETECTED_AT;
import static com.papertrail.core.GraphFixtures.RUN_ID;
import static com.papertrail.core.GraphFixtures.contextWithEdges;
import static com.papertrail.core.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CollusionRingDetector")
class CollusionRingDetectorTest {

    private final CollusionRingDetector detector = new CollusionRingDetector();

    private static DerivedEdge coBid(String a, String b, WinPattern pattern) {
        return new DerivedEdge(EdgeType.CO_BID_WITH, a, b,
                new EdgeEvidence.CoBid(2, pattern, List.of("R-" + a + b + "-1", "R-" + a + b + "-2")));
    }

    private static List<DerivedEdge> clique(List<String> members, WinPattern pattern) {
        List<DerivedEdge> edges = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                edges.add(coBid(members.get(i), members.get(j), pattern));
            }
        }
        return edges;
    }

    private List<RedFlag> detect(List<DerivedEdge> edges) {
        return detector.detect(contextWithEdges(graph(ProcurementFacts.empty()), edges));
    }

    @Nested
    @DisplayName("Ring flags")
    class RingFlags {

        @Test
        @DisplayName("Should flag a fully rotating ring of four as CRITICAL")
        void testCriticalRing() {
            List<RedFlag> flags = detect(clique(List.of("c1", "c2", "c3", "c4"), WinPattern.ROTATING));

            assertEquals(1, flags.size());
            RedFlag flag = flags.get(0);
            assertEquals(Severity.CRITICAL, flag.getSeverity());
            assertEquals(List.of("c1", "c2", "c3", "c4"), flag.getSubjectIds());
            assertEquals(6, flag.getEvidence().get("internal_edges"));
            assertEquals(1.0, (double) flag.getEvidence().get("density"), 1e-9);
            assertEquals(12, flag.getEvidence().get("shared_contract_count"));
        }

        @Test
        @DisplayName("Should flag a mostly rotating triangle as HIGH")
        void testHighRing() {
            List<DerivedEdge> edges = List.of(
                    coBid("c1", "c2", WinPattern.ROTATING),
                    coBid("c2", "c3", WinPattern.ROTATING),
                    coBid("c1", "c3", WinPattern.COMPETITIVE));

            List<RedFlag> flags = detect(edges);

            assertEquals(1, flags.size());
            assertEquals(Severity.HIGH, flags.get(0).getSeverity());
            assertEquals(2.0 / 3.0, (double) flags.get(0).getEvidence().get("rotation_ratio"), 1e-9);
        }

        @Test
        @DisplayName("Should not flag a dense group without rotation")
        void testNoRotation() {
            assertTrue(detect(clique(List.of("c1", "c2", "c3", "c4"), WinPattern.COMPETITIVE)).isEmpty());
        }

        @Test
        @DisplayName("Should not flag a pair")
        void testTooSmall() {
            assertTrue(detect(List.of(coBid("c1", "c2", WinPattern.ROTATING))).isEmpty());
        }

        @Test
        @DisplayName("Should return nothing without co-bid edges")
        void testNoEdges() {
            assertTrue(detect(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Community detection")
    class CommunityDetection {

        @Test
        @DisplayName("Should separate disconnected triangles")
        void testDisconnectedTriangles() {
            List<DerivedEdge> edges = new ArrayList<>(clique(List.of("a1", "a2", "a3"), WinPattern.ROTATING));
            edges.addAll(clique(List.of("b1", "b2", "b3"), WinPattern.ROTATING));

            CollusionRingDetector.Communities communities = CollusionRingDetector.findCommunities(edges, 100);

            assertEquals(List.of(List.of("a1", "a2", "a3"), List.of("b1", "b2", "b3")), communities.groups());
            assertFalse(communities.truncated());
        }

        @Test
        @DisplayName("Should be independent of edge order")
        void testDeterministic() {
            List<DerivedEdge> edges = new ArrayList<>(clique(List.of("a1", "a2", "a3", "a4"), WinPattern.ROTATING));
            edges.addAll(clique(List.of("b1", "b2", "b3"), WinPattern.ROTATING));
            List<DerivedEdge> reversed = new ArrayList<>(edges);
            Collections.reverse(reversed);

            assertEquals(CollusionRingDetector.findCommunities(edges, 100).groups(),
                    CollusionRingDetector.findCommunities(reversed, 100).groups());
        }
    }

    @Nested
    @DisplayName("Iteration budget")
    class IterationBudget {

        @Test
        @DisplayName("Should stop at the budget and mark the partial ring as truncated")
        void testTruncated() {
            List<DerivedEdge> edges = clique(List.of("c1", "c2", "c3", "c4"), WinPattern.ROTATING);
            DetectionOptions options = DetectionOptions.builder().communityIterationBudget(1).build();
            DetectionContext context = new DetectionContext(RUN_ID, graph(ProcurementFacts.empty()),
                    new DerivationResult(edges, List.of()), List.of(), List.of(), options, DETECTED_AT);

            List<RedFlag> flags = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> detector.detect(context));

            assertTrue(CollusionRingDetector.findCommunities(edges, 1).truncated());
            assertEquals(1, flags.size());
            assertEquals(List.of("c1", "c2", "c3", "c4"), flags.get(0).getSubjectIds());
            assertEquals(true, flags.get(0).getEvidence().get("truncated"));
        }

        @Test
        @DisplayName("Should not mark a converged run as truncated")
        void testConverged() {
            List<RedFlag> flags = detect(clique(List.of("c1", "c2", "c3", "c4"), WinPattern.ROTATING));

            assertEquals(false, flags.get(0).getEvidence().get("truncated"));
        }
    }
}
