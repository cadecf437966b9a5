package com.papertrail.core.graph;

import com.papertrail.core.analytics.AnalysisWindow;
import com.papertrail.core.analytics.ConcentrationLevel;
import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.DynastyScore;
import com.papertrail.core.analytics.MarketShare;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeEvidence;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import com.papertrail.core.model.WinPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.papertrail.core.GraphFixtures.DETECTED_AT;
import static com.papertrail.core.GraphFixtures.agency;
import static com.papertrail.core.GraphFixtures.contractor;
import static com.papertrail.core.GraphFixtures.graph;
import static com.papertrail.core.GraphFixtures.politician;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("GraphStoreWriter")
class GraphStoreWriterTest {

    private static final String RUN = "run-2";

    private final ResolvedGraph graph = graph(ProcurementFacts.empty(),
            contractor("con-a", "Alpha Builders"), contractor("con-b", "Bravo Construction"),
            agency("agy-1", "DPWH District"), politician("pol-1", "Juan Reyes"));

    @Nested
    @DisplayName("Entities and edges")
    class EntitiesAndEdges {

        @Test
        @DisplayName("Should create one node per entity, tagged with the run id")
        void testWriteEntities() {
            RecordingGraphConnection connection = new RecordingGraphConnection();

            new GraphStoreWriter(connection).writeEntities(RUN, graph.getEntities());

            assertEquals(2, connection.count("CREATE (:Contractor"));
            assertEquals(1, connection.count("CREATE (:Agency"));
            assertEquals(1, connection.count("CREATE (:Politician"));
            assertTrue(connection.statements().stream().allMatch(s -> RUN.equals(s.params().get("runId"))));
        }

        @Test
        @DisplayName("Should delete this run's nodes of every attempted label when a write fails")
        void testWriteEntitiesRollback() {
            RecordingGraphConnection connection = new RecordingGraphConnection().failOn("CREATE (:Contractor");

            GraphStoreException e = assertThrows(GraphStoreException.class,
                    () -> new GraphStoreWriter(connection).writeEntities(RUN, graph.getEntities()));

            assertTrue(e.getMessage().contains(RUN));
            assertEquals(1, connection.count("MATCH (n:Contractor {run_id: $runId}) DETACH DELETE n"));
            assertEquals(1, connection.count("MATCH (n:Agency {run_id: $runId}) DETACH DELETE n"));
            assertEquals(1, connection.count("MATCH (n:Politician {run_id: $runId}) DETACH DELETE n"));
        }

        @Test
        @DisplayName("Should write edges between resolved endpoints and skip the rest")
        void testWriteEdges() {
            RecordingGraphConnection connection = new RecordingGraphConnection();
            List<DerivedEdge> edges = List.of(
                    new DerivedEdge(EdgeType.CO_BID_WITH, "con-b", "con-a",
                            new EdgeEvidence.CoBid(2, WinPattern.ROTATING, List.of("C-1", "C-2"))),
                    new DerivedEdge(EdgeType.SUBCONTRACTED_TO, "con-a", "con-unknown",
                            new EdgeEvidence.SubcontractFlow(1_000_000.0, 1, List.of("C-1"))));

            int written = new GraphStoreWriter(connection).writeEdges(RUN, edges, graph);

            assertEquals(1, written);
            assertEquals(1, connection.statements().size());
            RecordingGraphConnection.Statement statement = connection.statements().get(0);
            assertTrue(statement.query().contains("CREATE (a)-[:CO_BID_WITH $props]->(b)"));
            assertEquals("con-a", statement.params().get("source"));
            @SuppressWarnings("unchecked")
            Map<String, Object> props = (Map<String, Object>) statement.params().get("props");
            assertEquals(2, props.get("contract_count"));
            assertEquals(RUN, props.get("run_id"));
        }

        @Test
        @DisplayName("Should remove this run's edges of the failing type")
        void testWriteEdgesRollback() {
            RecordingGraphConnection connection = new RecordingGraphConnection().failOn("[:CO_BID_WITH $props]");
            List<DerivedEdge> edges = List.of(new DerivedEdge(EdgeType.CO_BID_WITH, "con-a", "con-b",
                    new EdgeEvidence.CoBid(2, WinPattern.ROTATING, List.of("C-1", "C-2"))));

            assertThrows(GraphStoreException.class,
                    () -> new GraphStoreWriter(connection).writeEdges(RUN, edges, graph));

            assertEquals(List.of("MATCH ()-[r:CO_BID_WITH {run_id: $runId}]->() DELETE r"), connection.queries());
        }
    }

    @Nested
    @DisplayName("Findings")
    class Findings {

        private final RedFlag flag = RedFlag.builder(RedFlagType.SINGLE_BIDDER)
                .severity(Severity.HIGH)
                .description("Single bid")
                .evidence("contract_ref", "C-1")
                .evidence("bid_count", 1)
                .detectedAt(DETECTED_AT)
                .subjects("con-a", "con-ghost")
                .build();

        private final ConcentrationMetric metric = new ConcentrationMetric("agy-1", 1.0, ConcentrationLevel.HIGH,
                5_000_000.0, 2, List.of(new MarketShare("con-a", 5_000_000.0, 1.0)), AnalysisWindow.unbounded());

        private final DynastyScore dynasty = new DynastyScore("fam-reyes", "Reyes", List.of("pol-1"),
                1, 1, 0, 0.4, 0.3, 0.0, 0.7);

        @Test
        @DisplayName("Should write flags with JSON evidence, agency metrics and families")
        void testWriteFindings() {
            RecordingGraphConnection connection = new RecordingGraphConnection();

            new GraphStoreWriter(connection).writeFindings(RUN, List.of(flag), List.of(metric), List.of(dynasty),
                    graph);

            RecordingGraphConnection.Statement flagNode = connection.statements().get(0);
            assertEquals(RUN + ":flag:0", flagNode.params().get("id"));
            assertEquals("single_bidder", flagNode.params().get("type"));
            assertEquals("high", flagNode.params().get("severity"));
            assertEquals("{\"contract_ref\":\"C-1\",\"bid_count\":1}", flagNode.params().get("evidence"));
            assertEquals(1, connection.count("CREATE (n)-[:FLAGGED"));
            assertEquals(1, connection.count("SET a.hhi = $hhi"));
            assertEquals(1, connection.count("CREATE (:PoliticalFamily"));
            assertEquals(1, connection.count("[:MEMBER_OF {run_id: $runId}]"));
        }

        @Test
        @DisplayName("Should undo every findings step when dynasties fail")
        void testWriteFindingsRollback() {
            RecordingGraphConnection connection = new RecordingGraphConnection().failOn("CREATE (:PoliticalFamily");

            assertThrows(GraphStoreException.class, () -> new GraphStoreWriter(connection)
                    .writeFindings(RUN, List.of(flag), List.of(metric), List.of(dynasty), graph));

            List<String> queries = connection.queries();
            int last = queries.size();
            assertEquals("MATCH (n:PoliticalFamily {run_id: $runId}) DETACH DELETE n", queries.get(last - 3));
            assertTrue(queries.get(last - 2).contains("SET a.hhi = null"));
            assertEquals("MATCH (n:RedFlag {run_id: $runId}) DETACH DELETE n", queries.get(last - 1));
        }
    }

    @Nested
    @DisplayName("Run lifecycle")
    class RunLifecycle {

        @Test
        @DisplayName("Should retire earlier runs only on completion")
        void testCompleteRun() {
            RecordingGraphConnection connection = new RecordingGraphConnection();
            GraphStoreWriter writer = new GraphStoreWriter(connection);

            writer.beginRun(RUN, DETECTED_AT);
            assertEquals(0, connection.count("DETACH DELETE"));

            writer.completeRun(RUN, Instant.parse("2024-06-01T00:05:00Z"));

            assertEquals(1, connection.count("n.run_id <> $runId DETACH DELETE n"));
            assertEquals(1, connection.count("SET r.status = 'COMPLETED'"));
        }

        @Test
        @DisplayName("Should wrap store failures on completion")
        void testCompleteRunFailure() {
            GraphConnection connection = mock(GraphConnection.class);
            doThrow(new IllegalStateException("connection reset"))
                    .when(connection).execute(contains("COMPLETED"), anyMap());

            GraphStoreException e = assertThrows(GraphStoreException.class,
                    () -> new GraphStoreWriter(connection).completeRun(RUN, DETECTED_AT));

            assertInstanceOf(IllegalStateException.class, e.getCause());
            verify(connection, never()).execute(contains("DETACH DELETE"), anyMap());
        }

        @Test
        @DisplayName("Should not throw when the failure mark cannot be written")
        void testFailRunSwallowsStoreErrors() {
            GraphConnection connection = mock(GraphConnection.class);
            doThrow(new IllegalStateException("down")).when(connection).execute(contains("FAILED"), anyMap());

            assertDoesNotThrow(() -> new GraphStoreWriter(connection).failRun(RUN, "DERIVE"));
        }
    }
}
