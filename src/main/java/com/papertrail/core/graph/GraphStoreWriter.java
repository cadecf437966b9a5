package com.papertrail.core.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.DynastyScore;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.NodeLabel;
import com.papertrail.core.model.RedFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Commits one run's results to the graph store.
 *
 * <p>Every row written carries the run id. A stage's writes run inside a
 * {@link StageTransaction} whose compensations delete that stage's rows for
 * the current run, so a failed stage leaves nothing behind and the rows of
 * earlier runs are never touched. Only {@link #completeRun(String)} retires
 * the rows of previous runs.</p>
 */
public class GraphStoreWriter {
    private static final Logger log = LoggerFactory.getLogger(GraphStoreWriter.class);

    public static final String RED_FLAG_LABEL = "RedFlag";
    public static final String RUN_LABEL = "PipelineRun";
    public static final String FLAGGED = "FLAGGED";

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphStoreWriter(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
    }

    public GraphConnection getConnection() {
        return connection;
    }

    public void beginRun(String runId, Instant startedAt) {
        write("begin run", () -> connection.execute(
                "CREATE (:" + RUN_LABEL + " {id: $runId, status: 'RUNNING', started_at: $startedAt})",
                Map.of("runId", runId, "startedAt", startedAt.toString())));
        log.info("store.run_started runId={}", runId);
    }

    /**
     * Writes one node per canonical entity, grouped by label.
     */
    public void writeEntities(String runId, Collection<CanonicalEntity> entities) {
        Map<NodeLabel, List<CanonicalEntity>> byLabel = new TreeMap<>();
        for (CanonicalEntity entity : entities) {
            byLabel.computeIfAbsent(entity.getKind().getNodeLabel(), k -> new ArrayList<>()).add(entity);
        }

        try (StageTransaction tx = new StageTransaction("materialize")) {
            byLabel.forEach((label, group) -> tx.execute("nodes " + label.getLabel(),
                    () -> group.forEach(entity -> createEntity(runId, label, entity)),
                    () -> deleteNodes(label.getLabel(), runId)));
            tx.markSuccess();
        } catch (RuntimeException e) {
            throw new GraphStoreException("Failed to write entities for run " + runId, e);
        }
        log.info("store.entities_written runId={} count={}", runId, entities.size());
    }

    /**
     * Writes derived edges between this run's nodes. Edges whose endpoints are
     * not resolved entities are skipped and counted.
     *
     * @return number of edges written
     */
    public int writeEdges(String runId, List<DerivedEdge> edges, ResolvedGraph graph) {
        Map<EdgeType, List<DerivedEdge>> byType = new TreeMap<>();
        edges.forEach(e -> byType.computeIfAbsent(e.type(), k -> new ArrayList<>()).add(e));

        int[] written = {0};
        int[] skipped = {0};
        try (StageTransaction tx = new StageTransaction("derive")) {
            byType.forEach((type, group) -> tx.execute("edges " + type.name(),
                    () -> group.forEach(edge -> {
                        Optional<NodeLabel> source = labelOf(graph, edge.sourceId());
                        Optional<NodeLabel> target = labelOf(graph, edge.targetId());
                        if (source.isEmpty() || target.isEmpty()) {
                            skipped[0]++;
                            return;
                        }
                        createEdge(runId, edge, source.get(), target.get());
                        written[0]++;
                    }),
                    () -> deleteEdges(type.name(), runId)));
            tx.markSuccess();
        } catch (RuntimeException e) {
            throw new GraphStoreException("Failed to write derived edges for run " + runId, e);
        }
        if (skipped[0] > 0) {
            log.warn("store.edges_skipped runId={} count={} reason=unresolved_endpoint", runId, skipped[0]);
        }
        log.info("store.edges_written runId={} count={}", runId, written[0]);
        return written[0];
    }

    /**
     * Writes red flags as nodes linked from each subject, then concentration
     * metrics onto agency nodes and dynasty scores onto family nodes.
     */
    public void writeFindings(String runId, List<RedFlag> flags, List<ConcentrationMetric> concentration,
                              List<DynastyScore> dynasties, ResolvedGraph graph) {
        try (StageTransaction tx = new StageTransaction("detect")) {
            tx.execute("red flags",
                    () -> {
                        for (int i = 0; i < flags.size(); i++) {
                            createFlag(runId, runId + ":flag:" + i, flags.get(i), graph);
                        }
                    },
                    () -> deleteNodes(RED_FLAG_LABEL, runId));
            tx.execute("concentration",
                    () -> concentration.forEach(m -> setConcentration(runId, m)),
                    () -> clearConcentration(runId));
            tx.execute("dynasties",
                    () -> dynasties.forEach(d -> createFamily(runId, d, graph)),
                    () -> deleteNodes(NodeLabel.POLITICAL_FAMILY.getLabel(), runId));
            tx.markSuccess();
        } catch (RuntimeException e) {
            throw new GraphStoreException("Failed to write findings for run " + runId, e);
        }
        log.info("store.findings_written runId={} flags={} agencies={} families={}",
                runId, flags.size(), concentration.size(), dynasties.size());
    }

    /**
     * Marks the run complete and removes every row left by earlier runs.
     */
    public void completeRun(String runId, Instant completedAt) {
        write("complete run", () -> {
            connection.execute("MATCH (r:" + RUN_LABEL + " {id: $runId}) "
                            + "SET r.status = 'COMPLETED', r.completed_at = $completedAt",
                    Map.of("runId", runId, "completedAt", completedAt.toString()));
            connection.execute("MATCH (n) WHERE n.run_id IS NOT NULL AND n.run_id <> $runId DETACH DELETE n",
                    Map.of("runId", runId));
            connection.execute("MATCH (r:" + RUN_LABEL + ") WHERE r.id <> $runId DELETE r",
                    Map.of("runId", runId));
        });
        log.info("store.run_completed runId={}", runId);
    }

    /**
     * Records the failure on the run node. Rows of completed stages stay until
     * a later run completes.
     */
    public void failRun(String runId, String stage) {
        try {
            connection.execute("MATCH (r:" + RUN_LABEL + " {id: $runId}) "
                    + "SET r.status = 'FAILED', r.failed_stage = $stage", Map.of("runId", runId, "stage", stage));
        } catch (RuntimeException e) {
            log.error("store.fail_mark_failed runId={} stage={}", runId, stage, e);
        }
    }

    private void createEntity(String runId, NodeLabel label, CanonicalEntity entity) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", entity.getId());
        params.put("name", entity.getDisplayName());
        params.put("kind", entity.getKind().name());
        params.put("aliases", new ArrayList<>(entity.getAliases()));
        params.put("sourceIds", new ArrayList<>(entity.getSourceRecordIds()));
        params.put("runId", runId);
        connection.execute("CREATE (:" + label.getLabel() + " {id: $id, name: $name, kind: $kind, "
                + "aliases: $aliases, source_ids: $sourceIds, run_id: $runId})", params);
    }

    private void createEdge(String runId, DerivedEdge edge, NodeLabel source, NodeLabel target) {
        InputSanitizer.validateIdentifier(edge.type().name());
        Map<String, Object> props = new LinkedHashMap<>(edge.evidence().toProperties());
        props.put("run_id", runId);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("source", edge.sourceId());
        params.put("target", edge.targetId());
        params.put("runId", runId);
        params.put("props", props);
        connection.execute("MATCH (a:" + source.getLabel() + " {id: $source, run_id: $runId}), "
                + "(b:" + target.getLabel() + " {id: $target, run_id: $runId}) "
                + "CREATE (a)-[:" + edge.type().name() + " $props]->(b)", params);
    }

    private void createFlag(String runId, String flagId, RedFlag flag, ResolvedGraph graph) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", flagId);
        params.put("type", flag.getType().getCode());
        params.put("severity", flag.getSeverity().getLabel());
        params.put("description", flag.getDescription());
        params.put("evidence", toJson(flag.getEvidence()));
        params.put("detectedAt", flag.getDetectedAt().toString());
        params.put("subjects", flag.getSubjectIds());
        params.put("runId", runId);
        connection.execute("CREATE (:" + RED_FLAG_LABEL + " {id: $id, type: $type, severity: $severity, "
                + "description: $description, evidence: $evidence, detected_at: $detectedAt, "
                + "subject_ids: $subjects, run_id: $runId})", params);

        for (String subject : flag.getSubjectIds()) {
            Optional<NodeLabel> label = labelOf(graph, subject);
            if (label.isEmpty()) {
                continue;
            }
            connection.execute("MATCH (n:" + label.get().getLabel() + " {id: $subject, run_id: $runId}), "
                            + "(f:" + RED_FLAG_LABEL + " {id: $flagId}) "
                            + "CREATE (n)-[:" + FLAGGED + " {run_id: $runId}]->(f)",
                    Map.of("subject", subject, "runId", runId, "flagId", flagId));
        }
    }

    private void setConcentration(String runId, ConcentrationMetric metric) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", metric.agencyId());
        params.put("runId", runId);
        params.put("hhi", metric.hhi());
        params.put("level", metric.level() != null ? metric.level().name() : null);
        params.put("total", metric.totalValue());
        params.put("count", metric.contractCount());
        connection.execute("MATCH (a:" + NodeLabel.AGENCY.getLabel() + " {id: $id, run_id: $runId}) "
                + "SET a.hhi = $hhi, a.concentration_level = $level, a.total_awarded = $total, "
                + "a.contract_count = $count", params);
    }

    private void clearConcentration(String runId) {
        connection.execute("MATCH (a:" + NodeLabel.AGENCY.getLabel() + " {run_id: $runId}) "
                + "SET a.hhi = null, a.concentration_level = null, a.total_awarded = null, a.contract_count = null",
                Map.of("runId", runId));
    }

    private void createFamily(String runId, DynastyScore score, ResolvedGraph graph) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", score.familyId());
        params.put("name", score.familyName());
        params.put("score", score.score());
        params.put("members", score.memberCount());
        params.put("positions", score.distinctPositions());
        params.put("municipalities", score.distinctMunicipalities());
        params.put("linked", score.contractorLinkedMembers());
        params.put("runId", runId);
        connection.execute("CREATE (:" + NodeLabel.POLITICAL_FAMILY.getLabel() + " {id: $id, name: $name, "
                + "dynasty_score: $score, member_count: $members, distinct_positions: $positions, "
                + "distinct_municipalities: $municipalities, contractor_linked_members: $linked, "
                + "run_id: $runId})", params);

        for (String member : score.memberIds()) {
            if (labelOf(graph, member).isEmpty()) {
                continue;
            }
            connection.execute("MATCH (p:" + NodeLabel.POLITICIAN.getLabel() + " {id: $member, run_id: $runId}), "
                            + "(f:" + NodeLabel.POLITICAL_FAMILY.getLabel() + " {id: $family, run_id: $runId}) "
                            + "CREATE (p)-[:" + EdgeType.MEMBER_OF.name() + " {run_id: $runId}]->(f)",
                    Map.of("member", member, "family", score.familyId(), "runId", runId));
        }
    }

    private void deleteNodes(String label, String runId) {
        connection.execute("MATCH (n:" + label + " {run_id: $runId}) DETACH DELETE n", Map.of("runId", runId));
    }

    private void deleteEdges(String type, String runId) {
        connection.execute("MATCH ()-[r:" + type + " {run_id: $runId}]->() DELETE r", Map.of("runId", runId));
    }

    private static Optional<NodeLabel> labelOf(ResolvedGraph graph, String id) {
        return graph.entity(id).map(e -> e.getKind().getNodeLabel());
    }

    private String toJson(Map<String, Object> evidence) {
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Failed to serialize red-flag evidence", e);
        }
    }

    private void write(String description, Runnable operation) {
        try {
            operation.run();
        } catch (RuntimeException e) {
            throw new GraphStoreException("Graph store write failed: " + description, e);
        }
    }
}
