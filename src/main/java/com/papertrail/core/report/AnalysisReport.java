package com.papertrail.core.report;

import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.DynastyScore;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;
import com.papertrail.core.redflag.DetectionResult;
import com.papertrail.core.redflag.DetectorFailure;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only output of one run for reporting consumers: per-entity flag lists
 * ordered by risk, per-agency concentration and per-family dynasty scores.
 */
public record AnalysisReport(
        String runId,
        Instant generatedAt,
        List<EntityRiskReport> entities,
        List<ConcentrationMetric> concentration,
        List<DynastyScore> dynasties,
        List<DetectorFailure> detectorFailures
) {
    private static final Comparator<EntityRiskReport> BY_RISK = Comparator
            .comparingDouble(EntityRiskReport::riskScore).reversed()
            .thenComparing(EntityRiskReport::entityId);

    public AnalysisReport {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        entities = List.copyOf(entities);
        concentration = List.copyOf(concentration);
        dynasties = List.copyOf(dynasties);
        detectorFailures = List.copyOf(detectorFailures);
    }

    /**
     * Groups flags by every subject they name. A pair flag appears under both
     * entities.
     */
    public static AnalysisReport of(String runId, Instant generatedAt, ResolvedGraph graph,
                                    DetectionResult detection, List<ConcentrationMetric> concentration,
                                    List<DynastyScore> dynasties, RiskScoreCalculator calculator) {
        Map<String, List<RedFlag>> bySubject = new TreeMap<>();
        for (RedFlag flag : detection.flags()) {
            for (String subject : flag.getSubjectIds()) {
                bySubject.computeIfAbsent(subject, k -> new ArrayList<>()).add(flag);
            }
        }

        List<EntityRiskReport> entities = new ArrayList<>();
        bySubject.forEach((entityId, flags) -> {
            Severity highest = flags.stream()
                    .map(RedFlag::getSeverity)
                    .reduce(Severity.LOW, Severity::max);
            EntityKind kind = graph.entity(entityId).map(CanonicalEntity::getKind).orElse(null);
            entities.add(new EntityRiskReport(entityId, graph.displayName(entityId), kind,
                    calculator.score(flags), highest, flags));
        });
        entities.sort(BY_RISK);

        List<DynastyScore> sortedDynasties = new ArrayList<>(dynasties);
        sortedDynasties.sort(Comparator.comparingDouble(DynastyScore::score).reversed()
                .thenComparing(DynastyScore::familyId));

        return new AnalysisReport(runId, generatedAt, entities, concentration, sortedDynasties,
                detection.failures());
    }

    public Optional<EntityRiskReport> forEntity(String entityId) {
        return entities.stream().filter(e -> e.entityId().equals(entityId)).findFirst();
    }

    public List<EntityRiskReport> atOrAbove(double riskThreshold) {
        return entities.stream().filter(e -> e.exceeds(riskThreshold)).toList();
    }

    public Optional<ConcentrationMetric> concentrationFor(String agencyId) {
        return concentration.stream().filter(m -> m.agencyId().equals(agencyId)).findFirst();
    }

    public Optional<DynastyScore> dynastyFor(String familyId) {
        return dynasties.stream().filter(d -> d.familyId().equals(familyId)).findFirst();
    }

    public boolean isComplete() {
        return detectorFailures.isEmpty();
    }
}
