package com.papertrail.core.metrics;

import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.MatchDecision;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code papertrail.stage.duration} (Timer, tags: stage, outcome)</li>
 *   <li>{@code papertrail.match.decision} (Counter, tags: kind, decision)</li>
 *   <li>{@code papertrail.similarity.score} (DistributionSummary)</li>
 *   <li>{@code papertrail.entities.resolved} (Counter, tag: kind)</li>
 *   <li>{@code papertrail.data.quality.warning} (Counter, tag: stage)</li>
 *   <li>{@code papertrail.edges.derived} (Counter, tag: type)</li>
 *   <li>{@code papertrail.redflag} (Counter, tags: type, severity)</li>
 *   <li>{@code papertrail.detector.failure} (Counter, tag: detector)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("papertrail.similarity.score")
                .description("Similarity scores of scored candidate pairs")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(stage + ":" + outcome, k ->
                Timer.builder("papertrail.stage.duration")
                        .description("Duration of pipeline stages")
                        .tag("stage", stage)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordMatchDecision(EntityKind kind, MatchDecision decision) {
        counter("papertrail.match.decision", "Candidate pair decisions",
                "kind", kind.name(), "decision", decision.name()).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordEntitiesResolved(EntityKind kind, int count) {
        counter("papertrail.entities.resolved", "Canonical entities produced", "kind", kind.name())
                .increment(count);
    }

    @Override
    public void recordDataQualityWarning(String stage) {
        counter("papertrail.data.quality.warning", "Records skipped as malformed", "stage", stage).increment();
    }

    @Override
    public void recordDerivedEdges(EdgeType type, int count) {
        counter("papertrail.edges.derived", "Derived edges produced", "type", type.name()).increment(count);
    }

    @Override
    public void recordRedFlag(RedFlagType type, Severity severity) {
        counter("papertrail.redflag", "Red flags raised",
                "type", type.getCode(), "severity", severity.getLabel()).increment();
    }

    @Override
    public void recordDetectorFailure(String detector) {
        counter("papertrail.detector.failure", "Detectors that threw or timed out", "detector", detector)
                .increment();
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + ":" + String.join(":", tags);
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tags(tags)
                        .register(registry));
    }
}
