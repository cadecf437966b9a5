package com.papertrail.core.pipeline;

import com.papertrail.core.analytics.ConcentrationAnalyzer;
import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.DynastyAnalyzer;
import com.papertrail.core.analytics.DynastyScore;
import com.papertrail.core.derive.DerivationResult;
import com.papertrail.core.derive.RelationshipDeriver;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.graph.GraphStoreException;
import com.papertrail.core.graph.GraphStoreWriter;
import com.papertrail.core.health.GraphStoreHealthCheck;
import com.papertrail.core.health.HealthCheck;
import com.papertrail.core.health.HealthStatus;
import com.papertrail.core.io.RawRecordBatch;
import com.papertrail.core.logging.LogContext;
import com.papertrail.core.metrics.MetricsService;
import com.papertrail.core.metrics.NoOpMetricsService;
import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.redflag.DetectionContext;
import com.papertrail.core.redflag.DetectionResult;
import com.papertrail.core.redflag.RedFlagDetector;
import com.papertrail.core.redflag.RedFlagEngine;
import com.papertrail.core.report.AnalysisReport;
import com.papertrail.core.report.RiskScoreCalculator;
import com.papertrail.core.resolution.EntityResolver;
import com.papertrail.core.resolution.ResolutionResult;
import com.papertrail.core.review.InMemoryReviewQueue;
import com.papertrail.core.review.ReviewQueue;
import com.papertrail.core.rules.Canonicalizer;
import com.papertrail.core.similarity.SimilarityScorer;
import com.papertrail.core.tracing.NoOpTracingService;
import com.papertrail.core.tracing.Span;
import com.papertrail.core.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs RESOLVE, MATERIALIZE, DERIVE and DETECT over one collector batch.
 *
 * <p>Without a {@link GraphStoreWriter} the run stays in memory and the
 * MATERIALIZE stage is a no-op. With one, each stage commits its own rows and
 * the previous run's rows are retired only after DETECT commits. A failing
 * stage surfaces as {@link StageFailedException}.</p>
 *
 * <pre>
 * AnalysisPipeline pipeline = AnalysisPipeline.builder()
 *         .options(PipelineOptions.defaults())
 *         .writer(new GraphStoreWriter(connection))
 *         .build();
 * PipelineResult result = pipeline.run(batch, facts);
 * </pre>
 */
public class AnalysisPipeline {
    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final PipelineOptions options;
    private final EntityResolver resolver;
    private final RelationshipDeriver deriver;
    private final ConcentrationAnalyzer concentrationAnalyzer;
    private final DynastyAnalyzer dynastyAnalyzer;
    private final RedFlagEngine engine;
    private final RiskScoreCalculator riskCalculator;
    private final GraphStoreWriter writer;
    private final HealthCheck healthCheck;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;

    private AnalysisPipeline(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.clock = builder.clock;
        this.writer = builder.writer;
        this.healthCheck = builder.healthCheck != null ? builder.healthCheck
                : builder.writer != null ? new GraphStoreHealthCheck(builder.writer.getConnection()) : null;

        Canonicalizer canonicalizer = new Canonicalizer(options.getCacheConfig());
        SimilarityScorer scorer = new SimilarityScorer(canonicalizer);
        this.resolver = EntityResolver.builder()
                .canonicalizer(canonicalizer)
                .reviewQueue(builder.reviewQueue)
                .options(options.getResolution())
                .metrics(metrics)
                .build();
        this.deriver = RelationshipDeriver.standard(options.getDerivation(), scorer, metrics);
        this.concentrationAnalyzer = new ConcentrationAnalyzer();
        this.dynastyAnalyzer = new DynastyAnalyzer(options.getDynastyWeights());
        List<RedFlagDetector> detectors = builder.detectors != null ? builder.detectors
                : RedFlagEngine.standardDetectors();
        this.engine = new RedFlagEngine(detectors, metrics, tracing);
        this.riskCalculator = new RiskScoreCalculator(options.getSeverityWeights());
    }

    public ReviewQueue getReviewQueue() {
        return resolver.getReviewQueue();
    }

    public PipelineResult run(RawRecordBatch batch, ProcurementFacts facts) {
        String runId = LogContext.generateRunId();
        Instant startedAt = clock.instant();

        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("pipeline.started records={} contracts={} persisted={}",
                    batch.size(), facts.getContracts().size(), writer != null);
            List<DataQualityWarning> warnings = new ArrayList<>(batch.warnings());
            batch.warnings().forEach(w -> metrics.recordDataQualityWarning("IMPORT"));

            ResolutionResult resolution = stage(PipelineStage.RESOLVE, runId,
                    () -> resolver.resolve(batch.records()));
            warnings.addAll(resolution.warnings());
            ResolvedGraph graph = ResolvedGraph.of(resolution, facts);

            stage(PipelineStage.MATERIALIZE, runId, () -> {
                if (writer != null) {
                    ensureHealthy();
                    writer.beginRun(runId, startedAt);
                    writer.writeEntities(runId, graph.getEntities());
                }
                return null;
            });

            DerivationResult derivation = stage(PipelineStage.DERIVE, runId, () -> {
                DerivationResult derived = deriver.derive(graph);
                if (writer != null) {
                    ensureHealthy();
                    writer.writeEdges(runId, derived.edges(), graph);
                }
                return derived;
            });

            Instant detectedAt = clock.instant();
            List<ConcentrationMetric> concentration = new ArrayList<>();
            List<DynastyScore> dynasties = new ArrayList<>();
            DetectionResult detection = stage(PipelineStage.DETECT, runId, () -> {
                concentration.addAll(concentrationAnalyzer.analyze(graph, options.getAnalysisWindow()));
                dynasties.addAll(dynastyAnalyzer.analyze(graph, derivation.edges()));
                DetectionContext context = new DetectionContext(runId, graph, derivation, concentration,
                        dynasties, options.getDetection(), detectedAt);
                DetectionResult detected = engine.run(context);
                if (writer != null) {
                    ensureHealthy();
                    writer.writeFindings(runId, detected.flags(), concentration, dynasties, graph);
                    writer.completeRun(runId, clock.instant());
                }
                return detected;
            });

            AnalysisReport report = AnalysisReport.of(runId, detectedAt, graph, detection, concentration,
                    dynasties, riskCalculator);
            log.info("pipeline.completed entities={} edges={} flags={} failures={} warnings={}",
                    graph.getEntities().size(), derivation.edges().size(), detection.flags().size(),
                    detection.failures().size(), warnings.size());
            return new PipelineResult(runId, resolution, graph, derivation, concentration, dynasties,
                    detection, report, warnings);
        }
    }

    private <T> T stage(PipelineStage stage, String runId, Supplier<T> work) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forStage(runId, stage.name());
             Span span = tracing.stageSpan(runId, stage.name())) {
            try {
                T result = work.get();
                span.succeeded();
                metrics.recordStageDuration(stage.name(), true, Duration.ofNanos(System.nanoTime() - start));
                log.info("stage.completed stage={} durationMs={}", stage, (System.nanoTime() - start) / 1_000_000);
                return result;
            } catch (RuntimeException e) {
                span.failed(e);
                metrics.recordStageDuration(stage.name(), false, Duration.ofNanos(System.nanoTime() - start));
                log.error("stage.failed stage={}", stage, e);
                if (writer != null && stage != PipelineStage.RESOLVE) {
                    writer.failRun(runId, stage.name());
                }
                throw new StageFailedException(stage, runId, e);
            }
        }
    }

    private void ensureHealthy() {
        HealthStatus status = healthCheck.check();
        if (!status.isUp()) {
            throw new GraphStoreException("Graph store unavailable: " + status.message());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineOptions options = PipelineOptions.defaults();
        private ReviewQueue reviewQueue = new InMemoryReviewQueue();
        private GraphStoreWriter writer;
        private HealthCheck healthCheck;
        private List<RedFlagDetector> detectors;
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private Clock clock = Clock.systemUTC();

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Queue shared across runs, so reviewer decisions feed the next run.
         */
        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder writer(GraphStoreWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder healthCheck(HealthCheck healthCheck) {
            this.healthCheck = healthCheck;
            return this;
        }

        /**
         * Replaces the standard detector battery.
         */
        public Builder detectors(List<RedFlagDetector> detectors) {
            this.detectors = List.copyOf(detectors);
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AnalysisPipeline build() {
            return new AnalysisPipeline(this);
        }
    }
}
