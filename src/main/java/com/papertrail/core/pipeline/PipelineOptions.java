package com.papertrail.core.pipeline;

import com.papertrail.core.analytics.AnalysisWindow;
import com.papertrail.core.config.CacheConfig;
import com.papertrail.core.config.DerivationOptions;
import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.config.DynastyWeights;
import com.papertrail.core.config.ResolutionOptions;
import com.papertrail.core.config.SeverityWeights;

import java.util.Objects;

/**
 * All tunables of one analysis run.
 */
public class PipelineOptions {

    private final ResolutionOptions resolution;
    private final DerivationOptions derivation;
    private final DetectionOptions detection;
    private final DynastyWeights dynastyWeights;
    private final SeverityWeights severityWeights;
    private final CacheConfig cacheConfig;
    private final AnalysisWindow analysisWindow;

    private PipelineOptions(Builder builder) {
        this.resolution = builder.resolution;
        this.derivation = builder.derivation;
        this.detection = builder.detection;
        this.dynastyWeights = builder.dynastyWeights;
        this.severityWeights = builder.severityWeights;
        this.cacheConfig = builder.cacheConfig;
        this.analysisWindow = builder.analysisWindow;
    }

    public ResolutionOptions getResolution() {
        return resolution;
    }

    public DerivationOptions getDerivation() {
        return derivation;
    }

    public DetectionOptions getDetection() {
        return detection;
    }

    public DynastyWeights getDynastyWeights() {
        return dynastyWeights;
    }

    public SeverityWeights getSeverityWeights() {
        return severityWeights;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Award-date window for concentration metrics.
     */
    public AnalysisWindow getAnalysisWindow() {
        return analysisWindow;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Stricter entity resolution, everything else at defaults.
     */
    public static PipelineOptions conservative() {
        return builder().resolution(ResolutionOptions.conservative()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolutionOptions resolution = ResolutionOptions.defaults();
        private DerivationOptions derivation = DerivationOptions.defaults();
        private DetectionOptions detection = DetectionOptions.defaults();
        private DynastyWeights dynastyWeights = DynastyWeights.defaults();
        private SeverityWeights severityWeights = SeverityWeights.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private AnalysisWindow analysisWindow = AnalysisWindow.unbounded();

        public Builder resolution(ResolutionOptions resolution) {
            this.resolution = Objects.requireNonNull(resolution, "resolution is required");
            return this;
        }

        public Builder derivation(DerivationOptions derivation) {
            this.derivation = Objects.requireNonNull(derivation, "derivation is required");
            return this;
        }

        public Builder detection(DetectionOptions detection) {
            this.detection = Objects.requireNonNull(detection, "detection is required");
            return this;
        }

        public Builder dynastyWeights(DynastyWeights dynastyWeights) {
            this.dynastyWeights = Objects.requireNonNull(dynastyWeights, "dynastyWeights is required");
            return this;
        }

        public Builder severityWeights(SeverityWeights severityWeights) {
            this.severityWeights = Objects.requireNonNull(severityWeights, "severityWeights is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder analysisWindow(AnalysisWindow analysisWindow) {
            this.analysisWindow = Objects.requireNonNull(analysisWindow, "analysisWindow is required");
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
