package com.papertrail.core.pipeline;

import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.DynastyScore;
import com.papertrail.core.derive.DerivationResult;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.redflag.DetectionResult;
import com.papertrail.core.report.AnalysisReport;
import com.papertrail.core.resolution.ResolutionResult;

import java.util.List;

/**
 * Everything one run produced.
 *
 * @param warnings import and resolution warnings together
 */
public record PipelineResult(
        String runId,
        ResolutionResult resolution,
        ResolvedGraph graph,
        DerivationResult derivation,
        List<ConcentrationMetric> concentration,
        List<DynastyScore> dynasties,
        DetectionResult detection,
        AnalysisReport report,
        List<DataQualityWarning> warnings
) {
    public PipelineResult {
        concentration = List.copyOf(concentration);
        dynasties = List.copyOf(dynasties);
        warnings = List.copyOf(warnings);
    }
}
