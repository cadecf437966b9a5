package com.papertrail.core.tracing;

/**
 * Tracing integration point. Opens one span per pipeline stage and one per
 * detector run, both tagged with the run id. The default
 * {@link NoOpTracingService} does nothing.
 */
public interface TracingService {

    Span stageSpan(String runId, String stage);

    Span detectorSpan(String runId, String detectorCode);
}
