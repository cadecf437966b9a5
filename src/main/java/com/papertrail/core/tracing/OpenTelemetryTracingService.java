package com.papertrail.core.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Locale;

/**
 * OpenTelemetry-backed {@link TracingService}. Stage spans are named
 * {@code papertrail.stage.<stage>} and detector spans
 * {@code papertrail.detector.<code>}.
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final AttributeKey<String> RUN_ID = AttributeKey.stringKey("papertrail.run_id");
    public static final AttributeKey<String> STAGE = AttributeKey.stringKey("papertrail.stage");
    public static final AttributeKey<String> DETECTOR = AttributeKey.stringKey("papertrail.detector");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span stageSpan(String runId, String stage) {
        String name = stage.toLowerCase(Locale.ROOT);
        return new OTelSpanAdapter(tracer.spanBuilder("papertrail.stage." + name)
                .setAttribute(RUN_ID, runId)
                .setAttribute(STAGE, name)
                .startSpan());
    }

    @Override
    public Span detectorSpan(String runId, String detectorCode) {
        return new OTelSpanAdapter(tracer.spanBuilder("papertrail.detector." + detectorCode)
                .setAttribute(RUN_ID, runId)
                .setAttribute(DETECTOR, detectorCode)
                .startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void count(String name, long value) {
            otelSpan.setAttribute("papertrail." + name, value);
        }

        @Override
        public void succeeded() {
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(Throwable cause) {
            otelSpan.recordException(cause);
            otelSpan.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
