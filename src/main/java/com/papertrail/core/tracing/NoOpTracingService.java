package com.papertrail.core.tracing;

public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span stageSpan(String runId, String stage) {
        return NO_OP_SPAN;
    }

    @Override
    public Span detectorSpan(String runId, String detectorCode) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void count(String name, long value) {
        }

        @Override
        public void succeeded() {
        }

        @Override
        public void failed(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
