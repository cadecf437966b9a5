package com.papertrail.core.tracing;

/**
 * A traced stage or detector run. Ends when closed, so it fits try-with-resources.
 */
public interface Span extends AutoCloseable {

    /**
     * Records a result size such as edges derived or flags raised.
     */
    void count(String name, long value);

    void succeeded();

    void failed(Throwable cause);

    @Override
    void close();
}
