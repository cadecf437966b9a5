package com.papertrail.core.health;

import com.papertrail.core.graph.GraphConnection;

/**
 * Graph store connectivity. Executes a trivial query and measures latency.
 */
public class GraphStoreHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public GraphStoreHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "graph-store";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            connection.query("RETURN 1");
            long latencyMs = System.currentTimeMillis() - startMs;

            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("graphName", connection.getGraphName());
        } catch (RuntimeException e) {
            return HealthStatus.down("Graph store connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
