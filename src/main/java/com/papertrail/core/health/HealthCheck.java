package com.papertrail.core.health;

/**
 * A check of one external dependency.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
