package com.papertrail.core.redflag;

/**
 * A detector that threw or ran out of time. Its flags are missing from the
 * run; every other detector's flags are kept.
 */
public record DetectorFailure(String detector, String errorType, String message, boolean timedOut) {

    static DetectorFailure of(String detector, Throwable error) {
        return new DetectorFailure(detector, error.getClass().getName(), error.getMessage(), false);
    }

    static DetectorFailure timeout(String detector, long millis) {
        return new DetectorFailure(detector, "timeout", "no result after " + millis + " ms", true);
    }
}
