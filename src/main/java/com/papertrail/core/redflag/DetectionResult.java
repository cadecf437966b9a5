package com.papertrail.core.redflag;

import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;

import java.util.List;

/**
 * Flags of all detectors that completed, and the detectors that did not.
 */
public record DetectionResult(List<RedFlag> flags, List<DetectorFailure> failures) {

    public DetectionResult {
        flags = List.copyOf(flags);
        failures = List.copyOf(failures);
    }

    public List<RedFlag> ofType(RedFlagType type) {
        return flags.stream().filter(f -> f.getType() == type).toList();
    }

    public List<RedFlag> concerning(String entityId) {
        return flags.stream().filter(f -> f.concerns(entityId)).toList();
    }

    public long count(Severity severity) {
        return flags.stream().filter(f -> f.getSeverity() == severity).count();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
