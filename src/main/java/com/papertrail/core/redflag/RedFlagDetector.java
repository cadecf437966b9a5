package com.papertrail.core.redflag;

import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.RedFlagType;

import java.util.List;

/**
 * One detector of the battery. Implementations read only the context, never
 * another detector's output, and may run concurrently with each other.
 */
public interface RedFlagDetector {

    RedFlagType getType();

    List<RedFlag> detect(DetectionContext context);

    default String getName() {
        return getType().getCode();
    }
}
