package com.homeostat.core.mode;

import com.homeostat.core.model.Mode;

import java.io.Serializable;
import java.time.Instant;

/**
 * An applied mode change and the reading that triggered it.
 */
public record ModeTransition(
        Mode oldMode,
        Mode newMode,
        String rule,
        String triggerMetric,
        double triggerValue,
        Instant timestamp
) implements Serializable {}
