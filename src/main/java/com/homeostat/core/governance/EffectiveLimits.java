package com.homeostat.core.governance;

import java.io.Serializable;
import java.time.Duration;

/**
 * Limits applying to one capability in the active mode. Unset values are {@code null}.
 */
public record EffectiveLimits(
        Integer maxTokens,
        Double temperature,
        Duration timeout,
        Integer rateLimit,
        Duration rateWindow
) implements Serializable {}
