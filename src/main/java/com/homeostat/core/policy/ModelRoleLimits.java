package com.homeostat.core.policy;

import java.io.Serializable;
import java.time.Duration;

/**
 * Per-mode limits for one model role. {@code timeout} may be {@code null}, in which
 * case the mode's step timeout applies.
 */
public record ModelRoleLimits(
        int maxTokens,
        double temperature,
        Duration timeout
) implements Serializable {}
