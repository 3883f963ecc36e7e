package com.homeostat.core.mode;

import com.homeostat.core.model.Mode;

import java.io.Serializable;
import java.time.Instant;

/**
 * The active mode and its constraints, published together as one immutable value.
 *
 * @param version increases by one on every applied transition
 * @param cause   rule that produced this mode, or {@code "initial"}
 */
public record ModeSnapshot(
        Mode mode,
        ConstraintSet constraints,
        Instant since,
        long version,
        String cause
) implements Serializable {

    public ModeSnapshot {
        if (constraints.mode() != mode) {
            throw new IllegalArgumentException(
                    "Constraint set for " + constraints.mode() + " cannot be published with mode " + mode);
        }
    }
}
