package com.homeostat.core.policy;

import com.homeostat.core.model.Mode;

import java.io.Serializable;
import java.util.List;

/**
 * Declarative mode transition. Rules for a source mode are evaluated in
 * {@code priority} order (lower first).
 */
public record TransitionRule(
        String name,
        Mode source,
        Mode target,
        List<Condition> conditions,
        Combinator combinator,
        boolean requiresApproval,
        int priority
) implements Serializable {

    public TransitionRule {
        conditions = List.copyOf(conditions);
    }
}
