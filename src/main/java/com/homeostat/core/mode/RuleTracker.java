package com.homeostat.core.mode;

import com.homeostat.core.policy.Combinator;
import com.homeostat.core.policy.Condition;
import com.homeostat.core.policy.TransitionRule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Hysteresis state for one transition rule: when each condition last became true.
 * A condition's timer resets the moment it evaluates false or its metric is missing.
 */
final class RuleTracker {

    /** Supplies the value a condition compares against. */
    @FunctionalInterface
    interface Readings {
        OptionalDouble valueOf(Condition condition);
    }

    record Trigger(String metric, double value) {}

    private final TransitionRule rule;
    private final Instant[] trueSince;

    RuleTracker(TransitionRule rule) {
        this.rule = rule;
        this.trueSince = new Instant[rule.conditions().size()];
    }

    TransitionRule rule() {
        return rule;
    }

    /**
     * Updates every condition's timer and returns the trigger if the rule's combinator
     * is satisfied by sustained conditions.
     */
    Optional<Trigger> update(Instant now, Readings readings) {
        List<Condition> conditions = rule.conditions();
        Trigger first = null;
        boolean all = true;
        for (int i = 0; i < conditions.size(); i++) {
            Condition condition = conditions.get(i);
            OptionalDouble value = readings.valueOf(condition);
            boolean holds = value.isPresent() && condition.test(value.getAsDouble());
            if (!holds) {
                trueSince[i] = null;
                all = false;
                continue;
            }
            if (trueSince[i] == null) {
                trueSince[i] = now;
            }
            boolean sustained = Duration.between(trueSince[i], now).compareTo(condition.sustained()) >= 0;
            if (sustained) {
                if (first == null) {
                    first = new Trigger(condition.metric(), value.getAsDouble());
                }
            } else {
                all = false;
            }
        }
        if (rule.combinator() == Combinator.ALL) {
            return all && first != null ? Optional.of(first) : Optional.empty();
        }
        return Optional.ofNullable(first);
    }

    void reset() {
        for (int i = 0; i < trueSince.length; i++) {
            trueSince[i] = null;
        }
    }
}
