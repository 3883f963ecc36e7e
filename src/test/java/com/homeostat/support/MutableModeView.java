package com.homeostat.support;

import com.homeostat.core.mode.ConstraintSet;
import com.homeostat.core.mode.ModeSnapshot;
import com.homeostat.core.mode.ModeView;
import com.homeostat.core.model.Mode;
import com.homeostat.core.policy.GovernancePolicy;

import java.time.Instant;

/**
 * Mode view a test can switch directly, bypassing the controller's rules.
 */
public class MutableModeView implements ModeView {

    private final GovernancePolicy policy;
    private volatile ModeSnapshot snapshot;

    public MutableModeView(GovernancePolicy policy, Mode initial) {
        this.policy = policy;
        this.snapshot = new ModeSnapshot(initial, ConstraintSet.derive(initial, policy), Instant.EPOCH, 0, "initial");
    }

    public void set(Mode mode) {
        ModeSnapshot previous = snapshot;
        snapshot = new ModeSnapshot(mode, ConstraintSet.derive(mode, policy), Instant.EPOCH,
                previous.version() + 1, "test");
    }

    @Override
    public ModeSnapshot current() {
        return snapshot;
    }
}
