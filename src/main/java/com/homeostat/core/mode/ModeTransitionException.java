package com.homeostat.core.mode;

import com.homeostat.core.model.Mode;

/**
 * Raised when a fired rule names a target that cannot be entered from the current mode.
 * The controller logs it and stays where it is.
 */
public class ModeTransitionException extends RuntimeException {

    private final Mode from;
    private final Mode to;

    public ModeTransitionException(Mode from, Mode to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public Mode from() {
        return from;
    }

    public Mode to() {
        return to;
    }
}
