package com.homeostat.core.mode;

/**
 * Read-only access to the published mode snapshot.
 */
@FunctionalInterface
public interface ModeView {

    ModeSnapshot current();
}
