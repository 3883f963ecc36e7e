package com.homeostat.core.governance;

/**
 * Governance refused a capability. Ends the task that asked for it, nothing else.
 */
public class DeniedException extends RuntimeException {

    private final String capability;

    public DeniedException(String capability, String reason) {
        super("Capability " + capability + " denied: " + reason);
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
