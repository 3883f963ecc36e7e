package com.homeostat.core.governance;

import java.io.Serializable;

/**
 * Outcome of a governance check.
 *
 * @param category the category the capability resolved to, or {@code "unknown"}
 * @param reason   why the capability was denied or needs approval; empty when allowed
 */
public record Decision(
        Verdict verdict,
        String category,
        String reason
) implements Serializable {

    public enum Verdict {
        ALLOWED,
        REQUIRES_APPROVAL,
        DENIED
    }

    public static Decision allowed(String category) {
        return new Decision(Verdict.ALLOWED, category, "");
    }

    public static Decision requiresApproval(String category, String reason) {
        return new Decision(Verdict.REQUIRES_APPROVAL, category, reason);
    }

    public static Decision denied(String category, String reason) {
        return new Decision(Verdict.DENIED, category, reason);
    }

    public boolean isAllowed() {
        return verdict == Verdict.ALLOWED;
    }

    public boolean isDenied() {
        return verdict == Verdict.DENIED;
    }

    public boolean requiresApproval() {
        return verdict == Verdict.REQUIRES_APPROVAL;
    }
}
