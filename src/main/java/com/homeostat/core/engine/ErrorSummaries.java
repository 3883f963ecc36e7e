package com.homeostat.core.engine;

import com.homeostat.core.approval.ApprovalTimeoutException;
import com.homeostat.core.governance.DeniedException;
import com.homeostat.core.model.TaskError;

import java.util.Map;

/**
 * Requester-facing failure text. Chosen by error type only; error messages may carry
 * paths, arguments or backend details and are never included.
 */
public final class ErrorSummaries {

    static final String GENERIC = "The request could not be completed.";

    private static final Map<String, String> BY_TYPE = Map.of(
            DeniedException.class.getSimpleName(),
            "The request was blocked by the current operating policy.",
            ApprovalTimeoutException.class.getSimpleName(),
            "The request needed an approval that was not given in time.",
            StepTimeoutException.class.getSimpleName(),
            "The request took too long and was stopped.",
            StepExecutionException.class.getSimpleName(),
            "The request could not be completed because of an internal error.");

    private ErrorSummaries() {}

    public static String summarize(TaskError error, String traceId) {
        String text = error == null ? GENERIC : BY_TYPE.getOrDefault(error.type(), GENERIC);
        return text + " (trace " + traceId + ")";
    }
}
