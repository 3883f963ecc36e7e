package com.homeostat.core.approval;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for an outstanding approval. {@code decision} completes with {@code true}
 * on approval, {@code false} on rejection, or exceptionally with a
 * {@link java.util.concurrent.TimeoutException} once the request expires.
 */
public record PendingApproval(
        String id,
        ApprovalRequest request,
        CompletableFuture<Boolean> decision
) {}
