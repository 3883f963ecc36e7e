package com.homeostat.core.approval;

import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.metrics.HomeostatMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Human-in-the-loop approvals for capabilities and mode transitions.
 * <p>
 * Requesters wait on {@link PendingApproval#decision()}; operators resolve through
 * {@link #approve} or {@link #reject}. Unresolved requests expire after their timeout.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final AtomicInteger counter = new AtomicInteger(0);
    private final ConcurrentHashMap<String, PendingApproval> pending = new ConcurrentHashMap<>();

    private final EventBus eventBus;
    private final HomeostatMetrics metrics;
    private final Clock clock;

    public ApprovalService(EventBus eventBus, HomeostatMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a request and publishes {@code approval_required}.
     */
    public PendingApproval request(ApprovalRequest request, Duration timeout) {
        String id = "APR-" + counter.incrementAndGet();
        var decision = new CompletableFuture<Boolean>();
        var approval = new PendingApproval(id, request, decision);
        pending.put(id, approval);

        log.info("Approval {} requested for {} ({}), expires in {}s",
                id, request.subject(), request.reason(), timeout.toSeconds());
        eventBus.publish(new HomeostatEvent(HomeostatEvent.APPROVAL_REQUIRED, request.traceId(),
                Map.of("approval_id", id,
                        "kind", request.kind().name(),
                        "subject", request.subject(),
                        "reason", request.reason(),
                        "timeout_seconds", timeout.toSeconds()),
                clock.instant()));

        decision.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((approved, error) -> onResolved(approval, approved, error));
        return approval;
    }

    public boolean approve(String id) {
        return resolve(id, true);
    }

    public boolean reject(String id) {
        return resolve(id, false);
    }

    /**
     * Withdraws an outstanding request; its requester sees the decision cancelled.
     */
    public boolean cancel(String id) {
        PendingApproval approval = pending.get(id);
        if (approval == null) {
            return false;
        }
        return approval.decision().cancel(false);
    }

    /** Outstanding requests, oldest first. */
    public List<PendingApproval> pending() {
        var list = new ArrayList<>(pending.values());
        list.sort(Comparator.comparing(p -> p.request().requestedAt()));
        return list;
    }

    public Optional<PendingApproval> find(String id) {
        return Optional.ofNullable(pending.get(id));
    }

    private boolean resolve(String id, boolean approved) {
        PendingApproval approval = pending.get(id);
        if (approval == null) {
            log.warn("No pending approval {}", id);
            return false;
        }
        return approval.decision().complete(approved);
    }

    /**
     * The request stays listed as pending until its outcome has been recorded and published.
     */
    private void onResolved(PendingApproval approval, Boolean approved, Throwable error) {
        String outcome;
        String eventType;
        if (error != null) {
            outcome = error instanceof TimeoutException ? "expired" : "cancelled";
            eventType = HomeostatEvent.APPROVAL_DENIED;
        } else if (Boolean.TRUE.equals(approved)) {
            outcome = "approved";
            eventType = HomeostatEvent.APPROVAL_GRANTED;
        } else {
            outcome = "rejected";
            eventType = HomeostatEvent.APPROVAL_DENIED;
        }
        log.info("Approval {} for {} {}", approval.id(), approval.request().subject(), outcome);
        try {
            metrics.recordApproval(outcome);
            eventBus.publish(new HomeostatEvent(eventType, approval.request().traceId(),
                    Map.of("approval_id", approval.id(),
                            "subject", approval.request().subject(),
                            "outcome", outcome),
                    clock.instant()));
        } finally {
            pending.remove(approval.id());
        }
    }
}
