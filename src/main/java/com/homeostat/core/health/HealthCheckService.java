package com.homeostat.core.health;

import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.mode.ModeController;
import com.homeostat.core.mode.ModeSnapshot;
import com.homeostat.core.sensor.MetricSampler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Component health as seen from the operating mode, the sampler and pending approvals.
 */
@Service
public class HealthCheckService {

    /** The sampler counts as stalled after this many missed intervals. */
    static final int STALL_INTERVALS = 3;

    private final ModeController modeController;
    private final MetricSampler sampler;
    private final ApprovalService approvals;
    private final Clock clock;
    private final HomeostatProperties.Sampler samplerConfig;

    public HealthCheckService(ModeController modeController, MetricSampler sampler, ApprovalService approvals,
                              Clock clock, HomeostatProperties properties) {
        this.modeController = modeController;
        this.sampler = sampler;
        this.approvals = approvals;
        this.clock = clock;
        this.samplerConfig = properties.getSampler();
    }

    public List<HealthStatus> checkAll() {
        return List.of(checkMode(), checkSampler(), checkApprovals());
    }

    /**
     * Most severe status across {@code statuses}.
     */
    public static HealthStatus.Status overall(List<HealthStatus> statuses) {
        HealthStatus.Status worst = HealthStatus.Status.UP;
        for (HealthStatus s : statuses) {
            if (s.status().ordinal() > worst.ordinal()) {
                worst = s.status();
            }
        }
        return worst;
    }

    HealthStatus checkMode() {
        ModeSnapshot snapshot = modeController.current();
        HealthStatus.Status status = switch (snapshot.mode()) {
            case NORMAL -> HealthStatus.Status.UP;
            case ALERT, DEGRADED, RECOVERY -> HealthStatus.Status.DEGRADED;
            case LOCKDOWN -> HealthStatus.Status.OUT_OF_SERVICE;
        };
        return new HealthStatus("mode", status, "Operating in " + snapshot.mode(),
                Map.of("mode", snapshot.mode().name(),
                        "since", snapshot.since().toString(),
                        "version", String.valueOf(snapshot.version()),
                        "cause", snapshot.cause()));
    }

    HealthStatus checkSampler() {
        if (!samplerConfig.isEnabled()) {
            return new HealthStatus("sampler", HealthStatus.Status.DEGRADED,
                    "Sampling disabled by configuration", Map.of());
        }
        if (!sampler.isRunning()) {
            return new HealthStatus("sampler", HealthStatus.Status.DOWN, "Sampler not running", Map.of());
        }
        Optional<Instant> last = sampler.lastCycleAt();
        if (last.isEmpty()) {
            return new HealthStatus("sampler", HealthStatus.Status.UP, "Waiting for first sample", Map.of());
        }
        Duration age = Duration.between(last.get(), clock.instant());
        Duration limit = samplerConfig.getInterval().multipliedBy(STALL_INTERVALS)
                .plus(samplerConfig.getCollectorTimeout());
        Map<String, String> metadata = Map.of("lastSample", last.get().toString(),
                "ageMs", String.valueOf(age.toMillis()));
        if (age.compareTo(limit) > 0) {
            return new HealthStatus("sampler", HealthStatus.Status.DOWN,
                    "No sample for " + age.toSeconds() + "s", metadata);
        }
        return new HealthStatus("sampler", HealthStatus.Status.UP, "Sampling", metadata);
    }

    HealthStatus checkApprovals() {
        int pending = approvals.pending().size();
        Optional<String> transition = modeController.pendingApproval();
        var metadata = transition.map(id -> Map.of("pending", String.valueOf(pending), "modeTransition", id))
                .orElse(Map.of("pending", String.valueOf(pending)));
        return new HealthStatus("approvals", HealthStatus.Status.UP,
                pending == 0 ? "No pending approvals" : pending + " approval(s) pending", metadata);
    }
}
