package com.homeostat.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homeostat.core.mode.ModeSnapshot;
import com.homeostat.core.mode.ModeView;
import com.homeostat.core.model.ToolCall;
import com.homeostat.core.sensor.MetricSample;
import com.homeostat.core.sensor.MetricSampler;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Reports the active mode and the most recent sample as JSON.
 */
@Component
public class SystemMetricsSnapshotTool implements LocalTool {

    public static final String NAME = "system_metrics_snapshot";

    private final MetricSampler sampler;
    private final ModeView modeView;
    private final ObjectMapper objectMapper;

    public SystemMetricsSnapshotTool(MetricSampler sampler, ModeView modeView, ObjectMapper objectMapper) {
        this.sampler = sampler;
        this.modeView = modeView;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String execute(ToolCall call) {
        ModeSnapshot snapshot = modeView.current();
        Optional<MetricSample> latest = sampler.latest();

        var report = new LinkedHashMap<String, Object>();
        report.put("mode", snapshot.mode().name());
        report.put("mode_since", snapshot.since().toString());
        report.put("sampled_at", latest.map(s -> s.timestamp().toString()).orElse(null));
        report.put("readings", latest.map(MetricSample::readings).orElse(null));
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Failed to render metrics snapshot", e);
        }
    }
}
