package com.homeostat.core.adapter;

import com.homeostat.core.model.ToolCall;
import com.homeostat.core.model.ToolResult;
import com.homeostat.core.port.ToolPort;
import com.homeostat.core.tools.LocalTool;
import com.homeostat.core.tools.ToolExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches tool calls to in-process {@link LocalTool}s by name.
 */
public class LocalToolAdapter implements ToolPort {

    private static final Logger log = LoggerFactory.getLogger(LocalToolAdapter.class);

    private final Map<String, LocalTool> tools = new LinkedHashMap<>();

    public LocalToolAdapter(List<LocalTool> tools) {
        for (LocalTool tool : tools) {
            if (this.tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate local tool: " + tool.name());
            }
        }
        log.info("Local tools available: {}", this.tools.keySet());
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    @Override
    public ToolResult execute(ToolCall call) {
        long start = System.currentTimeMillis();
        LocalTool tool = tools.get(call.name());
        if (tool == null) {
            return ToolResult.failure(call.id(), call.name(), "No local implementation for tool " + call.name(), 0);
        }
        try {
            String output = tool.execute(call);
            return ToolResult.success(call.id(), call.name(), output, System.currentTimeMillis() - start);
        } catch (ToolExecutionException e) {
            log.info("Tool {} failed: {}", call.name(), e.getMessage());
            return ToolResult.failure(call.id(), call.name(), e.getMessage(), System.currentTimeMillis() - start);
        }
    }
}
