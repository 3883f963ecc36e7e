package com.homeostat.core.steps;

import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.engine.StepHandler;
import com.homeostat.core.engine.StepOutcome;
import com.homeostat.core.governance.Capability;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.model.ToolCall;
import com.homeostat.core.model.ToolResult;
import com.homeostat.core.port.ToolPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the tool calls the model asked for and hands the results back to the model.
 * Once the tool loop limit is passed, stops calling tools and goes to SYNTHESIS with
 * a summary of the latest results.
 */
@Component
public class ToolExecutionStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionStepHandler.class);

    private final ToolPort tools;
    private final int maxIterations;

    public ToolExecutionStepHandler(ToolPort tools, HomeostatProperties properties) {
        this.tools = tools;
        this.maxIterations = properties.getExecutor().getMaxToolIterations();
    }

    @Override
    public TaskState state() {
        return TaskState.TOOL_EXECUTION;
    }

    @Override
    public List<Capability> capabilities(ExecutionContext context) {
        if (limitReached(context)) {
            return List.of();
        }
        return context.pendingToolCalls().stream().map(Capability::tool).toList();
    }

    @Override
    public StepOutcome handle(ExecutionContext context) {
        int iteration = context.toolIterations() + 1;
        if (limitReached(context)) {
            log.warn("Tool loop limit of {} reached; returning best-effort reply", maxIterations);
            ExecutionContext next = context.toBuilder()
                    .toolIterations(iteration)
                    .pendingToolCalls(List.of())
                    .reply(fallbackReply(context.toolResults()))
                    .build();
            return StepOutcome.to(TaskState.SYNTHESIS, next);
        }

        var results = new ArrayList<>(context.toolResults());
        var messages = new ArrayList<>(context.messages());
        for (ToolCall call : context.pendingToolCalls()) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            ToolResult result = tools.execute(call);
            log.info("Tool {} {} in {}ms", call.name(), result.success() ? "succeeded" : "failed", result.latencyMs());
            results.add(result);
            messages.add(ChatMessage.tool(result));
        }

        ExecutionContext next = context.toBuilder()
                .toolIterations(iteration)
                .pendingToolCalls(List.of())
                .toolResults(results)
                .messages(messages)
                .build();
        return StepOutcome.to(TaskState.MODEL_CALL, next);
    }

    private boolean limitReached(ExecutionContext context) {
        return context.toolIterations() + 1 > maxIterations;
    }

    static String fallbackReply(List<ToolResult> results) {
        if (results.isEmpty()) {
            return "I attempted to use tools, but couldn't produce a final answer. Try rephrasing your request.";
        }
        var lines = new ArrayList<String>();
        lines.add("I attempted to use tools, but could not finish the answer. Latest tool results:");
        for (ToolResult r : results.subList(Math.max(0, results.size() - 3), results.size())) {
            lines.add(r.success()
                    ? "- " + r.toolName() + ": success"
                    : "- " + r.toolName() + ": failed (" + (r.error() != null ? r.error() : "unknown error") + ")");
        }
        return String.join("\n", lines);
    }
}
