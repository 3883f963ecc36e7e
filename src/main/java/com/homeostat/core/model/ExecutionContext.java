package com.homeostat.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one task's execution.
 * <p>
 * Immutable: step handlers return a modified copy and the executor adopts it, so a
 * handler that is cancelled after its timeout can never leak writes into the task.
 */
public record ExecutionContext(
        String traceId,
        String sessionId,
        String userMessage,
        TaskState state,
        List<ChatMessage> messages,
        List<ToolCall> pendingToolCalls,
        List<ToolResult> toolResults,
        String plan,
        String modelRole,
        int toolIterations,
        String reply,
        TaskError error,
        List<StepRecord> steps,
        MetricsSummary metricsSummary,
        Instant createdAt
) implements Serializable {

    public ExecutionContext {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(state, "state");
        messages = messages == null ? List.of() : List.copyOf(messages);
        pendingToolCalls = pendingToolCalls == null ? List.of() : List.copyOf(pendingToolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Creates a fresh context in {@link TaskState#INIT}.
     */
    public static ExecutionContext start(String traceId, String sessionId, String userMessage, Instant now) {
        return new ExecutionContext(traceId, sessionId, userMessage, TaskState.INIT,
                List.of(), List.of(), List.of(), null, null, 0, null, null, List.of(), null, now);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Optional<StepRecord> lastStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1));
    }

    public ExecutionContext withState(TaskState next) {
        return toBuilder().state(next).build();
    }

    public ExecutionContext withStep(StepRecord record) {
        var all = new ArrayList<>(steps);
        all.add(record);
        return toBuilder().steps(all).build();
    }

    public ExecutionContext withMessage(ChatMessage message) {
        var all = new ArrayList<>(messages);
        all.add(message);
        return toBuilder().messages(all).build();
    }

    public ExecutionContext failed(TaskError taskError) {
        return toBuilder().state(TaskState.FAILED).error(taskError).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private String traceId;
        private String sessionId;
        private String userMessage;
        private TaskState state;
        private List<ChatMessage> messages;
        private List<ToolCall> pendingToolCalls;
        private List<ToolResult> toolResults;
        private String plan;
        private String modelRole;
        private int toolIterations;
        private String reply;
        private TaskError error;
        private List<StepRecord> steps;
        private MetricsSummary metricsSummary;
        private Instant createdAt;

        private Builder(ExecutionContext source) {
            this.traceId = source.traceId;
            this.sessionId = source.sessionId;
            this.userMessage = source.userMessage;
            this.state = source.state;
            this.messages = source.messages;
            this.pendingToolCalls = source.pendingToolCalls;
            this.toolResults = source.toolResults;
            this.plan = source.plan;
            this.modelRole = source.modelRole;
            this.toolIterations = source.toolIterations;
            this.reply = source.reply;
            this.error = source.error;
            this.steps = source.steps;
            this.metricsSummary = source.metricsSummary;
            this.createdAt = source.createdAt;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages = messages;
            return this;
        }

        public Builder pendingToolCalls(List<ToolCall> pendingToolCalls) {
            this.pendingToolCalls = pendingToolCalls;
            return this;
        }

        public Builder toolResults(List<ToolResult> toolResults) {
            this.toolResults = toolResults;
            return this;
        }

        public Builder plan(String plan) {
            this.plan = plan;
            return this;
        }

        public Builder modelRole(String modelRole) {
            this.modelRole = modelRole;
            return this;
        }

        public Builder toolIterations(int toolIterations) {
            this.toolIterations = toolIterations;
            return this;
        }

        public Builder reply(String reply) {
            this.reply = reply;
            return this;
        }

        public Builder error(TaskError error) {
            this.error = error;
            return this;
        }

        public Builder steps(List<StepRecord> steps) {
            this.steps = steps;
            return this;
        }

        public Builder metricsSummary(MetricsSummary metricsSummary) {
            this.metricsSummary = metricsSummary;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(traceId, sessionId, userMessage, state, messages, pendingToolCalls,
                    toolResults, plan, modelRole, toolIterations, reply, error, steps, metricsSummary, createdAt);
        }
    }
}
