package com.homeostat.core.steps;

import com.homeostat.core.engine.RetryPolicy;
import com.homeostat.core.engine.StepHandler;
import com.homeostat.core.engine.StepOutcome;
import com.homeostat.core.governance.Capability;
import com.homeostat.core.governance.GovernanceGate;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.port.ModelPort;
import com.homeostat.core.port.ModelResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Calls the model with the selected role. Tool requests lead to TOOL_EXECUTION,
 * a plain answer to SYNTHESIS.
 */
@Component
public class ModelCallStepHandler implements StepHandler {

    private final ModelPort model;
    private final GovernanceGate gate;
    private final List<String> toolNames;

    public ModelCallStepHandler(ModelPort model, GovernanceGate gate, GovernancePolicy policy) {
        this.model = model;
        this.gate = gate;
        this.toolNames = policy.tools().keySet().stream().sorted().toList();
    }

    @Override
    public TaskState state() {
        return TaskState.MODEL_CALL;
    }

    @Override
    public List<Capability> capabilities(ExecutionContext context) {
        return List.of(Capability.modelRole(roleOf(context)));
    }

    @Override
    public StepOutcome handle(ExecutionContext context) {
        String role = roleOf(context);
        ModelResponse response = model.complete(
                ModelRequests.of(role, context.messages(), gate.limitsFor(Capability.modelRole(role)), toolNames));

        if (response.hasToolCalls()) {
            ExecutionContext next = context.withMessage(ChatMessage.assistant(response.content(), response.toolCalls()))
                    .toBuilder()
                    .pendingToolCalls(response.toolCalls())
                    .build();
            return StepOutcome.to(TaskState.TOOL_EXECUTION, next);
        }
        String reply = response.content() == null ? "" : response.content().strip();
        ExecutionContext next = context.withMessage(ChatMessage.assistant(reply))
                .toBuilder()
                .reply(reply)
                .build();
        return StepOutcome.to(TaskState.SYNTHESIS, next);
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RetryPolicy.TRANSIENT;
    }

    private static String roleOf(ExecutionContext context) {
        return context.modelRole() != null ? context.modelRole() : ModelRoleClassifier.STANDARD;
    }
}
