package com.homeostat.core.steps;

import com.homeostat.core.engine.RetryPolicy;
import com.homeostat.core.engine.StepHandler;
import com.homeostat.core.engine.StepOutcome;
import com.homeostat.core.governance.Capability;
import com.homeostat.core.governance.GovernanceGate;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.port.ModelPort;
import com.homeostat.core.port.ModelResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the planner role for a short plan and adds it to the conversation.
 */
@Component
public class PlanningStepHandler implements StepHandler {

    static final String PLANNING_PROMPT =
            "Before answering, write a short numbered plan (at most five steps) for the last request. "
                    + "Do not answer it yet.";

    private final ModelPort model;
    private final GovernanceGate gate;

    public PlanningStepHandler(ModelPort model, GovernanceGate gate) {
        this.model = model;
        this.gate = gate;
    }

    @Override
    public TaskState state() {
        return TaskState.PLANNING;
    }

    @Override
    public List<Capability> capabilities(ExecutionContext context) {
        return List.of(Capability.modelRole(ModelRoleClassifier.PLANNER));
    }

    @Override
    public StepOutcome handle(ExecutionContext context) {
        Capability planner = Capability.modelRole(ModelRoleClassifier.PLANNER);
        var messages = new ArrayList<>(context.messages());
        messages.add(ChatMessage.system(PLANNING_PROMPT));

        ModelResponse response = model.complete(
                ModelRequests.of(ModelRoleClassifier.PLANNER, messages, gate.limitsFor(planner), List.of()));
        String plan = response.content() == null ? "" : response.content().strip();

        ExecutionContext next = context.toBuilder().plan(plan).build();
        if (!plan.isEmpty()) {
            next = next.withMessage(ChatMessage.system("Plan:\n" + plan));
        }
        return StepOutcome.to(TaskState.MODEL_CALL, next);
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RetryPolicy.TRANSIENT;
    }
}
