package com.homeostat.core.steps;

import com.homeostat.core.engine.StepHandler;
import com.homeostat.core.engine.StepOutcome;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.port.SessionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Loads the session history, appends the request and chooses the model role.
 */
@Component
public class InitStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(InitStepHandler.class);

    private final SessionPort sessions;
    private final ModelRoleClassifier classifier;

    public InitStepHandler(SessionPort sessions, ModelRoleClassifier classifier) {
        this.sessions = sessions;
        this.classifier = classifier;
    }

    @Override
    public TaskState state() {
        return TaskState.INIT;
    }

    @Override
    public StepOutcome handle(ExecutionContext context) {
        var messages = new ArrayList<>(sessions.load(context.sessionId()));
        int history = messages.size();
        messages.add(ChatMessage.user(context.userMessage()));

        String role = classifier.classify(context.userMessage());
        boolean plan = classifier.needsPlanning(context.userMessage());
        log.info("Request classified as {} ({} history messages, planning={})", role, history, plan);

        ExecutionContext next = context.toBuilder()
                .messages(messages)
                .modelRole(role)
                .build();
        return StepOutcome.to(plan ? TaskState.PLANNING : TaskState.MODEL_CALL, next);
    }
}
