package com.homeostat.core.steps;

import com.homeostat.core.engine.StepHandler;
import com.homeostat.core.engine.StepOutcome;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.port.SessionPort;
import org.springframework.stereotype.Component;

/**
 * Settles the final reply and persists the conversation for the session.
 */
@Component
public class SynthesisStepHandler implements StepHandler {

    static final String DEFAULT_REPLY = "Task completed";

    private final SessionPort sessions;

    public SynthesisStepHandler(SessionPort sessions) {
        this.sessions = sessions;
    }

    @Override
    public TaskState state() {
        return TaskState.SYNTHESIS;
    }

    @Override
    public StepOutcome handle(ExecutionContext context) {
        String reply = context.reply() == null || context.reply().isBlank() ? DEFAULT_REPLY : context.reply();
        ExecutionContext next = context.toBuilder().reply(reply).build();

        boolean replyRecorded = !next.messages().isEmpty()
                && ChatMessage.ASSISTANT.equals(next.messages().get(next.messages().size() - 1).role())
                && reply.equals(next.messages().get(next.messages().size() - 1).content());
        if (!replyRecorded) {
            next = next.withMessage(ChatMessage.assistant(reply));
        }
        sessions.save(next.sessionId(), next.messages());
        return StepOutcome.to(TaskState.COMPLETED, next);
    }
}
