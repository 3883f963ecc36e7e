package com.homeostat.dispatch.cli;

import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.approval.PendingApproval;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.mode.ModeController;
import com.homeostat.core.mode.ModeSnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * CLI command: homeostat serve
 * <p>
 * Keeps the sampler and mode controller running in the foreground, prints mode
 * transitions, control signals and approval requests as they happen, and reads operator
 * commands from standard input: {@code approve <id>}, {@code reject <id>},
 * {@code pending}, {@code status}, {@code quit}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the control loop in the foreground and answer approvals")
@Component
public class ServeCommand implements Runnable {

    private static final Set<String> WATCHED = Set.of(
            HomeostatEvent.MODE_TRANSITION,
            HomeostatEvent.CONTROL_SIGNAL,
            HomeostatEvent.APPROVAL_REQUIRED,
            HomeostatEvent.APPROVAL_GRANTED,
            HomeostatEvent.APPROVAL_DENIED,
            HomeostatEvent.POLICY_VIOLATION);

    private final ModeController modeController;
    private final ApprovalService approvals;
    private final EventBus eventBus;

    public ServeCommand(ModeController modeController, ApprovalService approvals, EventBus eventBus) {
        this.modeController = modeController;
        this.approvals = approvals;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        serve(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    void serve(BufferedReader input) {
        ConsoleOutput.printBanner();
        ModeSnapshot snapshot = modeController.current();
        ConsoleOutput.mode(snapshot.mode(), "control loop running");
        ConsoleOutput.info("Commands: approve <id>, reject <id>, pending, status, quit");
        System.out.println();

        EventBus.Subscription subscription = eventBus.subscribeAll(event -> {
            if (WATCHED.contains(event.eventType())) {
                ConsoleOutput.watchEvent(event.eventType(), event.payload().toString());
            }
        });
        try {
            String line;
            while ((line = input.readLine()) != null) {
                if (!handle(line.trim())) {
                    return;
                }
            }
            // stdin closed: keep serving until interrupted
            ConsoleOutput.info("Input closed; press Ctrl+C to stop.");
            Thread.currentThread().join();
        } catch (IOException e) {
            ConsoleOutput.error("Console input failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            subscription.unsubscribe();
            ConsoleOutput.info("Stopped.");
        }
    }

    /** Returns {@code false} when the operator asked to stop. */
    boolean handle(String line) {
        if (line.isEmpty()) {
            return true;
        }
        String[] parts = line.split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String argument = parts.length > 1 ? parts[1] : null;
        switch (command) {
            case "quit", "exit" -> {
                return false;
            }
            case "pending" -> {
                var pending = approvals.pending();
                if (pending.isEmpty()) {
                    ConsoleOutput.info("No pending approvals");
                }
                for (PendingApproval p : pending) {
                    ConsoleOutput.approval(p.id(), p.request().subject(), p.request().reason());
                }
            }
            case "status" -> {
                ModeSnapshot snapshot = modeController.current();
                ConsoleOutput.mode(snapshot.mode(), "since " + snapshot.since() + " (cause: " + snapshot.cause() + ")");
            }
            case "approve", "reject" -> {
                if (argument == null) {
                    ConsoleOutput.error("Usage: " + command + " <approval-id>");
                } else if (command.equals("approve") ? approvals.approve(argument) : approvals.reject(argument)) {
                    ConsoleOutput.success((command.equals("approve") ? "Approved " : "Rejected ") + argument);
                } else {
                    ConsoleOutput.error("No pending approval " + argument);
                }
            }
            default -> ConsoleOutput.error("Unknown command: " + command);
        }
        return true;
    }
}
