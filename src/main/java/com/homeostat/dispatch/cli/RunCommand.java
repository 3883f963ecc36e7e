package com.homeostat.dispatch.cli;

import com.homeostat.core.approval.ApprovalRequest;
import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.approval.PendingApproval;
import com.homeostat.core.engine.TaskService;
import com.homeostat.core.model.StepRecord;
import com.homeostat.core.model.TaskResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: homeostat run "&lt;message&gt;"
 * <p>
 * Submits one task and waits for it, answering capability approvals on the console
 * (or automatically with {@code --approve-all} / {@code --reject-all}).
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute one task")
@Component
public class RunCommand implements Runnable {

    private static final long POLL_MS = 100;

    @Parameters(index = "0", description = "Task message")
    private String message;

    @Option(names = {"--session", "-s"}, description = "Session id; history is loaded and saved under it")
    private String sessionId;

    @Option(names = "--approve-all", description = "Approve every capability approval this task requests")
    private boolean approveAll;

    @Option(names = "--reject-all", description = "Reject every capability approval this task requests")
    private boolean rejectAll;

    @Option(names = {"--verbose", "-v"}, description = "Print the step audit trail")
    private boolean verbose;

    private final TaskService taskService;
    private final ApprovalService approvals;

    public RunCommand(TaskService taskService, ApprovalService approvals) {
        this.taskService = taskService;
        this.approvals = approvals;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (approveAll && rejectAll) {
            ConsoleOutput.error("--approve-all and --reject-all cannot be combined");
            return;
        }

        ConsoleOutput.info("Running task...");
        TaskResult result;
        try {
            result = await(taskService.submit(sessionId, message));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for the task");
            return;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Task failed: " + rootCauseMessage(e));
            return;
        }

        System.out.println();
        if (result.succeeded()) {
            System.out.println(result.reply());
            System.out.println();
            ConsoleOutput.success("Task complete (" + result.steps().size() + " steps)");
        } else {
            ConsoleOutput.error(result.errorSummary());
        }
        if (verbose) {
            System.out.println();
            for (StepRecord step : result.steps()) {
                ConsoleOutput.step(step);
            }
            ConsoleOutput.metrics(result.metricsSummary());
        }
        ConsoleOutput.info("Trace: " + result.traceId());
    }

    private TaskResult await(CompletableFuture<TaskResult> future) throws InterruptedException, ExecutionException {
        Set<String> answered = new HashSet<>();
        BufferedReader console = null;
        while (true) {
            try {
                return future.get(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                for (PendingApproval pending : approvals.pending()) {
                    ApprovalRequest request = pending.request();
                    if (request.kind() != ApprovalRequest.Kind.CAPABILITY || !answered.add(pending.id())) {
                        continue;
                    }
                    if (console == null && !approveAll && !rejectAll) {
                        console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                    }
                    answer(pending, console);
                }
            }
        }
    }

    private void answer(PendingApproval pending, BufferedReader console) {
        ApprovalRequest request = pending.request();
        ConsoleOutput.approval(pending.id(), request.subject(), request.reason());
        boolean approve;
        if (approveAll) {
            approve = true;
        } else if (rejectAll) {
            approve = false;
        } else {
            System.out.print("Approve? [y/N] ");
            System.out.flush();
            approve = readYes(console);
        }
        if (approve) {
            approvals.approve(pending.id());
            ConsoleOutput.success("Approved " + pending.id());
        } else {
            approvals.reject(pending.id());
            ConsoleOutput.error("Rejected " + pending.id());
        }
    }

    private static boolean readYes(BufferedReader console) {
        try {
            String line = console.readLine();
            return line != null && line.trim().toLowerCase().startsWith("y");
        } catch (IOException e) {
            ConsoleOutput.error("Could not read answer: " + e.getMessage());
            return false;
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
