package com.homeostat.core.engine;

import com.homeostat.core.approval.ApprovalRequest;
import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.approval.ApprovalTimeoutException;
import com.homeostat.core.approval.PendingApproval;
import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.governance.Capability;
import com.homeostat.core.governance.CommandAllowlistService;
import com.homeostat.core.governance.DeniedException;
import com.homeostat.core.governance.GovernanceGate;
import com.homeostat.core.governance.PathRestrictionService;
import com.homeostat.core.governance.SlidingWindowRateLimiter;
import com.homeostat.core.logging.MdcContext;
import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.Mode;
import com.homeostat.core.model.StepRecord;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.model.ToolCall;
import com.homeostat.core.model.ToolResult;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.port.ModelTransportException;
import com.homeostat.core.trace.TraceContext;
import com.homeostat.support.MutableModeView;
import com.homeostat.support.TestPolicies;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class TaskExecutorTest {

    private final GovernancePolicy policy = TestPolicies.standard();
    private final MutableModeView modeView = new MutableModeView(policy, Mode.NORMAL);
    private final Clock clock = Clock.systemUTC();
    private final EventBus eventBus = new EventBus();
    private final List<HomeostatEvent> events = new CopyOnWriteArrayList<>();
    private final Map<TaskState, ScriptedHandler> handlers = new EnumMap<>(TaskState.class);

    private HomeostatMetrics metrics;
    private ApprovalService approvals;
    private GovernanceGate gate;
    private HomeostatProperties properties;
    private TaskExecutor executor;

    /** Tool the MODEL_CALL step asks for on its first pass, or {@code null} for none. */
    private volatile ToolCall requestedTool;

    @BeforeEach
    void setUp() {
        eventBus.subscribeAll(events::add);
        metrics = new HomeostatMetrics(new SimpleMeterRegistry());
        approvals = new ApprovalService(eventBus, metrics, clock);
        gate = new GovernanceGate(policy, modeView, new SlidingWindowRateLimiter(), new PathRestrictionService(),
                new CommandAllowlistService(), metrics, clock);
        properties = new HomeostatProperties();
        properties.getExecutor().setRetryBackoff(Duration.ofMillis(10));

        handle(TaskState.INIT, ctx -> StepOutcome.to(TaskState.MODEL_CALL, ctx));
        handle(TaskState.PLANNING, ctx -> StepOutcome.to(TaskState.MODEL_CALL, ctx));
        handlers.put(TaskState.MODEL_CALL, new ScriptedHandler(TaskState.MODEL_CALL,
                ctx -> List.of(Capability.modelRole("standard")), this::modelCall, RetryPolicy.TRANSIENT));
        handlers.put(TaskState.TOOL_EXECUTION, new ScriptedHandler(TaskState.TOOL_EXECUTION,
                ctx -> ctx.pendingToolCalls().stream().map(Capability::tool).toList(), this::runTools, RetryPolicy.NONE));
        handle(TaskState.SYNTHESIS, ctx -> StepOutcome.to(TaskState.COMPLETED, ctx));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        MDC.clear();
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private void handle(TaskState state, Function<ExecutionContext, StepOutcome> body) {
        handlers.put(state, new ScriptedHandler(state, ctx -> List.of(), body, RetryPolicy.NONE));
    }

    private StepOutcome modelCall(ExecutionContext ctx) {
        if (requestedTool != null && ctx.toolResults().isEmpty()) {
            return StepOutcome.to(TaskState.TOOL_EXECUTION,
                    ctx.toBuilder().pendingToolCalls(List.of(requestedTool)).build());
        }
        return StepOutcome.to(TaskState.SYNTHESIS, ctx.toBuilder().reply("done").build());
    }

    private StepOutcome runTools(ExecutionContext ctx) {
        var results = new ArrayList<>(ctx.toolResults());
        for (ToolCall call : ctx.pendingToolCalls()) {
            results.add(ToolResult.success(call.id(), call.name(), "ok", 1));
        }
        return StepOutcome.to(TaskState.MODEL_CALL, ctx.toBuilder()
                .toolResults(results)
                .pendingToolCalls(List.of())
                .toolIterations(ctx.toolIterations() + 1)
                .build());
    }

    private TaskExecutor executor() {
        executor = new TaskExecutor(new ArrayList<>(handlers.values()), gate, modeView, approvals, policy,
                eventBus, metrics, clock, properties);
        return executor;
    }

    private static ExecutionContext newTask(String message) {
        return ExecutionContext.start("trace-" + message.hashCode(), null, message, Instant.now());
    }

    private static void assertGapFree(ExecutionContext result) {
        long[] sequences = result.steps().stream().mapToLong(StepRecord::sequence).toArray();
        assertArrayEquals(LongStream.rangeClosed(1, sequences.length).toArray(), sequences);
    }

    private List<HomeostatEvent> events(String type) {
        return events.stream().filter(e -> e.eventType().equals(type)).toList();
    }

    private PendingApproval awaitPendingApproval() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            List<PendingApproval> pending = approvals.pending();
            if (!pending.isEmpty()) {
                return pending.get(0);
            }
            Thread.sleep(10);
        }
        throw new AssertionError("no approval was requested");
    }

    @Nested
    @DisplayName("successful tasks")
    class Successful {

        @Test
        @DisplayName("runs every state in order with gap-free sequence numbers")
        void sequenceIsGapFree() {
            requestedTool = new ToolCall("call-1", "read_file", Map.of("path", "/tmp/a.txt"));

            ExecutionContext result = executor().execute(newTask("read it"));

            assertEquals(TaskState.COMPLETED, result.state());
            assertEquals("done", result.reply());
            assertGapFree(result);
            assertEquals(List.of(TaskState.INIT, TaskState.MODEL_CALL, TaskState.TOOL_EXECUTION,
                            TaskState.MODEL_CALL, TaskState.SYNTHESIS),
                    result.steps().stream().map(StepRecord::fromState).toList());
            assertEquals(TaskState.COMPLETED, result.lastStep().orElseThrow().toState());

            List<HomeostatEvent> transitions = events(HomeostatEvent.STATE_TRANSITION);
            assertEquals(5, transitions.size());
            for (int i = 0; i < transitions.size(); i++) {
                assertEquals(result.traceId(), transitions.get(i).traceId());
                assertEquals((long) i + 1, transitions.get(i).payload().get("sequence"));
            }
        }

        @Test
        @DisplayName("executing a terminal context returns it unchanged and records nothing")
        void terminalIsIdempotent() {
            ExecutionContext done = executor().execute(newTask("hello"));
            events.clear();

            ExecutionContext again = executor.execute(done);

            assertSame(done, again);
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("a resumed context continues numbering after its recorded steps")
        void resumeContinuesSequence() {
            ExecutionContext task = newTask("resume");
            ExecutionContext first = executor().step(task, TraceContext.resume(task),
                    System.nanoTime() + TimeUnit.SECONDS.toNanos(30));
            assertEquals(TaskState.MODEL_CALL, first.state());

            ExecutionContext result = executor.execute(first);

            assertEquals(TaskState.COMPLETED, result.state());
            assertGapFree(result);
            assertEquals(3, result.steps().size());
        }

        @Test
        @DisplayName("handlers see the trace and step in the MDC")
        void mdcPropagated() {
            var seen = new CopyOnWriteArrayList<String>();
            handle(TaskState.INIT, ctx -> {
                seen.add(MDC.get(MdcContext.TRACE_ID) + "/" + MDC.get(MdcContext.STEP_SEQ)
                        + "/" + MDC.get(MdcContext.TASK_STATE));
                return StepOutcome.to(TaskState.MODEL_CALL, ctx);
            });
            ExecutionContext task = newTask("mdc");

            executor().execute(task);

            assertEquals(List.of(task.traceId() + "/1/INIT"), seen);
            assertNull(MDC.get(MdcContext.TRACE_ID));
        }
    }

    @Nested
    @DisplayName("governance")
    class Governance {

        @Test
        @DisplayName("a denied tool fails the task without running the tool step")
        void deniedToolNeverRuns() {
            modeView.set(Mode.DEGRADED);
            requestedTool = new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"));

            ExecutionContext result = executor().execute(newTask("write it"));

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(0, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
            assertEquals(DeniedException.class.getSimpleName(), result.error().type());
            assertEquals(TaskState.TOOL_EXECUTION, result.error().state());
            assertGapFree(result);
            StepRecord last = result.lastStep().orElseThrow();
            assertEquals(TaskState.TOOL_EXECUTION, last.fromState());
            assertEquals(TaskState.FAILED, last.toState());
            assertEquals(0, last.attempts());

            List<HomeostatEvent> violations = events(HomeostatEvent.POLICY_VIOLATION);
            assertEquals(1, violations.size());
            assertEquals("tool:write_file", violations.get(0).payload().get("capability"));
            assertEquals("DEGRADED", violations.get(0).payload().get("mode"));
        }

        @Test
        @DisplayName("a write in LOCKDOWN is denied before the tool step runs")
        void writeDeniedInLockdown() {
            modeView.set(Mode.LOCKDOWN);
            ExecutionContext task = newTask("write in lockdown").toBuilder()
                    .state(TaskState.TOOL_EXECUTION)
                    .pendingToolCalls(List.of(new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"))))
                    .build();

            ExecutionContext result = executor().execute(task);

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(0, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
            assertEquals(DeniedException.class.getSimpleName(), result.error().type());
            assertEquals(TaskState.TOOL_EXECUTION, result.error().state());
            assertEquals(1, result.steps().size());
            assertEquals(0, result.lastStep().orElseThrow().attempts());
            assertTrue(approvals.pending().isEmpty());

            List<HomeostatEvent> violations = events(HomeostatEvent.POLICY_VIOLATION);
            assertEquals(1, violations.size());
            assertEquals("tool:write_file", violations.get(0).payload().get("capability"));
            assertEquals("LOCKDOWN", violations.get(0).payload().get("mode"));
        }

        @Test
        @DisplayName("a task waits for approval and resumes without a sequence gap")
        void approvalSuspendsAndResumes() throws Exception {
            requestedTool = new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"));
            ExecutionContext task = newTask("approve me");
            TaskExecutor exec = executor();

            CompletableFuture<ExecutionContext> running = CompletableFuture.supplyAsync(() -> exec.execute(task));
            PendingApproval pending = awaitPendingApproval();

            assertEquals(ApprovalRequest.Kind.CAPABILITY, pending.request().kind());
            assertEquals(task.traceId(), pending.request().traceId());
            assertEquals("tool:write_file", pending.request().subject());
            assertFalse(running.isDone());
            assertEquals(0, handlers.get(TaskState.TOOL_EXECUTION).calls.get());

            approvals.approve(pending.id());
            ExecutionContext result = running.get(5, TimeUnit.SECONDS);

            assertEquals(TaskState.COMPLETED, result.state());
            assertEquals(1, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
            assertGapFree(result);
            assertEquals(5, result.steps().size());
            assertEquals(1, events(HomeostatEvent.APPROVAL_REQUIRED).size());
        }

        @Test
        @DisplayName("a rejected approval fails the task as denied")
        void rejectedApprovalDenies() throws Exception {
            requestedTool = new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"));
            TaskExecutor exec = executor();
            CompletableFuture<ExecutionContext> running =
                    CompletableFuture.supplyAsync(() -> exec.execute(newTask("reject me")));

            approvals.reject(awaitPendingApproval().id());
            ExecutionContext result = running.get(5, TimeUnit.SECONDS);

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(DeniedException.class.getSimpleName(), result.error().type());
            assertEquals(0, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
        }

        @Test
        @DisplayName("an unanswered approval expires and fails the task")
        void approvalExpires() {
            requestedTool = new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"));

            ExecutionContext result = executor().execute(newTask("nobody answers"));

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(ApprovalTimeoutException.class.getSimpleName(), result.error().type());
            assertEquals(0, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
        }
    }

    @Nested
    @DisplayName("approval waits and the task budget")
    class ApprovalBudget {

        @Test
        @DisplayName("an approval wait ends when the task budget runs out and the request is withdrawn")
        void approvalWaitBoundedByBudget() {
            properties.getExecutor().setTaskBudget(Duration.ofMillis(300));
            requestedTool = new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"));

            long start = System.nanoTime();
            ExecutionContext result = executor().execute(newTask("nobody answers in time"));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMs < 1_000, "took " + elapsedMs + "ms");
            assertEquals(TaskState.FAILED, result.state());
            assertEquals(StepTimeoutException.class.getSimpleName(), result.error().type());
            assertEquals(TaskState.TOOL_EXECUTION, result.error().state());
            assertEquals(0, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
            assertGapFree(result);

            assertTrue(approvals.pending().isEmpty());
            List<HomeostatEvent> denied = events(HomeostatEvent.APPROVAL_DENIED);
            assertEquals(1, denied.size());
            assertEquals("cancelled", denied.get(0).payload().get("outcome"));
        }

        @Test
        @DisplayName("an approval that arrives within the budget still lets the task finish")
        void approvalWithinBudget() throws Exception {
            properties.getExecutor().setTaskBudget(Duration.ofSeconds(5));
            requestedTool = new ToolCall("call-1", "write_file", Map.of("path", "/tmp/out.txt"));
            TaskExecutor exec = executor();
            CompletableFuture<ExecutionContext> running =
                    CompletableFuture.supplyAsync(() -> exec.execute(newTask("answered in time")));

            approvals.approve(awaitPendingApproval().id());
            ExecutionContext result = running.get(5, TimeUnit.SECONDS);

            assertEquals(TaskState.COMPLETED, result.state());
            assertEquals(1, handlers.get(TaskState.TOOL_EXECUTION).calls.get());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a step that overruns its timeout is cancelled and only its task fails")
        void stepTimeout() throws Exception {
            AtomicBoolean interrupted = new AtomicBoolean();
            handlers.put(TaskState.MODEL_CALL, new ScriptedHandler(TaskState.MODEL_CALL,
                    ctx -> List.of(Capability.modelRole(ctx.userMessage().equals("slow") ? "reasoning" : "standard")),
                    ctx -> {
                        if (ctx.userMessage().equals("slow")) {
                            try {
                                Thread.sleep(10_000);
                            } catch (InterruptedException e) {
                                interrupted.set(true);
                                Thread.currentThread().interrupt();
                            }
                        }
                        return StepOutcome.to(TaskState.SYNTHESIS, ctx.toBuilder().reply("done").build());
                    }, RetryPolicy.NONE));
            TaskExecutor exec = executor();

            long start = System.nanoTime();
            CompletableFuture<ExecutionContext> slow = CompletableFuture.supplyAsync(() -> exec.execute(newTask("slow")));
            ExecutionContext fast = exec.execute(newTask("fast"));
            ExecutionContext timedOut = slow.get(8, TimeUnit.SECONDS);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(TaskState.COMPLETED, fast.state());
            assertEquals(TaskState.FAILED, timedOut.state());
            assertEquals(StepTimeoutException.class.getSimpleName(), timedOut.error().type());
            assertEquals(TaskState.MODEL_CALL, timedOut.error().state());
            assertTrue(elapsedMs < 5_000, "took " + elapsedMs + "ms");
            assertGapFree(timedOut);
            Thread.sleep(100);
            assertTrue(interrupted.get());
        }

        @Test
        @DisplayName("an exception from a handler fails the task and is recorded, never thrown")
        void handlerExceptionContained() {
            handle(TaskState.SYNTHESIS, ctx -> {
                throw new IllegalStateException("boom at /secret/path");
            });

            ExecutionContext result = assertDoesNotThrow(() -> executor().execute(newTask("explode")));

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(StepExecutionException.class.getSimpleName(), result.error().type());
            assertEquals(TaskState.SYNTHESIS, result.error().state());
            assertEquals(1, result.lastStep().orElseThrow().attempts());
            assertEquals("StepExecutionException",
                    events(HomeostatEvent.STATE_TRANSITION).get(2).payload().get("error_type"));
        }

        @Test
        @DisplayName("a null outcome is treated as a handler failure")
        void nullOutcome() {
            handle(TaskState.INIT, ctx -> null);

            ExecutionContext result = executor().execute(newTask("null"));

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(StepExecutionException.class.getSimpleName(), result.error().type());
        }

        @Test
        @DisplayName("transient model failures are retried within the step")
        void transientRetried() {
            AtomicInteger attempts = new AtomicInteger();
            handlers.put(TaskState.MODEL_CALL, new ScriptedHandler(TaskState.MODEL_CALL, ctx -> List.of(),
                    ctx -> {
                        if (attempts.incrementAndGet() == 1) {
                            throw new ModelTransportException("connection reset");
                        }
                        return StepOutcome.to(TaskState.SYNTHESIS, ctx.toBuilder().reply("done").build());
                    }, RetryPolicy.TRANSIENT));

            ExecutionContext result = executor().execute(newTask("flaky"));

            assertEquals(TaskState.COMPLETED, result.state());
            assertEquals(2, result.steps().get(1).attempts());
            assertGapFree(result);
        }

        @Test
        @DisplayName("retries stop at the configured attempt count")
        void retriesExhausted() {
            handlers.put(TaskState.MODEL_CALL, new ScriptedHandler(TaskState.MODEL_CALL, ctx -> List.of(),
                    ctx -> {
                        throw new ModelTransportException("down");
                    }, RetryPolicy.TRANSIENT));

            ExecutionContext result = executor().execute(newTask("down"));

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(properties.getExecutor().getRetryAttempts(), result.lastStep().orElseThrow().attempts());
            assertEquals(properties.getExecutor().getRetryAttempts(),
                    handlers.get(TaskState.MODEL_CALL).calls.get());
        }

        @Test
        @DisplayName("the task budget caps the total time across steps")
        void taskBudget() {
            properties.getExecutor().setTaskBudget(Duration.ofMillis(300));
            handle(TaskState.INIT, ctx -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return StepOutcome.to(TaskState.MODEL_CALL, ctx);
            });

            long start = System.nanoTime();
            ExecutionContext result = executor().execute(newTask("budget"));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(TaskState.FAILED, result.state());
            assertEquals(StepTimeoutException.class.getSimpleName(), result.error().type());
            assertTrue(elapsedMs < 1_500, "took " + elapsedMs + "ms");
        }
    }

    @Nested
    @DisplayName("handler registration")
    class Registration {

        @Test
        @DisplayName("every non-terminal state needs a handler")
        void missingHandler() {
            handlers.remove(TaskState.PLANNING);

            assertThrows(IllegalStateException.class, TaskExecutorTest.this::executor);
        }

        @Test
        @DisplayName("a state may have only one handler")
        void duplicateHandler() {
            var list = new ArrayList<StepHandler>(handlers.values());
            list.add(new ScriptedHandler(TaskState.INIT, ctx -> List.of(), ctx -> null, RetryPolicy.NONE));

            assertThrows(IllegalStateException.class, () -> new TaskExecutor(list, gate, modeView, approvals,
                    policy, eventBus, metrics, clock, properties));
        }
    }

    private static final class ScriptedHandler implements StepHandler {

        private final TaskState state;
        private final Function<ExecutionContext, List<Capability>> capabilities;
        private final Function<ExecutionContext, StepOutcome> body;
        private final RetryPolicy retry;
        final AtomicInteger calls = new AtomicInteger();

        ScriptedHandler(TaskState state, Function<ExecutionContext, List<Capability>> capabilities,
                        Function<ExecutionContext, StepOutcome> body, RetryPolicy retry) {
            this.state = state;
            this.capabilities = capabilities;
            this.body = body;
            this.retry = retry;
        }

        @Override
        public TaskState state() {
            return state;
        }

        @Override
        public List<Capability> capabilities(ExecutionContext context) {
            return capabilities.apply(context);
        }

        @Override
        public StepOutcome handle(ExecutionContext context) {
            calls.incrementAndGet();
            return body.apply(context);
        }

        @Override
        public RetryPolicy retryPolicy() {
            return retry;
        }
    }
}
