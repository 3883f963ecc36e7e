package com.homeostat.core.engine;

import com.homeostat.core.adapter.InMemorySessionAdapter;
import com.homeostat.core.adapter.LocalModelAdapter;
import com.homeostat.core.adapter.LocalToolAdapter;
import com.homeostat.core.approval.ApprovalService;
import com.homeostat.core.config.HomeostatProperties;
import com.homeostat.core.events.EventBus;
import com.homeostat.core.events.HomeostatEvent;
import com.homeostat.core.governance.CommandAllowlistService;
import com.homeostat.core.governance.DeniedException;
import com.homeostat.core.governance.GovernanceGate;
import com.homeostat.core.governance.PathRestrictionService;
import com.homeostat.core.governance.SlidingWindowRateLimiter;
import com.homeostat.core.metrics.HomeostatMetrics;
import com.homeostat.core.model.ChatMessage;
import com.homeostat.core.model.Mode;
import com.homeostat.core.model.StepRecord;
import com.homeostat.core.model.TaskError;
import com.homeostat.core.model.TaskResult;
import com.homeostat.core.model.TaskState;
import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.sensor.MetricSampler;
import com.homeostat.core.steps.InitStepHandler;
import com.homeostat.core.steps.ModelCallStepHandler;
import com.homeostat.core.steps.ModelRoleClassifier;
import com.homeostat.core.steps.PlanningStepHandler;
import com.homeostat.core.steps.SynthesisStepHandler;
import com.homeostat.core.steps.ToolExecutionStepHandler;
import com.homeostat.core.tools.ListDirectoryTool;
import com.homeostat.core.tools.ReadFileTool;
import com.homeostat.core.tools.WriteFileTool;
import com.homeostat.support.MutableModeView;
import com.homeostat.support.TestPolicies;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    @TempDir
    Path workDir;

    private final GovernancePolicy policy = TestPolicies.standard();
    private final MutableModeView modeView = new MutableModeView(policy, Mode.NORMAL);
    private final EventBus eventBus = new EventBus();
    private final List<HomeostatEvent> events = new CopyOnWriteArrayList<>();
    private final InMemorySessionAdapter sessions = new InMemorySessionAdapter();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private GovernanceGate gate;
    private TaskExecutor executor;
    private TaskService service;

    @BeforeEach
    void setUp() {
        eventBus.subscribeAll(events::add);
        Clock clock = Clock.systemUTC();
        var properties = new HomeostatProperties();
        var metrics = new HomeostatMetrics(registry);
        var approvals = new ApprovalService(eventBus, metrics, clock);
        gate = new GovernanceGate(policy, modeView, new SlidingWindowRateLimiter(), new PathRestrictionService(),
                new CommandAllowlistService(), metrics, clock);

        var model = new LocalModelAdapter();
        var tools = new LocalToolAdapter(List.of(new ReadFileTool(properties), new ListDirectoryTool(properties),
                new WriteFileTool()));
        var classifier = new ModelRoleClassifier(properties);
        List<StepHandler> handlers = List.of(
                new InitStepHandler(sessions, classifier),
                new PlanningStepHandler(model, gate),
                new ModelCallStepHandler(model, gate, policy),
                new ToolExecutionStepHandler(tools, properties),
                new SynthesisStepHandler(sessions));
        executor = new TaskExecutor(handlers, gate, modeView, approvals, policy, eventBus, metrics, clock, properties);
        var sampler = new MetricSampler(List.of(), List.of(), modeView, eventBus, metrics, clock, properties);
        service = new TaskService(executor, gate, modeView, sampler, eventBus, metrics, clock, properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        executor.shutdown();
    }

    private List<String> eventTypes() {
        return events.stream().map(HomeostatEvent::eventType).toList();
    }

    @Test
    @DisplayName("a tool-using request completes through the whole pipeline")
    void completesWithTool() throws Exception {
        Path file = workDir.resolve("notes.txt");
        Files.writeString(file, "remember the milk");

        TaskResult result = service.run(null, "read " + file);

        assertTrue(result.succeeded());
        assertNull(result.errorSummary());
        assertTrue(result.reply().contains("remember the milk"), result.reply());
        assertEquals(List.of(TaskState.INIT, TaskState.MODEL_CALL, TaskState.TOOL_EXECUTION,
                        TaskState.MODEL_CALL, TaskState.SYNTHESIS),
                result.steps().stream().map(StepRecord::fromState).toList());
        assertEquals(0, gate.slotsInUse());

        List<String> types = eventTypes();
        assertEquals(HomeostatEvent.TASK_STARTED, types.get(0));
        assertEquals(HomeostatEvent.TASK_COMPLETED, types.get(types.size() - 1));
        assertEquals(1.0, registry.get("homeostat.tasks.total").tag("status", "COMPLETED").counter().count());
    }

    @Test
    @DisplayName("a plain request is answered without tools")
    void completesWithoutTool() {
        TaskResult result = service.run(null, "hello there");

        assertEquals(TaskState.COMPLETED, result.state());
        assertEquals("Acknowledged: hello there", result.reply());
        assertEquals(3, result.steps().size());
        assertNotNull(result.metricsSummary());
        assertEquals(0, result.metricsSummary().sampleCount());
        assertNull(result.metricsSummary().cpuAvg());
    }

    @Test
    @DisplayName("a request refused at admission has no steps and a generic summary")
    void admissionRefusedInLockdown() {
        modeView.set(Mode.LOCKDOWN);

        TaskResult result = service.run(null, "hello there");

        assertEquals(TaskState.FAILED, result.state());
        assertTrue(result.steps().isEmpty());
        assertEquals(List.of(HomeostatEvent.TASK_STARTED, HomeostatEvent.POLICY_VIOLATION, HomeostatEvent.TASK_FAILED),
                eventTypes());
        assertTrue(result.errorSummary().contains(result.traceId()));
        assertFalse(result.errorSummary().contains("concurrency"));
        assertFalse(result.errorSummary().contains("LOCKDOWN"));
        assertEquals(0, gate.slotsInUse());

        HomeostatEvent failed = events.get(events.size() - 1);
        assertEquals(DeniedException.class.getSimpleName(), failed.payload().get("error_type"));
        assertEquals(0, failed.payload().get("steps"));
    }

    @Test
    @DisplayName("a denied tool fails the task without leaking its arguments")
    void deniedPathNotLeaked() {
        TaskResult result = service.run(null, "read /etc/passwd");

        assertEquals(TaskState.FAILED, result.state());
        assertEquals(ErrorSummaries.summarize(
                        new TaskError(DeniedException.class.getSimpleName(),
                                TaskState.TOOL_EXECUTION, "x"), result.traceId()),
                result.errorSummary());
        assertFalse(result.errorSummary().contains("/etc"));
        assertEquals(0, gate.slotsInUse());
    }

    @Test
    @DisplayName("requests in the same session see earlier turns")
    void sessionHistoryCarried() {
        service.run("s-1", "hello there");
        service.run("s-1", "and again");

        List<ChatMessage> history = sessions.load("s-1");
        assertEquals(List.of(ChatMessage.USER, ChatMessage.ASSISTANT, ChatMessage.USER, ChatMessage.ASSISTANT),
                history.stream().map(ChatMessage::role).toList());
        assertEquals("Acknowledged: and again", history.get(3).content());
    }

    @Test
    @DisplayName("submitted requests run on the task pool")
    void submitRunsAsync() throws Exception {
        TaskResult result = service.submit(null, "hello there").get(5, TimeUnit.SECONDS);

        assertEquals(TaskState.COMPLETED, result.state());
        assertNotNull(result.traceId());
        assertTrue(events.stream().allMatch(e -> result.traceId().equals(e.traceId())));
    }
}
