package com.homeostat;

import com.homeostat.core.engine.TaskExecutor;
import com.homeostat.core.engine.TaskService;
import com.homeostat.core.mode.ModeView;
import com.homeostat.core.model.Mode;
import com.homeostat.core.model.TaskResult;
import com.homeostat.core.model.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Starts the full application context with the background sampler and controller tick
 * switched off, and runs one task through it.
 */
@SpringBootTest(properties = {
        "homeostat.sampler.enabled=false",
        "homeostat.controller.enabled=false",
        "homeostat.model.provider=local"
})
class HomeostatApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private TaskService tasks;

    @Autowired
    private ModeView modeView;

    @Test
    @DisplayName("the task executor bean coexists with Spring's application task executor")
    void executorBeansCoexist() {
        assertTrue(context.containsBean("applicationTaskExecutor"));
        assertSame(context.getBean(TaskExecutor.class), context.getBean("homeostatTaskExecutor"));
    }

    @Test
    @DisplayName("a plain request completes through the wired pipeline")
    void runsOneTask() {
        assertEquals(Mode.NORMAL, modeView.current().mode());

        TaskResult result = tasks.run(null, "hello there");

        assertEquals(TaskState.COMPLETED, result.state());
        assertEquals("Acknowledged: hello there", result.reply());
        assertEquals(3, result.steps().size());
        assertNull(result.errorSummary());
    }
}
