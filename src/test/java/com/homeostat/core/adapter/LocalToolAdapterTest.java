package com.homeostat.core.adapter;

import com.homeostat.core.model.ToolCall;
import com.homeostat.core.model.ToolResult;
import com.homeostat.core.tools.LocalTool;
import com.homeostat.core.tools.ToolExecutionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalToolAdapterTest {

    private static LocalTool tool(String name, String output) {
        return new LocalTool() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String execute(ToolCall call) {
                if (output == null) {
                    throw new ToolExecutionException("disk on fire");
                }
                return output;
            }
        };
    }

    @Test
    void dispatchesByName() {
        var adapter = new LocalToolAdapter(List.of(tool("echo", "hi"), tool("broken", null)));

        ToolResult ok = adapter.execute(new ToolCall("c1", "echo", Map.of()));
        ToolResult failed = adapter.execute(new ToolCall("c2", "broken", Map.of()));

        assertTrue(ok.success());
        assertEquals("hi", ok.output());
        assertEquals("c1", ok.callId());
        assertFalse(failed.success());
        assertEquals("disk on fire", failed.error());
    }

    @Test
    void unknownToolIsAFailedResult() {
        var adapter = new LocalToolAdapter(List.of(tool("echo", "hi")));

        ToolResult result = adapter.execute(new ToolCall("c1", "missing", Map.of()));

        assertFalse(result.success());
        assertTrue(result.error().contains("missing"));
    }

    @Test
    void duplicateNamesRejected() {
        assertThrows(IllegalStateException.class,
                () -> new LocalToolAdapter(List.of(tool("echo", "a"), tool("echo", "b"))));
    }
}
