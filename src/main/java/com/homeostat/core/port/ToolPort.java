package com.homeostat.core.port;

import com.homeostat.core.model.ToolCall;
import com.homeostat.core.model.ToolResult;

/**
 * Tool layer. Failures are reported in the returned {@link ToolResult}, not thrown.
 */
public interface ToolPort {

    ToolResult execute(ToolCall call);
}
