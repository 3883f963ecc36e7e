package com.homeostat.core.tools;

import com.homeostat.core.model.ToolCall;

/**
 * A tool executed in-process. Governance has already admitted the call by the time
 * {@link #execute} runs.
 */
public interface LocalTool {

    String name();

    /**
     * @return textual output handed back to the model
     * @throws ToolExecutionException when the tool cannot complete
     */
    String execute(ToolCall call);
}
