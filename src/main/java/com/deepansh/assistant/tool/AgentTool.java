package com.deepansh.assistant.tool;

import java.util.List;
import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The parameter list is rendered as JSON Schema and sent to the model so it
 * knows how to invoke the tool. Arguments arrive already bound by name, with
 * declared defaults filled in for omitted optional parameters.
 *
 * Implementations may throw; {@link ToolRegistry} turns any exception into an
 * error string that goes back to the model as an ordinary tool result.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /**
     * Natural-language description. This is the main signal the model uses
     * to decide when to call the tool.
     */
    String getDescription();

    /** Ordered parameter descriptors. */
    List<ToolParameter> getParameters();

    /** Runs the tool and returns the text observation fed back to the model. */
    String execute(Map<String, Object> arguments) throws Exception;

    /** Image-related tools are only registered when multimodal support is on. */
    default boolean isMultimodal() {
        return false;
    }
}
