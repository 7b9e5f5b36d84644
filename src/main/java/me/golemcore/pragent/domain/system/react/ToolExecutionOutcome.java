package me.golemcore.pragent.domain.system.react;

import me.golemcore.pragent.domain.model.ToolResult;

/**
 * Result of one tool call, together with the text sent back to the model as
 * the tool message.
 */
record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent) {

    boolean isSuccess() {
        return toolResult != null && toolResult.isSuccess();
    }
}
