package me.golemcore.pragent.domain.system.react;

import me.golemcore.pragent.domain.model.Message;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Message history of one autonomous run, after the system prompt.
 */
class ConversationHistory {

    private final Clock clock;
    private final List<Message> messages = new ArrayList<>();

    ConversationHistory(Clock clock) {
        this.clock = clock;
    }

    void appendUser(String content) {
        messages.add(message(Message.ROLE_USER)
                .content(content)
                .build());
    }

    void appendAssistantText(String content) {
        if (content == null || content.isBlank()) {
            return;
        }
        messages.add(message(Message.ROLE_ASSISTANT)
                .content(content)
                .build());
    }

    void appendAssistantToolCalls(String content, List<Message.ToolCall> toolCalls) {
        messages.add(message(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(new ArrayList<>(toolCalls))
                .build());
    }

    void appendToolResult(ToolExecutionOutcome outcome) {
        messages.add(message(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .build());
    }

    /**
     * A copy of the history, safe to hand to a request.
     */
    List<Message> snapshot() {
        return new ArrayList<>(messages);
    }

    private Message.MessageBuilder message(String role) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .timestamp(clock.instant());
    }
}
