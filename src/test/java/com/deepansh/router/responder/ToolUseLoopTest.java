package com.deepansh.router.responder;

import com.deepansh.router.exception.MalformedMessageException;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.TextBlock;
import com.deepansh.router.model.ToolResultBlock;
import com.deepansh.router.model.ToolUseBlock;
import com.deepansh.router.tool.ToolHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolUseLoopTest {

    private final AtomicInteger handlerCalls = new AtomicInteger();

    private final ToolHandler echoHandler = (toolUseMessage, conversation) -> {
        handlerCalls.incrementAndGet();
        Message.MessageBuilder result = Message.builder().role(Message.Role.user);
        toolUseMessage.getToolUses().forEach(use -> result.block(ToolResultBlock.success(use.id(), "ok")));
        return result.build();
    };

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 20})
    void run_modelAlwaysRequestsTools_invokesExactlyMaxRecursionsTimes(int maxRecursions) {
        AtomicInteger modelCalls = new AtomicInteger();
        ToolUseLoop loop = new ToolUseLoop(echoHandler, maxRecursions);

        ToolUseLoop.Outcome outcome = loop.run(List.of(Message.userText("loop forever")),
                conversation -> toolRequest("call-" + modelCalls.incrementAndGet(), "thinking"));

        assertThat(modelCalls).hasValue(maxRecursions);
        assertThat(outcome.invocations()).isEqualTo(maxRecursions);
        assertThat(outcome.exhausted()).isTrue();
        assertThat(outcome.lastMessage().hasToolUse()).isTrue();
        assertThat(handlerCalls).hasValue(maxRecursions - 1);
    }

    @Test
    void run_toolThenAnswer_stopsAtFirstReplyWithoutToolUse() {
        List<Integer> conversationSizes = new ArrayList<>();
        ToolUseLoop loop = new ToolUseLoop(echoHandler, ToolUseLoop.DEFAULT_MAX_RECURSIONS);

        ToolUseLoop.Outcome outcome = loop.run(List.of(Message.userText("echo hi")), conversation -> {
            conversationSizes.add(conversation.size());
            return conversation.size() == 1
                    ? toolRequest("call-1", "Let me echo that.")
                    : Message.assistantText("Echoed.");
        });

        assertThat(outcome.exhausted()).isFalse();
        assertThat(outcome.invocations()).isEqualTo(2);
        assertThat(outcome.lastMessage().getText()).isEqualTo("Echoed.");
        assertThat(outcome.accumulatedText()).isEqualTo("Let me echo that.\nEchoed.");
        assertThat(conversationSizes).containsExactly(1, 3);
        assertThat(outcome.conversation()).hasSize(3);
    }

    @Test
    void run_noToolUse_singleInvocationNoHandlerCall() {
        ToolUseLoop loop = new ToolUseLoop(echoHandler, 3);

        ToolUseLoop.Outcome outcome = loop.run(List.of(Message.userText("2+2")), c -> Message.assistantText("4"));

        assertThat(outcome.invocations()).isOne();
        assertThat(handlerCalls).hasValue(0);
    }

    @Test
    void run_handlerAnswersUnknownId_throwsMalformedMessage() {
        ToolHandler wrongIds = (toolUseMessage, conversation) -> Message.builder()
                .role(Message.Role.user)
                .block(ToolResultBlock.success("not-requested", "?"))
                .build();
        ToolUseLoop loop = new ToolUseLoop(wrongIds, 3);

        assertThatThrownBy(() -> loop.run(List.of(Message.userText("go")), c -> toolRequest("call-1", "")))
                .isInstanceOf(MalformedMessageException.class);
    }

    @Test
    void constructor_zeroRecursions_throws() {
        assertThatThrownBy(() -> new ToolUseLoop(echoHandler, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Message toolRequest(String id, String text) {
        Message.MessageBuilder builder = Message.builder().role(Message.Role.assistant);
        if (!text.isEmpty()) {
            builder.block(new TextBlock(text));
        }
        return builder.block(new ToolUseBlock(id, "echo", Map.of("message", "x"))).build();
    }
}
