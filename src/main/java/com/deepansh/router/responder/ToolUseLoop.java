package com.deepansh.router.responder;

import com.deepansh.router.model.Message;
import com.deepansh.router.model.MessageValidator;
import com.deepansh.router.tool.ToolHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded tool-use state machine.
 *
 * Each round invokes the model with the working conversation. A reply carrying ToolUse
 * blocks is answered through the {@link ToolHandler}; both messages are appended and the
 * model is invoked again. The loop stops at the first reply without ToolUse, or once the
 * recursion budget (set once per {@link #run} call, never reset) is spent. Exhaustion is
 * soft: the last reply is returned and flagged.
 */
@Slf4j
public class ToolUseLoop {

    public static final int DEFAULT_MAX_RECURSIONS = 20;

    /** One model invocation over the working conversation. */
    @FunctionalInterface
    public interface ModelCall {
        Message invoke(List<Message> conversation);
    }

    public record Outcome(Message lastMessage, String accumulatedText, int invocations,
                          boolean exhausted, List<Message> conversation) {
    }

    private final ToolHandler toolHandler;
    private final int maxRecursions;

    public ToolUseLoop(ToolHandler toolHandler, int maxRecursions) {
        if (toolHandler == null) {
            throw new IllegalArgumentException("toolHandler must not be null");
        }
        if (maxRecursions < 1) {
            throw new IllegalArgumentException("toolMaxRecursions must be >= 1, got " + maxRecursions);
        }
        this.toolHandler = toolHandler;
        this.maxRecursions = maxRecursions;
    }

    public Outcome run(List<Message> initialConversation, ModelCall modelCall) {
        List<Message> conversation = new ArrayList<>(initialConversation);
        ToolExchangeState state = new ToolExchangeState(maxRecursions);
        Message reply;

        do {
            reply = modelCall.invoke(List.copyOf(conversation));
            state.recordInvocation(reply);

            if (state.canRecurse()) {
                conversation.add(reply);
                Message toolResults = toolHandler.handle(reply, List.copyOf(conversation));
                MessageValidator.validate(toolResults, conversation);
                conversation.add(toolResults);
                log.debug("Tool round {} answered {} tool use(s), {} recursion(s) left",
                        state.getInvocations(), reply.getToolUses().size(), state.getRecursionsRemaining());
            }
        } while (state.canRecurse());

        boolean exhausted = reply.hasToolUse();
        if (exhausted) {
            log.warn("Tool recursion budget of {} exhausted; returning last reply", maxRecursions);
        }
        return new Outcome(reply, state.getAccumulatedText(), state.getInvocations(), exhausted,
                List.copyOf(conversation));
    }
}
