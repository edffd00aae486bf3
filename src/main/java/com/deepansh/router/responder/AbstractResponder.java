package com.deepansh.router.responder;

import com.deepansh.router.exception.ResponderException;
import com.deepansh.router.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Base class for responders: identity derived from the name, and the output checks
 * every variant must pass before the orchestrator sees its result.
 *
 * Subclasses implement {@link #respond}; any unchecked failure they raise is wrapped in
 * a {@link ResponderException} carrying the responder id.
 */
@Slf4j
public abstract class AbstractResponder implements Responder {

    private final String id;
    private final String name;
    private final String description;
    private final ResponderCapabilities capabilities;
    private final boolean saveChat;

    protected AbstractResponder(String name, String description,
                                ResponderCapabilities capabilities, boolean saveChat) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("responder name must not be blank");
        }
        this.id = generateKeyFromName(name);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("responder name '" + name + "' yields an empty id");
        }
        this.name = name;
        this.description = description != null ? description : "";
        this.capabilities = capabilities != null ? capabilities : ResponderCapabilities.PLAIN;
        this.saveChat = saveChat;
    }

    /**
     * "Tech Agent!" → "tech-agent": drops everything but letters, digits, whitespace and
     * dashes, then turns whitespace runs into single dashes.
     */
    public static String generateKeyFromName(String name) {
        String key = name.replaceAll("[^a-zA-Z0-9\\s-]", "");
        return key.trim().replaceAll("\\s+", "-").toLowerCase(Locale.ROOT);
    }

    @Override
    public final ResponderOutput process(ResponderRequest request) {
        log.debug("Responder invoked [responder={}, user={}, session={}, history={}]",
                id, request.getUserId(), request.getSessionId(), request.getHistory().size());

        ResponderOutput output;
        try {
            output = respond(request);
        } catch (ResponderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResponderException("Responder '" + id + "' failed: " + e.getMessage(), e);
        }

        if (output == null) {
            throw new ResponderException("Responder '" + id + "' produced no output");
        }
        if (output.isStreaming() != capabilities.streaming()) {
            throw new ResponderException("Responder '" + id + "' returned "
                    + (output.isStreaming() ? "a stream" : "a message")
                    + " but declares streaming=" + capabilities.streaming());
        }
        if (!output.isStreaming() && isEmpty(output.getMessage())) {
            throw new ResponderException("Responder '" + id + "' returned an empty message");
        }
        return output;
    }

    protected abstract ResponderOutput respond(ResponderRequest request);

    static boolean isEmpty(Message message) {
        return message.getRole() != Message.Role.assistant
                || (message.getText().isBlank() && !message.hasToolUse());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public ResponderCapabilities getCapabilities() {
        return capabilities;
    }

    @Override
    public boolean isSaveChat() {
        return saveChat;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
