package com.deepansh.router.responder;

/**
 * Static capabilities of a responder. {@code streaming} fixes the output shape of
 * every {@link Responder#process} call; it is never decided per request.
 */
public record ResponderCapabilities(boolean streaming, boolean usesTools, boolean usesRetrieval) {

    public static final ResponderCapabilities PLAIN = new ResponderCapabilities(false, false, false);

    public static ResponderCapabilities streamingOnly() {
        return new ResponderCapabilities(true, false, false);
    }
}
