package com.deepansh.router.responder;

/**
 * A pluggable capability that answers one user turn.
 *
 * The orchestrator depends only on this interface. Concrete transports (hosted models,
 * remote functions, rule tables) stay behind it.
 */
public interface Responder {

    /** Stable identifier derived from the name; unique within a registry. */
    String getId();

    String getName();

    /** Free text describing what this responder handles; shown to classifiers. */
    String getDescription();

    ResponderCapabilities getCapabilities();

    /** Whether exchanges answered by this responder are written to history. */
    default boolean isSaveChat() {
        return true;
    }

    /**
     * Produces the reply to one user turn. The output is a stream exactly when
     * {@link ResponderCapabilities#streaming()} is set.
     *
     * @throws com.deepansh.router.exception.ResponderException when no output can be produced
     */
    ResponderOutput process(ResponderRequest request);

    default ResponderRegistration registration() {
        return ResponderRegistration.of(this);
    }
}
