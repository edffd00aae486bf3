package com.deepansh.router.responder;

/** Public description of a registered responder, as listed to callers and classifiers. */
public record ResponderRegistration(String id, String name, String description,
                                    ResponderCapabilities capabilities) {

    public static ResponderRegistration of(Responder responder) {
        return new ResponderRegistration(responder.getId(), responder.getName(),
                responder.getDescription(), responder.getCapabilities());
    }
}
