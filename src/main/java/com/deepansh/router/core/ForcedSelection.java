package com.deepansh.router.core;

/** Bypasses classification: the request goes straight to {@code responderId}. */
public record ForcedSelection(String responderId, double confidence) {

    public static ForcedSelection of(String responderId) {
        return new ForcedSelection(responderId, 1.0);
    }
}
