package com.deepansh.router.core;

/** Lifecycle of one routed request. */
public enum RouteState {
    START,
    CLASSIFYING,
    DISPATCHING,
    FALLBACK,
    REJECTED,
    PERSISTING,
    DONE
}
