package com.deepansh.router.core;

public enum RouteErrorType {
    /** Every classifier attempt failed. */
    CLASSIFICATION_FAILED,
    /** The classifier answered but named no registered responder, and no default applies. */
    NO_AGENT_SELECTED,
    /** The selected responder failed or timed out. */
    RESPONDER_ERROR
}
