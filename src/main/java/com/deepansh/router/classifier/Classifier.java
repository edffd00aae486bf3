package com.deepansh.router.classifier;

import com.deepansh.router.model.Message;
import com.deepansh.router.responder.Responder;

import java.util.List;
import java.util.Map;

/**
 * Selects the responder for one user turn.
 *
 * Implementations may be probabilistic; only the shape of the result is fixed.
 * Structured-output failures are thrown as
 * {@link com.deepansh.router.exception.NoStructuredOutputException} or
 * {@link com.deepansh.router.exception.MalformedStructuredOutputException}; the caller retries.
 */
public interface Classifier {

    ClassifierResult classify(String inputText, List<Message> history);

    /** Replaces the set of responders the classifier chooses from, keyed by id. */
    void setResponders(Map<String, Responder> responders);
}
