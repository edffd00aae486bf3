package com.deepansh.router.classifier;

import com.deepansh.router.responder.Responder;

/**
 * Outcome of one classification. A null {@code selectedResponder} means the classifier
 * named a responder that is not registered; {@code confidence} is still what it reported.
 */
public record ClassifierResult(Responder selectedResponder, double confidence) {

    public boolean isSelected() {
        return selectedResponder != null;
    }
}
