package com.deepansh.router.responder;

/**
 * External retrieval capability. Implementations live outside this service
 * (vector stores, knowledge bases); responders only combine the returned context.
 */
@FunctionalInterface
public interface Retriever {

    /** Retrieves passages relevant to {@code text} and joins them into one context string. */
    String retrieveAndCombine(String text);
}
