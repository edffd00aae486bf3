package com.deepansh.router.classifier;

/** The structured output a classifier produces before name resolution. */
public record ClassifierDecision(String userInput, String selectedAgent, double confidence) {
}
