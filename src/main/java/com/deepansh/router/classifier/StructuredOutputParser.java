package com.deepansh.router.classifier;

import com.deepansh.router.exception.MalformedStructuredOutputException;
import com.deepansh.router.exception.NoStructuredOutputException;
import com.deepansh.router.model.Message;
import com.deepansh.router.model.ToolUseBlock;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extracts the classifier decision from a model reply.
 *
 * The reply must hold exactly one ToolUse block named {@link #TOOL_NAME}, whose input has
 * {@code userinput} (string), {@code selected_agent} (string) and {@code confidence}
 * (number in [0, 1]) and no other key. Nothing is coerced: a numeric string is as malformed
 * as a missing field.
 */
public final class StructuredOutputParser {

    public static final String TOOL_NAME = "analyzePrompt";

    static final String USER_INPUT = "userinput";
    static final String SELECTED_AGENT = "selected_agent";
    static final String CONFIDENCE = "confidence";

    private static final Set<String> FIELDS = Set.of(USER_INPUT, SELECTED_AGENT, CONFIDENCE);

    private StructuredOutputParser() {
    }

    public static ClassifierDecision parse(Message reply) {
        List<ToolUseBlock> blocks = reply.getToolUses().stream()
                .filter(t -> TOOL_NAME.equals(t.name()))
                .toList();

        if (blocks.isEmpty()) {
            throw new NoStructuredOutputException("No " + TOOL_NAME + " tool use found in classifier reply");
        }
        if (blocks.size() > 1) {
            throw new MalformedStructuredOutputException("Expected one " + TOOL_NAME
                    + " block, found " + blocks.size());
        }

        Map<String, Object> input = blocks.get(0).input();
        Set<String> unknown = new TreeSet<>(input.keySet());
        unknown.removeAll(FIELDS);
        if (!unknown.isEmpty()) {
            throw new MalformedStructuredOutputException("Unexpected field(s) in " + TOOL_NAME + " input: " + unknown);
        }
        String userInput = requireString(input, USER_INPUT);
        String selectedAgent = requireString(input, SELECTED_AGENT);

        Object rawConfidence = input.get(CONFIDENCE);
        if (!(rawConfidence instanceof Number number)) {
            throw new MalformedStructuredOutputException("Field '" + CONFIDENCE + "' must be a number, got "
                    + describe(rawConfidence));
        }
        double confidence = number.doubleValue();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new MalformedStructuredOutputException("Field '" + CONFIDENCE + "' must be in [0, 1], got "
                    + confidence);
        }

        return new ClassifierDecision(userInput, selectedAgent, confidence);
    }

    private static String requireString(Map<String, Object> input, String field) {
        Object value = input.get(field);
        if (!(value instanceof String s)) {
            throw new MalformedStructuredOutputException("Field '" + field + "' must be a string, got "
                    + describe(value));
        }
        return s;
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName() + " " + value;
    }

    /** JSON schema of the forced tool, shared by every model-backed classifier. */
    public static Map<String, Object> inputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        USER_INPUT, Map.of(
                                "type", "string",
                                "description", "The original user input"),
                        SELECTED_AGENT, Map.of(
                                "type", "string",
                                "description", "The name of the selected agent"),
                        CONFIDENCE, Map.of(
                                "type", "number",
                                "description", "Confidence level between 0 and 1")),
                "required", List.of(USER_INPUT, SELECTED_AGENT, CONFIDENCE),
                "additionalProperties", false);
    }
}
