package com.deepansh.router.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One declared responder under {@code router.responders}. Which fields apply depends on {@link #type}.
 */
@Data
public class ResponderProperties {

    public enum Type { LLM, REMOTE, RULE, CHAIN, SUPERVISOR }

    @NotBlank
    private String name;

    private String description = "";

    private Type type = Type.LLM;

    private boolean saveChat = true;

    // llm, supervisor
    private boolean streaming = false;
    private String promptTemplate;
    private Map<String, String> promptVariables = new HashMap<>();
    /** Names of registered tools this responder may call. */
    private List<String> tools = new ArrayList<>();
    @Min(1)
    private int toolMaxRecursions = 20;
    private Integer maxTokens;
    private Double temperature;
    private Double topP;
    private List<String> stopSequences = new ArrayList<>();

    // remote
    private String url;

    // rule
    private List<Rule> rules = new ArrayList<>();
    private String fallbackReply;

    // chain: names of previously declared responders, in order
    private List<String> chain = new ArrayList<>();

    // supervisor: names of previously declared responders the lead model may message
    private List<String> team = new ArrayList<>();
    private boolean trace = false;

    @Data
    public static class Rule {
        private String pattern;
        private String reply;
    }
}
