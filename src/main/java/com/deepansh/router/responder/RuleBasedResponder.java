package com.deepansh.router.responder;

import com.deepansh.router.exception.ResponderException;
import com.deepansh.router.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic responder: the first matching rule answers.
 *
 * Replies may reference capture groups ({@code $1}). Without a match the fallback reply is
 * used; with no fallback the responder fails, like any responder that produces nothing.
 */
@Slf4j
public class RuleBasedResponder extends AbstractResponder {

    public record Rule(Pattern pattern, String reply) {

        public static Rule of(String regex, String reply) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), reply);
        }
    }

    private final List<Rule> rules;
    private final String fallbackReply;

    public RuleBasedResponder(String name, String description, boolean saveChat,
                              List<Rule> rules, String fallbackReply) {
        super(name, description, ResponderCapabilities.PLAIN, saveChat);
        this.rules = List.copyOf(rules);
        this.fallbackReply = fallbackReply;
    }

    @Override
    protected ResponderOutput respond(ResponderRequest request) {
        String input = request.getInputText();
        for (Rule rule : rules) {
            Matcher m = rule.pattern().matcher(input);
            if (m.find()) {
                log.debug("Rule matched [responder={}, pattern={}]", getId(), rule.pattern().pattern());
                return ResponderOutput.of(Message.assistantText(expand(m, rule.reply())));
            }
        }
        if (fallbackReply == null) {
            throw new ResponderException(
                    "No rule of responder '" + getId() + "' matched the input");
        }
        return ResponderOutput.of(Message.assistantText(fallbackReply));
    }

    /** Substitutes {@code $0}..{@code $9} with the match's groups; missing groups become empty. */
    static String expand(Matcher m, String reply) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < reply.length(); i++) {
            char c = reply.charAt(i);
            if (c == '$' && i + 1 < reply.length() && Character.isDigit(reply.charAt(i + 1))) {
                int group = reply.charAt(++i) - '0';
                String value = group <= m.groupCount() ? m.group(group) : null;
                sb.append(value != null ? value : "");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
