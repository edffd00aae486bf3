package com.deepansh.router.classifier;

import com.deepansh.router.model.Message;
import com.deepansh.router.responder.Responder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based classifier: scores each responder by how many input words appear in its
 * keywords (configured per id, otherwise taken from its name and description).
 *
 * An input sharing no word with any responder is treated as a follow-up: the responder that
 * answered last in the history hint (the {@code [id]} tag) is selected with low confidence.
 * With no such tag the decision names {@code unknown}, which resolves to no responder.
 */
@Slf4j
public class KeywordClassifier extends AbstractClassifier {

    static final String UNKNOWN = "unknown";
    static final double FOLLOW_UP_CONFIDENCE = 0.5;

    private static final Pattern WORD = Pattern.compile("[a-z0-9+#]{3,}");
    private static final Pattern RESPONDER_TAG = Pattern.compile("^\\[([^\\]]+)]");

    private final Map<String, Set<String>> keywords;

    public KeywordClassifier(Map<String, List<String>> keywords) {
        this.keywords = keywords.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey,
                        e -> e.getValue().stream().map(k -> k.toLowerCase(Locale.ROOT)).collect(Collectors.toSet())));
    }

    @Override
    protected ClassifierDecision decide(String inputText, List<Message> history) {
        Set<String> words = words(inputText);
        String best = null;
        int bestScore = 0;

        for (Responder responder : getResponders().values()) {
            Set<String> vocabulary = keywords.getOrDefault(responder.getId(),
                    words(responder.getName() + " " + responder.getDescription()));
            int score = (int) words.stream().filter(vocabulary::contains).count();
            if (score > bestScore || (score == bestScore && score > 0 && responder.getId().compareTo(best) < 0)) {
                best = responder.getId();
                bestScore = score;
            }
        }

        if (best != null) {
            double confidence = Math.min(1.0, (double) bestScore / Math.max(1, words.size()) + 0.5);
            log.debug("Keyword match [responder={}, score={}]", best, bestScore);
            return new ClassifierDecision(inputText, best, confidence);
        }

        String previous = lastResponder(history);
        if (previous != null) {
            log.debug("No keyword match, treating as follow-up of {}", previous);
            return new ClassifierDecision(inputText, previous, FOLLOW_UP_CONFIDENCE);
        }
        return new ClassifierDecision(inputText, UNKNOWN, 0.0);
    }

    private static String lastResponder(List<Message> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            Message m = history.get(i);
            if (m.getRole() == Message.Role.assistant) {
                Matcher tag = RESPONDER_TAG.matcher(m.getText());
                if (tag.find()) {
                    return tag.group(1);
                }
            }
        }
        return null;
    }

    static Set<String> words(String text) {
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        return m.results().map(MatchResult::group).collect(Collectors.toSet());
    }
}
