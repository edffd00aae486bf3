package com.deepansh.router.responder;

import com.deepansh.router.model.Message;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Pipes the user turn through several responders: each one's text becomes the next one's input.
 *
 * Only the last link may stream, which is checked when the chain is built; the chain streams
 * exactly when its last link does. A failing link ends the chain with an error reply in the
 * chain's own output shape rather than an exception, so the caller still gets an answer.
 */
@Slf4j
public class ChainResponder extends AbstractResponder {

    private final List<Responder> links;

    public ChainResponder(String name, String description, boolean saveChat,
                          List<Responder> links) {
        super(name, description, capabilitiesOf(links), saveChat);
        for (int i = 0; i < links.size() - 1; i++) {
            if (links.get(i).getCapabilities().streaming()) {
                throw new IllegalArgumentException("Intermediate responder '" + links.get(i).getId()
                        + "' of chain '" + name + "' streams; only the last link may stream");
            }
        }
        this.links = List.copyOf(links);
    }

    private static ResponderCapabilities capabilitiesOf(List<Responder> links) {
        if (links == null || links.isEmpty()) {
            throw new IllegalArgumentException("A chain requires at least one responder");
        }
        boolean tools = links.stream().anyMatch(r -> r.getCapabilities().usesTools());
        boolean retrieval = links.stream().anyMatch(r -> r.getCapabilities().usesRetrieval());
        return new ResponderCapabilities(links.get(links.size() - 1).getCapabilities().streaming(), tools, retrieval);
    }

    @Override
    protected ResponderOutput respond(ResponderRequest request) {
        log.info("Processing chain with {} responders [chain={}]", links.size(), getId());
        String currentInput = request.getInputText();

        for (int i = 0; ; i++) {
            Responder link = links.get(i);
            boolean last = i == links.size() - 1;
            ResponderOutput output;
            try {
                output = link.process(request.toBuilder().inputText(currentInput).build());
            } catch (RuntimeException e) {
                log.error("Chain link failed [chain={}, link={}]: {}", getId(), link.getId(), e.getMessage());
                return errorReply("Error processing request with agent " + link.getName() + ": " + e.getMessage());
            }

            if (last) {
                return output;
            }
            String text = output.getMessage().getText();
            if (text.isBlank()) {
                log.warn("Chain link returned no text [chain={}, link={}]", getId(), link.getId());
                return errorReply("Agent " + link.getName() + " returned no text content.");
            }
            log.debug("Output of link {}: {}", i, text);
            currentInput = text;
        }
    }

    private ResponderOutput errorReply(String text) {
        return getCapabilities().streaming()
                ? ResponderOutput.of(Flux.just(text))
                : ResponderOutput.of(Message.assistantText(text));
    }

    public List<Responder> getLinks() {
        return links;
    }
}
