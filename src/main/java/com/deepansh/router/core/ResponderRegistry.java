package com.deepansh.router.core;

import com.deepansh.router.responder.Responder;
import com.deepansh.router.responder.ResponderRegistration;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Responders known to one orchestrator, keyed by id.
 *
 * Registration is rare and copies the table; lookups read the current immutable snapshot
 * without locking. Listeners receive every new snapshot (the classifier keeps its own copy).
 */
@Slf4j
public class ResponderRegistry {

    private volatile Map<String, Responder> responders = Map.of();
    private final List<Consumer<Map<String, Responder>>> listeners = new CopyOnWriteArrayList<>();

    public synchronized void register(Responder responder) {
        if (responders.containsKey(responder.getId())) {
            throw new IllegalStateException("A responder with id '" + responder.getId() + "' is already registered");
        }
        Map<String, Responder> next = new LinkedHashMap<>(responders);
        next.put(responder.getId(), responder);
        responders = Collections.unmodifiableMap(next);
        log.info("Responder registered [id={}, streaming={}, tools={}]", responder.getId(),
                responder.getCapabilities().streaming(), responder.getCapabilities().usesTools());
        listeners.forEach(l -> l.accept(responders));
    }

    public void onChange(Consumer<Map<String, Responder>> listener) {
        listeners.add(listener);
        listener.accept(responders);
    }

    public Optional<Responder> find(String id) {
        return Optional.ofNullable(id).map(responders::get);
    }

    public boolean contains(String id) {
        return id != null && responders.containsKey(id);
    }

    public Map<String, Responder> snapshot() {
        return responders;
    }

    public List<ResponderRegistration> registrations() {
        return responders.values().stream().map(Responder::registration).toList();
    }

    public int size() {
        return responders.size();
    }
}
