package com.nevis.digest.service;

import com.nevis.digest.service.digester.Digester;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Digesters keyed by name, kept in registration order. Registration order is the
 * priority order in which the coordinator runs them.
 */
@Slf4j
public class DigesterRegistry {

    private final Map<String, Digester> digesters = new LinkedHashMap<>();

    public synchronized void register(Digester digester) {
        if (digesters.containsKey(digester.name())) {
            log.debug("Digester {} already registered, ignoring", digester.name());
            return;
        }
        digesters.put(digester.name(), digester);
        log.info("Registered digester {} (outputs: {})", digester.name(), digester.outputs());
    }

    public synchronized void initialize(List<? extends Digester> toRegister) {
        toRegister.forEach(this::register);
    }

    public synchronized Optional<Digester> find(String name) {
        return Optional.ofNullable(digesters.get(name));
    }

    public synchronized Optional<Digester> findByOutput(String digestType) {
        return digesters.values().stream()
            .filter(digester -> digester.outputs().contains(digestType))
            .findFirst();
    }

    public synchronized List<Digester> getAll() {
        return List.copyOf(digesters.values());
    }

    public synchronized List<String> getAllDigestTypes() {
        List<String> types = new ArrayList<>();
        digesters.values().forEach(digester -> types.addAll(digester.outputs()));
        return types;
    }
}
