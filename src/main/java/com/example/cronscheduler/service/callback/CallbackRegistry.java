package com.example.cronscheduler.service.callback;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for job callbacks.
 * <p>
 * Discovers all {@link JobCallbackHandler} beans at startup; further callbacks can be
 * registered programmatically at any time. Lookup is by kind.
 */
@Slf4j
@Component
public class CallbackRegistry {

    private final Map<String, JobCallback> callbacks = new ConcurrentHashMap<>();
    private final List<JobCallbackHandler> handlerBeans;

    public CallbackRegistry(List<JobCallbackHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            register(handler.getKind(), handler);
        }
    }

    /**
     * Register or replace the callback for a kind
     */
    public void register(String kind, JobCallback callback) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Callback kind is required");
        }
        var previous = callbacks.put(kind, callback);
        if (previous != null && previous != callback) {
            log.warn("Duplicate callback for kind {}: {} will override {}",
                    kind, callback.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
        log.info("Registered callback for kind {}: {}", kind, callback.getClass().getSimpleName());
    }

    public Optional<JobCallback> getCallback(String kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(callbacks.get(kind));
    }

    public Set<String> getRegisteredKinds() {
        return new TreeSet<>(callbacks.keySet());
    }
}
