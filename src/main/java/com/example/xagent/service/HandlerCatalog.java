package com.example.xagent.service;

import com.example.xagent.exception.HandlerLoadException;
import com.example.xagent.handler.DefinitionDomainHandler;
import com.example.xagent.handler.DomainDefinitionValidator;
import com.example.xagent.handler.DomainHandler;
import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainHandlerDescriptor;
import com.example.xagent.repository.DomainDefinitionRepository;
import com.example.xagent.repository.DomainDefinitionRepository.DefinitionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of domain handlers and the only process-wide mutable state of the pipeline.
 * <p>
 * {@link #scan()} records handler names without instantiating anything; {@link #get(String)}
 * builds a handler the first time it is asked for and caches it for the lifetime of the
 * process. Lazy loading and {@link #register} run under one catalog-wide lock, which
 * guarantees at most one handler instance per name.
 * <p>
 * Iteration order is registration order: scanned entries first, then synthesized ones.
 */
public class HandlerCatalog {

    private static final Logger log = LoggerFactory.getLogger(HandlerCatalog.class);

    private final DomainDefinitionRepository repository;
    private final Object lock = new Object();

    /** Guarded by {@link #lock}. */
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private record Entry(DomainHandlerDescriptor descriptor, DefinitionSource source, DomainHandler handler) {
        Entry loaded(DomainHandlerDescriptor newDescriptor, DomainHandler newHandler) {
            return new Entry(newDescriptor, source, newHandler);
        }
    }

    public HandlerCatalog(DomainDefinitionRepository repository) {
        this.repository = repository;
    }

    /**
     * Discovers handler definitions and records one unloaded descriptor per name.
     * A broken entry (bad file name, duplicate name) is logged and skipped; the scan
     * itself never fails.
     */
    public void scan() {
        int added = 0;
        synchronized (lock) {
            for (DefinitionSource source : repository.discover()) {
                try {
                    String name = source.name();
                    if (!DomainDefinitionValidator.NAME_PATTERN.matcher(name).matches()) {
                        log.warn("Skipping domain definition {}: '{}' is not a valid domain name",
                                source.description(), name);
                        continue;
                    }
                    if (entries.containsKey(name)) {
                        log.warn("Skipping domain definition {}: domain '{}' already registered from {}",
                                source.description(), name, entries.get(name).descriptor().source());
                        continue;
                    }
                    entries.put(name, new Entry(
                            DomainHandlerDescriptor.unresolved(name, source.description(), source.plugin()),
                            source, null));
                    added++;
                } catch (RuntimeException e) {
                    log.warn("Skipping domain definition {}: {}", source.description(), e.getMessage());
                }
            }
        }
        log.info("Handler catalog scan completed: {} domains discovered", added);
    }

    /**
     * Returns the handler for a domain, loading and caching it on first use.
     *
     * @return the handler, or empty if the name is unknown or its definition is broken
     */
    public Optional<DomainHandler> get(String name) {
        if (name == null) return Optional.empty();
        synchronized (lock) {
            Entry entry = entries.get(name);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.handler() != null) {
                return Optional.of(entry.handler());
            }
            try {
                DomainHandler handler = load(entry.source());
                DomainHandlerDescriptor descriptor = DomainHandlerDescriptor.loadedFrom(
                        ((DefinitionDomainHandler) handler).definition(), entry.descriptor().source());
                entries.put(name, entry.loaded(descriptor, handler));
                log.debug("Loaded domain handler '{}' (priority {})", name, handler.priorityScore());
                return Optional.of(handler);
            } catch (HandlerLoadException e) {
                log.warn("Domain handler '{}' could not be loaded: {}", name, e.getMessage());
                return Optional.empty();
            }
        }
    }

    /** All known domain names, loaded or not, in registration order. */
    public List<String> list() {
        synchronized (lock) {
            return List.copyOf(entries.keySet());
        }
    }

    public List<DomainHandlerDescriptor> descriptors() {
        synchronized (lock) {
            return entries.values().stream().map(Entry::descriptor).toList();
        }
    }

    public Optional<DomainHandlerDescriptor> descriptor(String name) {
        synchronized (lock) {
            Entry entry = entries.get(name);
            return entry != null ? Optional.of(entry.descriptor()) : Optional.empty();
        }
    }

    public boolean contains(String name) {
        synchronized (lock) {
            return entries.containsKey(name);
        }
    }

    /**
     * Adds an already-built handler (typically a synthesized one).
     * The check for an existing registration and the insertion happen under the same
     * lock: if the name is already taken, nothing changes and the existing handler is
     * returned so the caller can reuse it.
     *
     * @return the handler registered under {@code descriptor.name()} after the call
     * @throws HandlerLoadException if the handler does not expose the required capabilities
     */
    public DomainHandler register(DomainHandlerDescriptor descriptor, DomainHandler handler,
                                  DefinitionSource source) {
        checkCapabilities(descriptor.name(), handler);
        synchronized (lock) {
            Entry existing = entries.get(descriptor.name());
            if (existing != null) {
                log.info("Domain '{}' is already registered, keeping the existing handler", descriptor.name());
                if (existing.handler() != null) {
                    return existing.handler();
                }
            } else {
                entries.put(descriptor.name(), new Entry(descriptor, source, handler));
                log.info("Registered domain handler '{}' (custom={}, cost={})",
                        descriptor.name(), descriptor.customCreated(), descriptor.creationCost());
                return handler;
            }
        }
        // Registered by scan but never loaded: load it outside the fast path above.
        return get(descriptor.name()).orElse(handler);
    }

    private DomainHandler load(DefinitionSource source) {
        DomainDefinition definition = repository.load(source);
        List<String> errors = DomainDefinitionValidator.validate(definition);
        if (!errors.isEmpty()) {
            throw new HandlerLoadException(source.name(), "Invalid definition: " + String.join("; ", errors));
        }
        DomainHandler handler = new DefinitionDomainHandler(definition);
        checkCapabilities(source.name(), handler);
        return handler;
    }

    private static void checkCapabilities(String expectedName, DomainHandler handler) {
        if (handler == null) {
            throw new HandlerLoadException(expectedName, "No handler instance");
        }
        if (!expectedName.equals(handler.name())) {
            throw new HandlerLoadException(expectedName,
                    "Handler reports name '" + handler.name() + "' instead of '" + expectedName + "'");
        }
        if (handler.keywords() == null || handler.keywords().isEmpty()) {
            throw new HandlerLoadException(expectedName, "Handler exposes no detection keywords");
        }
        int priority = handler.priorityScore();
        if (priority < DomainDefinitionValidator.MIN_PRIORITY || priority > DomainDefinitionValidator.MAX_PRIORITY) {
            throw new HandlerLoadException(expectedName, "Handler priority out of range: " + priority);
        }
    }
}
