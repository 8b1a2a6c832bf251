package com.example.xagent.service;

import com.example.xagent.agent.PluginSynthesizer;
import com.example.xagent.config.PipelineProperties;
import com.example.xagent.handler.DefinitionDomainHandler;
import com.example.xagent.handler.DomainDefinitionValidator;
import com.example.xagent.handler.DomainHandler;
import com.example.xagent.handler.GeneralDomainHandler;
import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainHandlerDescriptor;
import com.example.xagent.model.Resolution;
import com.example.xagent.model.SynthesisResult;
import com.example.xagent.repository.DomainDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Picks the domain handler for a document.
 * <p>
 * Every catalog handler is scored with
 * {@code detectConfidence(content) * priorityScore / maxPriority}; the highest score wins
 * and ties go to the handler registered first. When the winner stays below the
 * confidence threshold, a new handler is synthesized, validated, persisted and
 * registered. Synthesis runs under a single lock and re-checks the catalog first, so
 * concurrent runs needing the same new domain synthesize it once and share it.
 * Synthesis failures and time-outs degrade to the {@code general} handler.
 */
@Service
public class DomainResolver {

    private static final Logger log = LoggerFactory.getLogger(DomainResolver.class);

    private static final Pattern HINT_SEPARATORS = Pattern.compile("[\\s-]+");

    private final HandlerCatalog catalog;
    private final PluginSynthesizer synthesizer;
    private final DomainDefinitionRepository repository;
    private final ExecutorService synthesisExecutor;
    private final double confidenceThreshold;
    private final int maxPriority;
    private final boolean synthesisEnabled;
    private final Duration synthesisTimeout;

    private final ReentrantLock synthesisLock = new ReentrantLock();

    public DomainResolver(HandlerCatalog catalog,
                          PluginSynthesizer synthesizer,
                          DomainDefinitionRepository repository,
                          @Qualifier("synthesisExecutor") ExecutorService synthesisExecutor,
                          PipelineProperties properties) {
        this.catalog = catalog;
        this.synthesizer = synthesizer;
        this.repository = repository;
        this.synthesisExecutor = synthesisExecutor;
        this.confidenceThreshold = properties.resolver().confidenceThreshold();
        this.maxPriority = properties.resolver().maxPriority();
        this.synthesisEnabled = properties.synthesis().enabled();
        this.synthesisTimeout = properties.synthesis().timeout();
    }

    private record Scored(DomainHandler handler, double score) {}

    /**
     * Resolves the handler for a document.
     *
     * @param content    document content
     * @param domainHint optional domain name; used directly when it names a known domain
     */
    public Resolution resolve(String content, String domainHint) {
        String hint = usableHint(domainHint);
        if (hint != null) {
            Optional<DomainHandler> hinted = catalog.get(hint);
            if (hinted.isPresent()) {
                log.info("Domain hint '{}' matches a known domain, skipping detection", hint);
                DomainHandler handler = hinted.get();
                return new Resolution(handler, handler.name(), weightedScore(handler, content), false, 0.0);
            }
        }

        Scored best = scoreAll(content);
        if (best != null && best.score() >= confidenceThreshold) {
            log.info("Resolved domain '{}' (weighted confidence {})", best.handler().name(), format(best.score()));
            return existing(best);
        }

        log.info("No domain reached confidence {} (best: {})", confidenceThreshold, describe(best));
        if (!synthesisEnabled) {
            log.info("Synthesis disabled, using '{}' handler", GeneralDomainHandler.NAME);
            return general();
        }
        return synthesize(content, hint);
    }

    /** Weighted score of one handler; a pure function of content, keywords and priority. */
    public double weightedScore(DomainHandler handler, String content) {
        return handler.detectConfidence(content) * ((double) handler.priorityScore() / maxPriority);
    }

    private Scored scoreAll(String content) {
        Scored best = null;
        for (String name : catalog.list()) {
            Optional<DomainHandler> handler = catalog.get(name);
            if (handler.isEmpty()) continue;
            double score = weightedScore(handler.get(), content);
            log.debug("Domain '{}' scored {}", name, format(score));
            if (best == null || score > best.score()) {
                best = new Scored(handler.get(), score);
            }
        }
        return best;
    }

    private Resolution synthesize(String content, String hint) {
        synthesisLock.lock();
        try {
            // Another run may have registered a fitting handler while this one waited.
            Scored best = scoreAll(content);
            if (best != null && best.score() >= confidenceThreshold) {
                log.info("Domain '{}' became available meanwhile (weighted confidence {}), reusing it",
                        best.handler().name(), format(best.score()));
                return existing(best);
            }

            List<String> existingNames = catalog.list();
            Optional<SynthesisResult> outcome = callSynthesizer(content, hint, existingNames);
            if (outcome.isEmpty()) {
                return general();
            }
            SynthesisResult result = outcome.get();
            if (!result.succeeded()) {
                log.warn("Synthesis failed: {}", result.error());
                return general();
            }

            DomainDefinition definition = result.definition();
            List<String> errors = new ArrayList<>(DomainDefinitionValidator.validate(definition));
            if (definition != null && existingNames.contains(definition.name())) {
                errors.add("Domain '" + definition.name() + "' already exists");
            }
            if (!errors.isEmpty()) {
                log.warn("Discarding synthesized domain '{}': {}",
                        definition != null ? definition.name() : null, String.join("; ", errors));
                return general();
            }

            return register(definition, result.cost(), content);
        } finally {
            synthesisLock.unlock();
        }
    }

    private Resolution register(DomainDefinition definition, double cost, String content) {
        DomainDefinition persisted;
        try {
            persisted = repository.saveSynthesized(definition, cost);
        } catch (RuntimeException e) {
            log.warn("Discarding synthesized domain '{}': {}", definition.name(), e.getMessage());
            return general();
        }

        DomainHandler handler = new DefinitionDomainHandler(persisted);
        DomainHandler registered;
        try {
            registered = catalog.register(
                    DomainHandlerDescriptor.loadedFrom(persisted, persisted.sourcePath()),
                    handler, repository.sourceOf(persisted));
        } catch (RuntimeException e) {
            log.warn("Synthesized domain '{}' rejected by the catalog: {}", definition.name(), e.getMessage());
            return general();
        }

        boolean minted = registered == handler;
        double score = weightedScore(registered, content);
        log.info("Synthesized domain '{}' registered (re-scored weighted confidence {}, cost {})",
                registered.name(), format(score), cost);
        return new Resolution(registered, registered.name(), score, minted, minted ? cost : 0.0);
    }

    private Optional<SynthesisResult> callSynthesizer(String content, String hint, List<String> existingNames) {
        Future<SynthesisResult> future = synthesisExecutor.submit(
                () -> synthesizer.synthesize(content, hint, existingNames));
        try {
            return Optional.ofNullable(future.get(synthesisTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Synthesis timed out after {}", synthesisTimeout);
        } catch (ExecutionException e) {
            log.warn("Synthesis failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Synthesis interrupted");
        }
        return Optional.empty();
    }

    private static Resolution existing(Scored scored) {
        return new Resolution(scored.handler(), scored.handler().name(), scored.score(), false, 0.0);
    }

    private static Resolution general() {
        return new Resolution(GeneralDomainHandler.INSTANCE, GeneralDomainHandler.NAME, 0.0, false, 0.0);
    }

    /** Domain names are lower-case with underscores, so "Gaming Studio-Management" matches gaming_studio_management. */
    static String usableHint(String domainHint) {
        if (domainHint == null || domainHint.isBlank()) return null;
        String hint = HINT_SEPARATORS.matcher(domainHint.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        return GeneralDomainHandler.NAME.equals(hint) ? null : hint;
    }

    private static String describe(Scored scored) {
        return scored == null ? "none" : scored.handler().name() + " = " + format(scored.score());
    }

    private static String format(double score) {
        return "%.3f".formatted(score);
    }
}
