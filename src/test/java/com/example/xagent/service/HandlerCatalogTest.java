package com.example.xagent.service;

import com.example.xagent.PipelineTestSupport;
import com.example.xagent.exception.HandlerLoadException;
import com.example.xagent.handler.DefinitionDomainHandler;
import com.example.xagent.handler.DomainHandler;
import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainDefinition.RequirementRule;
import com.example.xagent.model.DomainHandlerDescriptor;
import com.example.xagent.model.Priority;
import com.example.xagent.model.RequirementCategory;
import com.example.xagent.repository.DomainDefinitionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandlerCatalogTest {

    @TempDir
    Path pluginDir;

    private DomainDefinitionRepository repository;

    @BeforeEach
    void setUp() {
        repository = PipelineTestSupport.repository(PipelineTestSupport.properties(pluginDir));
    }

    private static DomainDefinition definition(String name) {
        return new DomainDefinition(name, List.of("hive", "honey", "apiary"), 4,
                List.of(new RequirementRule(List.of("hive"), "Hive Inspection Log",
                        Priority.HIGH, RequirementCategory.FUNCTIONAL)),
                List.of("Beekeepers"), null, null, true, 0.0, null, null);
    }

    @Test
    void scanRecordsUnloadedDescriptors() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);

        assertThat(catalog.list()).hasSize(14).contains("healthcare", "fintech", "customer_support");
        assertThat(catalog.descriptors()).noneMatch(DomainHandlerDescriptor::loaded);
        assertThat(catalog.descriptor("healthcare")).get()
                .satisfies(d -> assertThat(d.priorityScore()).isZero());
    }

    @Test
    void getLoadsOnceAndCaches() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);

        DomainHandler first = catalog.get("healthcare").orElseThrow();
        DomainHandler second = catalog.get("healthcare").orElseThrow();

        assertThat(first).isSameAs(second);
        assertThat(first.priorityScore()).isEqualTo(5);
        assertThat(catalog.descriptor("healthcare")).get()
                .satisfies(d -> {
                    assertThat(d.loaded()).isTrue();
                    assertThat(d.priorityScore()).isEqualTo(5);
                    assertThat(d.customCreated()).isFalse();
                });
    }

    @Test
    void unknownNameIsNotFound() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);

        assertThat(catalog.get("quantum_research")).isEmpty();
        assertThat(catalog.get(null)).isEmpty();
        assertThat(catalog.contains("quantum_research")).isFalse();
    }

    @Test
    void brokenEntriesDoNotAffectOthers() throws Exception {
        Files.writeString(pluginDir.resolve("broken.json"), "{ this is not json");
        Files.writeString(pluginDir.resolve("thin.json"), """
                {"name": "thin", "keywords": ["one"], "priorityScore": 3,
                 "requirementRules": [{"title": "Thin Rule"}]}
                """);
        Files.writeString(pluginDir.resolve("Bad-Name.json"), "{}");

        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);

        assertThat(catalog.list()).hasSize(16).contains("broken", "thin").doesNotContain("Bad-Name");
        assertThat(catalog.get("broken")).isEmpty();
        assertThat(catalog.get("thin")).isEmpty();
        assertThat(catalog.get("fintech")).isPresent();
    }

    @Test
    void registerAddsNewHandlerInRegistrationOrder() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);
        DomainDefinition persisted = repository.saveSynthesized(definition("beekeeping"), 0.0);
        DomainHandler handler = new DefinitionDomainHandler(persisted);

        DomainHandler registered = catalog.register(
                DomainHandlerDescriptor.loadedFrom(persisted, persisted.sourcePath()),
                handler, repository.sourceOf(persisted));

        assertThat(registered).isSameAs(handler);
        assertThat(catalog.list()).last().isEqualTo("beekeeping");
        assertThat(catalog.get("beekeeping")).containsSame(handler);
        assertThat(catalog.descriptor("beekeeping")).get()
                .satisfies(d -> assertThat(d.customCreated()).isTrue());
    }

    @Test
    void registerKeepsExistingHandler() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);
        DomainDefinition persisted = repository.saveSynthesized(definition("beekeeping"), 0.0);
        DomainHandler first = new DefinitionDomainHandler(persisted);
        DomainHandler second = new DefinitionDomainHandler(persisted);
        DomainHandlerDescriptor descriptor = DomainHandlerDescriptor.loadedFrom(persisted, persisted.sourcePath());

        catalog.register(descriptor, first, repository.sourceOf(persisted));
        DomainHandler winner = catalog.register(descriptor, second, repository.sourceOf(persisted));

        assertThat(winner).isSameAs(first);
        assertThat(catalog.list()).filteredOn("beekeeping"::equals).hasSize(1);
    }

    @Test
    void registerOfScannedButUnloadedNameReturnsTheLoadedHandler() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);
        DomainDefinition fintech = catalog.get("fintech")
                .map(h -> ((DefinitionDomainHandler) h).definition())
                .orElseThrow();
        HandlerCatalog fresh = PipelineTestSupport.scannedCatalog(repository);

        DomainHandler winner = fresh.register(DomainHandlerDescriptor.loadedFrom(fintech, "test"),
                new DefinitionDomainHandler(fintech), null);

        assertThat(fresh.get("fintech")).containsSame(winner);
    }

    @Test
    void registerRejectsHandlerWithoutCapabilities() {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);
        DomainDefinition definition = definition("beekeeping");

        assertThatThrownBy(() -> catalog.register(
                DomainHandlerDescriptor.loadedFrom(definition, "test"),
                new DefinitionDomainHandler(definition("apiary")), null))
                .isInstanceOf(HandlerLoadException.class)
                .hasMessageContaining("instead of 'beekeeping'");
        assertThat(catalog.contains("beekeeping")).isFalse();
    }

    @Test
    void concurrentFirstAccessYieldsOneInstance() throws Exception {
        HandlerCatalog catalog = PipelineTestSupport.scannedCatalog(repository);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Optional<DomainHandler>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return catalog.get("real_estate");
                }));
            }
            start.countDown();

            DomainHandler expected = futures.get(0).get(5, TimeUnit.SECONDS).orElseThrow();
            for (Future<Optional<DomainHandler>> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).containsSame(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
