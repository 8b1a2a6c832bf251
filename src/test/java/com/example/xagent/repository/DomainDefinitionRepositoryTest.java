package com.example.xagent.repository;

import com.example.xagent.PipelineTestSupport;
import com.example.xagent.exception.HandlerLoadException;
import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainDefinition.RequirementRule;
import com.example.xagent.model.Priority;
import com.example.xagent.model.RequirementCategory;
import com.example.xagent.repository.DomainDefinitionRepository.DefinitionSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainDefinitionRepositoryTest {

    @TempDir
    Path pluginDir;

    private DomainDefinitionRepository repository;

    @BeforeEach
    void setUp() {
        repository = PipelineTestSupport.repository(PipelineTestSupport.properties(pluginDir));
    }

    private static DomainDefinition beekeeping() {
        return new DomainDefinition("beekeeping", List.of("hive", "honey", "apiary"), 4,
                List.of(new RequirementRule(List.of("hive"), "Hive Inspection Log",
                        Priority.HIGH, RequirementCategory.FUNCTIONAL)),
                List.of("Beekeepers"), null, null, false, 0.0, null, null);
    }

    @Test
    void discoversBuiltInDefinitionsSortedByName() {
        List<DefinitionSource> sources = repository.discover();

        assertThat(sources).hasSize(14);
        assertThat(sources).noneMatch(DefinitionSource::plugin);
        assertThat(sources).extracting(DefinitionSource::name)
                .startsWith("customer_support", "ecommerce", "education_management")
                .contains("healthcare", "fintech", "gaming_studio_management", "staging_furniture")
                .isSorted();
    }

    @Test
    void loadsBuiltInDefinition() {
        DefinitionSource fintech = repository.discover().stream()
                .filter(s -> s.name().equals("fintech"))
                .findFirst().orElseThrow();

        DomainDefinition definition = repository.load(fintech);

        assertThat(definition.priorityScore()).isEqualTo(5);
        assertThat(definition.keywords()).contains("banking", "wallet");
        assertThat(definition.requirementRules()).isNotEmpty();
        assertThat(definition.crossCuttingRules()).isNull();
        assertThat(definition.customCreated()).isFalse();
    }

    @Test
    void persistsSynthesizedDefinitionWithProvenance() throws Exception {
        DomainDefinition saved = repository.saveSynthesized(beekeeping(), 0.0125);

        Path file = pluginDir.resolve("beekeeping.json");
        assertThat(file).exists();
        assertThat(saved.customCreated()).isTrue();
        assertThat(saved.creationCost()).isEqualTo(0.0125);
        assertThat(saved.createdTimestamp()).isNotNull();
        assertThat(saved.sourcePath()).isEqualTo(file.toAbsolutePath().normalize().toString());
        assertThat(Files.readString(file)).contains("\"customCreated\" : true");
        try (var leftovers = Files.list(pluginDir)) {
            assertThat(leftovers).extracting(p -> p.getFileName().toString()).containsExactly("beekeeping.json");
        }

        DomainDefinition reloaded = repository.load(repository.sourceOf(saved));
        assertThat(reloaded).isEqualTo(saved);
    }

    @Test
    void failedWriteLeavesNoTemporaryFile() throws Exception {
        Path blocked = Files.createDirectories(pluginDir.resolve("beekeeping.json"));
        Files.writeString(blocked.resolve("occupant.txt"), "x");

        assertThatThrownBy(() -> repository.saveSynthesized(beekeeping(), 0.0))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("beekeeping");

        try (var leftovers = Files.list(pluginDir)) {
            assertThat(leftovers).extracting(p -> p.getFileName().toString()).containsExactly("beekeeping.json");
        }
    }

    @Test
    void rediscoversPersistedDefinitionsAfterBuiltIns() {
        repository.saveSynthesized(beekeeping(), 0.0);

        List<DefinitionSource> sources = repository.discover();

        assertThat(sources).hasSize(15);
        DefinitionSource last = sources.get(sources.size() - 1);
        assertThat(last.name()).isEqualTo("beekeeping");
        assertThat(last.plugin()).isTrue();
    }

    @Test
    void rejectsDefinitionWhoseNameDoesNotMatchItsFile() throws Exception {
        Path file = pluginDir.resolve("orchard.json");
        Files.writeString(file, """
                {"name": "vineyard", "keywords": ["grape", "vine", "cellar"], "priorityScore": 3,
                 "requirementRules": [{"title": "Harvest Log"}]}
                """);

        assertThatThrownBy(() -> repository.load(new DefinitionSource("orchard", new FileSystemResource(file), true)))
                .isInstanceOf(HandlerLoadException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void rejectsUnparseableDefinition() throws Exception {
        Path file = pluginDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> repository.load(new DefinitionSource("broken", new FileSystemResource(file), true)))
                .isInstanceOf(HandlerLoadException.class)
                .satisfies(e -> assertThat(((HandlerLoadException) e).getDomainName()).isEqualTo("broken"));
    }
}
