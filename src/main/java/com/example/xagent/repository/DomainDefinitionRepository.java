package com.example.xagent.repository;

import com.example.xagent.config.PipelineProperties;
import com.example.xagent.exception.HandlerLoadException;
import com.example.xagent.model.DomainDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File-backed store of domain definitions.
 * <p>
 * Built-in definitions are read-only classpath resources; synthesized ones are JSON
 * files in the plugin directory, one per domain ({@code <name>.json}), so that a
 * restart rediscovers them.
 */
@Repository
public class DomainDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(DomainDefinitionRepository.class);
    private static final String EXTENSION = ".json";

    private final ResourcePatternResolver resourceResolver;
    private final ObjectMapper objectMapper;
    private final String builtinLocation;
    private final Path pluginDir;

    public DomainDefinitionRepository(ResourcePatternResolver resourceResolver,
                                      ObjectMapper objectMapper,
                                      PipelineProperties properties) {
        this.resourceResolver = resourceResolver;
        this.objectMapper = objectMapper;
        this.builtinLocation = properties.catalog().builtinLocation();
        this.pluginDir = Path.of(properties.catalog().pluginDir()).toAbsolutePath().normalize();
    }

    /**
     * A definition file found during discovery. The domain name comes from the file
     * name; the content is not read.
     *
     * @param name     Domain name derived from the file name
     * @param resource Definition resource
     * @param plugin   True when the file lives in the plugin directory
     */
    public record DefinitionSource(String name, Resource resource, boolean plugin) {
        public String description() {
            return resource.getDescription();
        }
    }

    /**
     * Lists all definition files: built-ins first, then plugins, each group sorted by name.
     */
    public List<DefinitionSource> discover() {
        List<DefinitionSource> sources = new ArrayList<>();
        try {
            Resource[] builtins = resourceResolver.getResources(builtinLocation);
            Stream.of(builtins)
                    .filter(r -> r.getFilename() != null && r.getFilename().endsWith(EXTENSION))
                    .sorted(Comparator.comparing(Resource::getFilename))
                    .forEach(r -> sources.add(new DefinitionSource(nameOf(r.getFilename()), r, false)));
        } catch (IOException e) {
            log.warn("Unable to list built-in domain definitions at '{}': {}", builtinLocation, e.getMessage());
        }

        if (Files.isDirectory(pluginDir)) {
            try (Stream<Path> files = Files.list(pluginDir)) {
                files.filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .forEach(p -> sources.add(new DefinitionSource(
                                nameOf(p.getFileName().toString()), new FileSystemResource(p), true)));
            } catch (IOException e) {
                log.warn("Unable to list plugin directory '{}': {}", pluginDir, e.getMessage());
            }
        }
        return sources;
    }

    /**
     * Reads and parses one definition.
     *
     * @throws HandlerLoadException if the file cannot be read or is not a valid definition
     */
    public DomainDefinition load(DefinitionSource source) {
        try (InputStream in = source.resource().getInputStream()) {
            DomainDefinition definition = objectMapper.readValue(in, DomainDefinition.class);
            if (definition == null) {
                throw new HandlerLoadException(source.name(), "Empty definition in " + source.description());
            }
            if (!source.name().equals(definition.name())) {
                throw new HandlerLoadException(source.name(), "Definition name '" + definition.name()
                        + "' does not match file " + source.description());
            }
            return definition;
        } catch (IOException e) {
            throw new HandlerLoadException(source.name(),
                    "Unable to read definition " + source.description() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Persists a synthesized definition, stamping its provenance.
     * The file is written to a temporary name first and moved into place.
     *
     * @return the definition as persisted, with {@code customCreated}, cost, timestamp and path set
     */
    public DomainDefinition saveSynthesized(DomainDefinition definition, double cost) {
        Path target = pluginDir.resolve(definition.name() + EXTENSION);
        DomainDefinition stamped = definition.withProvenance(cost, Instant.now(), target.toString());
        Path tmp = null;
        try {
            Files.createDirectories(pluginDir);
            tmp = Files.createTempFile(pluginDir, definition.name(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), stamped);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Persisted synthesized domain '{}' to {}", definition.name(), target);
            return stamped;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Unable to persist domain definition '" + definition.name() + "'", e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Unable to remove temporary file {}: {}", tmp, e.getMessage());
        }
    }

    public DefinitionSource sourceOf(DomainDefinition persisted) {
        Path path = Path.of(persisted.sourcePath());
        return new DefinitionSource(persisted.name(), new FileSystemResource(path), true);
    }

    public Path pluginDir() {
        return pluginDir;
    }

    private static String nameOf(String filename) {
        return filename.substring(0, filename.length() - EXTENSION.length());
    }
}
