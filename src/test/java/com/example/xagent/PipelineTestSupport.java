package com.example.xagent;

import com.example.xagent.config.PipelineProperties;
import com.example.xagent.repository.DomainDefinitionRepository;
import com.example.xagent.service.HandlerCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Builds pipeline components without a Spring context, backed by the built-in domain
 * definitions on the classpath and a per-test plugin directory.
 */
public final class PipelineTestSupport {

    public static final String BEEKEEPING_CONTENT = """
            Our apiary keeps forty hive boxes. Each hive produces honey every season.
            The beekeeper inspects every hive for queen status, pollen stores and honey yield.
            Apiary records log each colony, its hive location and the honey harvest.
            """;

    public static final String FINTECH_CONTENT = "A digital banking wallet with payment processing, fraud detection, "
            + "KYC and AML compliance, loan origination and credit scoring for every transaction.";

    public static final String ENTERPRISE_CONTENT = "An enterprise corporate portal needs SSO, RBAC, compliance "
            + "audit trails, scalability, 99.9% uptime, security hardening and real-time dashboards.";

    public static final String HEALTHCARE_CONTENT = "The hospital clinic needs patient appointment scheduling, "
            + "prescription handling, diagnosis and treatment notes, and HIPAA compliant medical record "
            + "storage for every doctor and nurse.";

    private PipelineTestSupport() {
    }

    public static PipelineProperties properties(Path pluginDir) {
        return properties(pluginDir, true, Duration.ofSeconds(10));
    }

    public static PipelineProperties properties(Path pluginDir, boolean synthesisEnabled, Duration timeout) {
        return new PipelineProperties(
                new PipelineProperties.Catalog(null, pluginDir.toString()),
                null,
                new PipelineProperties.Synthesis(synthesisEnabled, "template", timeout, 4, null, null),
                null,
                null);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static DomainDefinitionRepository repository(PipelineProperties properties) {
        return new DomainDefinitionRepository(new PathMatchingResourcePatternResolver(), objectMapper(), properties);
    }

    public static HandlerCatalog scannedCatalog(DomainDefinitionRepository repository) {
        HandlerCatalog catalog = new HandlerCatalog(repository);
        catalog.scan();
        return catalog;
    }
}
