package com.example.xagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the refinement pipeline.
 * Every nested group falls back to its defaults when absent, so tests can build the
 * record directly with {@code null}s.
 */
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        Catalog catalog,
        Resolver resolver,
        Synthesis synthesis,
        Orchestrator orchestrator,
        Ingress ingress
) {

    public PipelineProperties {
        if (catalog == null) catalog = new Catalog(null, null);
        if (resolver == null) resolver = new Resolver(null, null);
        if (synthesis == null) synthesis = new Synthesis(null, null, null, null, null, null);
        if (orchestrator == null) orchestrator = new Orchestrator(null);
        if (ingress == null) ingress = new Ingress(null);
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null);
    }

    /**
     * Where handler definitions are discovered.
     *
     * @param builtinLocation Resource pattern of the built-in definitions
     * @param pluginDir       Directory synthesized definitions are written to and re-scanned from
     */
    public record Catalog(String builtinLocation, String pluginDir) {
        public Catalog {
            if (builtinLocation == null || builtinLocation.isBlank()) builtinLocation = "classpath:domains/*.json";
            if (pluginDir == null || pluginDir.isBlank()) pluginDir = "./domain-plugins";
        }
    }

    /**
     * Domain resolution tuning.
     *
     * @param confidenceThreshold Minimum weighted score to accept an existing handler
     * @param maxPriority         Priority that gives a handler full weight
     */
    public record Resolver(Double confidenceThreshold, Integer maxPriority) {
        public Resolver {
            if (confidenceThreshold == null) confidenceThreshold = 0.6;
            if (maxPriority == null || maxPriority < 1) maxPriority = 5;
        }
    }

    /**
     * Handler synthesis.
     *
     * @param enabled                   Whether unmatched content may trigger synthesis
     * @param mode                      {@code template} (deterministic) or {@code llm}
     * @param timeout                   Upper bound for one synthesis call
     * @param defaultPriority           Minimum priority given to template-synthesized handlers
     * @param inputTokenPricePerMillion  Cost of one million prompt tokens (USD)
     * @param outputTokenPricePerMillion Cost of one million completion tokens (USD)
     */
    public record Synthesis(Boolean enabled, String mode, Duration timeout, Integer defaultPriority,
                            Double inputTokenPricePerMillion, Double outputTokenPricePerMillion) {
        public Synthesis {
            if (enabled == null) enabled = true;
            if (mode == null || mode.isBlank()) mode = "template";
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (defaultPriority == null) defaultPriority = 4;
            if (inputTokenPricePerMillion == null) inputTokenPricePerMillion = 3.0;
            if (outputTokenPricePerMillion == null) outputTokenPricePerMillion = 15.0;
        }
    }

    /** @param maxIterations Upper bound on quality-gate evaluations per run */
    public record Orchestrator(Integer maxIterations) {
        public Orchestrator {
            if (maxIterations == null || maxIterations < 1) maxIterations = 3;
        }
    }

    /** @param maxContentLength Largest accepted document, in characters */
    public record Ingress(Integer maxContentLength) {
        public Ingress {
            if (maxContentLength == null || maxContentLength < 1) maxContentLength = 200_000;
        }
    }
}
