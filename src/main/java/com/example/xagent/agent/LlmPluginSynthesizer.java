package com.example.xagent.agent;

import com.example.xagent.config.PipelineProperties;
import com.example.xagent.exception.SynthesisException;
import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.SynthesisResult;
import com.example.xagent.model.SynthesizedDomainResponse;
import com.example.xagent.service.ResilientLlmCaller;
import com.example.xagent.service.ResilientLlmCaller.LlmCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;

/**
 * Synthesizer backed by a language model. The model returns a structured domain
 * proposal (keywords, priority, requirement rules, stakeholders), never code.
 * If the model call fails and a fallback is configured, the deterministic template
 * synthesizer answers instead.
 */
public class LlmPluginSynthesizer implements PluginSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(LlmPluginSynthesizer.class);

    private static final String SYSTEM_PROMPT = """
            You are a business analyst that designs domain handlers for a requirements pipeline.

            TASK:
            Given a project description, define ONE new business domain that fits it.
            Return JSON only, compliant with the provided schema.

            RULES:
            - name: lowercase letters and underscores only (e.g. "beekeeping", "quantum_research").
            - name MUST NOT be one of the existing domain names listed in the request.
            - keywords: 8 to 15 lowercase terms or short phrases that identify the domain in free text.
              Avoid generic software words (system, user, data, app, platform, management).
            - priorityScore: 1 (generic) to 5 (highly specialized or regulated).
            - requirementRules: 3 to 6 rules. Each rule has "triggers" (lowercase terms that must appear
              in a document for the rule to apply), a concise "title", a "priority" (high, medium, low)
              and a "category" (functional or non-functional).
            - stakeholders: 2 to 6 stakeholder roles.
            """;

    private final ChatClient chatClient;
    private final PluginSynthesizer fallback;
    private final double inputPricePerMillion;
    private final double outputPricePerMillion;

    public LlmPluginSynthesizer(ChatClient chatClient, PluginSynthesizer fallback,
                                PipelineProperties.Synthesis properties) {
        this.chatClient = chatClient;
        this.fallback = fallback;
        this.inputPricePerMillion = properties.inputTokenPricePerMillion();
        this.outputPricePerMillion = properties.outputTokenPricePerMillion();
    }

    @Override
    public SynthesisResult synthesize(String content, String domainHint, List<String> existingNames) {
        log.info("LlmPluginSynthesizer: requesting a new domain (hint '{}', {} existing domains)",
                domainHint, existingNames.size());
        try {
            LlmCall<SynthesizedDomainResponse> call = ResilientLlmCaller.callEntity(
                    chatClient, SYSTEM_PROMPT,
                    """
                            Existing domain names (do not reuse): %s
                            Domain hint: %s

                            PROJECT DESCRIPTION:
                            ===BEGIN===
                            %s
                            ===END===
                            """.formatted(String.join(", ", existingNames),
                            domainHint != null ? domainHint : "none", content),
                    SynthesizedDomainResponse.class, "LlmPluginSynthesizer");

            double cost = call.cost(inputPricePerMillion, outputPricePerMillion);
            if (call.entity() == null) {
                return fallbackOr(content, domainHint, existingNames, "Model returned no domain proposal");
            }
            DomainDefinition definition = call.entity().toDefinition();
            if (existingNames.contains(definition.name())) {
                return SynthesisResult.failure("Model proposed existing domain name '" + definition.name() + "'");
            }
            log.info("LlmPluginSynthesizer: proposed domain '{}' ({} keywords, cost ${})",
                    definition.name(), definition.keywords().size(), "%.4f".formatted(cost));
            return SynthesisResult.success(definition, cost);

        } catch (SynthesisException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("LlmPluginSynthesizer: model call failed: {}", e.getMessage());
            return fallbackOr(content, domainHint, existingNames, e.getMessage());
        }
    }

    private SynthesisResult fallbackOr(String content, String domainHint, List<String> existingNames, String error) {
        if (fallback == null) {
            throw new SynthesisException("Domain synthesis failed: " + error);
        }
        log.info("LlmPluginSynthesizer: falling back to template synthesis");
        return fallback.synthesize(content, domainHint, existingNames);
    }
}
