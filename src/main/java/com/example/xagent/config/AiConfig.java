package com.example.xagent.config;

import com.example.xagent.agent.LlmPluginSynthesizer;
import com.example.xagent.agent.PluginSynthesizer;
import com.example.xagent.agent.TemplatePluginSynthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Synthesis wiring: the optional Anthropic-backed ChatClient, the synthesizer chosen by
 * {@code pipeline.synthesis.mode}, and the executor that bounds synthesis time.
 */
@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    /**
     * ChatClient used to propose new domains (Anthropic). Only created in {@code llm} mode.
     */
    @Bean("synthesisChatClient")
    @ConditionalOnProperty(prefix = "pipeline.synthesis", name = "mode", havingValue = "llm")
    public ChatClient synthesisChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    @Bean
    public PluginSynthesizer pluginSynthesizer(PipelineProperties properties,
                                               @Qualifier("synthesisChatClient") ObjectProvider<ChatClient> chatClient) {
        PipelineProperties.Synthesis synthesis = properties.synthesis();
        TemplatePluginSynthesizer template = new TemplatePluginSynthesizer(synthesis.defaultPriority());
        ChatClient client = chatClient.getIfAvailable();
        if ("llm".equalsIgnoreCase(synthesis.mode()) && client != null) {
            log.info("Domain synthesis: language model with template fallback");
            return new LlmPluginSynthesizer(client, template, synthesis);
        }
        log.info("Domain synthesis: template");
        return template;
    }

    /**
     * Runs synthesis calls so the resolver can give up on them after the configured timeout.
     * Synthesis is serialized by the resolver, two threads leave room for a timed-out call
     * that is still winding down.
     */
    @Bean(name = "synthesisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService synthesisExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    /**
     * ObjectMapper shared for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
