package com.example.xagent.service;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Utility for LLM calls with lenient JSON parsing, bounded retry and token accounting.
 * <p>
 * Model output is parsed through a {@link BeanOutputConverter} backed by a lenient
 * {@link ObjectMapper} (trailing commas, comments, single quotes, unknown fields).
 * Failed attempts are retried up to {@value #MAX_RETRIES} times with a linear back-off.
 * Token counts of the successful attempt are returned with the entity so callers can
 * turn them into a cost.
 */
public final class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);
    private static final int MAX_RETRIES = 2;
    private static final long BACKOFF_MILLIS = 1000L;

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ResilientLlmCaller() {
    }

    /**
     * Parsed model output plus the token usage of the call that produced it.
     */
    public record LlmCall<T>(T entity, long inputTokens, long outputTokens, String model) {

        /** Cost in USD for the given per-million-token prices. */
        public double cost(double inputPricePerMillion, double outputPricePerMillion) {
            return inputTokens * inputPricePerMillion / 1_000_000.0
                    + outputTokens * outputPricePerMillion / 1_000_000.0;
        }
    }

    /**
     * Calls the model and converts its answer to {@code type}.
     *
     * @param chatClient   the LLM client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt (format instructions are appended)
     * @param type         the target class for parsing
     * @param callerName   caller name, for logging
     * @return the parsed entity and token usage
     * @throws IllegalStateException if all attempts fail
     */
    public static <T> LlmCall<T> callEntity(ChatClient chatClient, String systemPrompt, String userPrompt,
                                            Class<T> type, String callerName) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();

        Exception lastError = null;
        for (int attempt = 1; attempt <= MAX_RETRIES + 1; attempt++) {
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(fullUserPrompt)
                        .call()
                        .chatResponse();

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new IllegalStateException("Empty or null content in LLM response");
                }
                T entity = converter.convert(content);
                return withUsage(entity, chatResponse, callerName);
            } catch (Exception e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IllegalStateException(callerName + " interrupted", e);
                }
                lastError = e;
                if (attempt <= MAX_RETRIES) {
                    long delay = attempt * BACKOFF_MILLIS;
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            callerName, attempt, MAX_RETRIES + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(callerName + " interrupted during back-off", ie);
                    }
                }
            }
        }
        throw new IllegalStateException("Error in " + callerName + " after " + (MAX_RETRIES + 1)
                + " attempts: " + lastError.getMessage(), lastError);
    }

    private static <T> LlmCall<T> withUsage(T entity, ChatResponse chatResponse, String callerName) {
        var metadata = chatResponse.getMetadata();
        Usage usage = metadata != null ? metadata.getUsage() : null;
        long in = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens().longValue() : 0L;
        long out = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens().longValue() : 0L;
        String model = metadata != null ? metadata.getModel() : null;
        log.debug("{}: {} input / {} output tokens (model={})", callerName, in, out, model);
        return new LlmCall<>(entity, in, out, model);
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
