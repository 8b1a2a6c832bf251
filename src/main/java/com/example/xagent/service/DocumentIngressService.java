package com.example.xagent.service;

import com.example.xagent.config.PipelineProperties;
import com.example.xagent.model.DocumentInput;
import com.example.xagent.model.IngressResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates documents entering the pipeline.
 * <p>
 * A document is malformed when it is missing, blank, larger than the configured
 * limit, or not readable text (NUL bytes, control characters, broken surrogate pairs).
 * Malformed input is reported as a result value and never consumes an iteration.
 */
@Service
public class DocumentIngressService {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngressService.class);

    private static final int MAX_HINT_LENGTH = 64;

    private final int maxContentLength;

    public DocumentIngressService(PipelineProperties properties) {
        this.maxContentLength = properties.ingress().maxContentLength();
    }

    public IngressResult parse(DocumentInput input) {
        if (input == null || input.content() == null) {
            return malformed("Missing document content");
        }
        String content = input.content();
        if (content.isBlank()) {
            return malformed("Empty document");
        }
        if (content.length() > maxContentLength) {
            return malformed("Document too large: " + content.length()
                    + " characters (maximum " + maxContentLength + ")");
        }
        String textProblem = textProblem(content);
        if (textProblem != null) {
            return malformed("Document is not valid text: " + textProblem);
        }

        String hint = input.domainHint();
        if (hint != null) {
            hint = hint.trim();
            if (hint.isEmpty() || hint.length() > MAX_HINT_LENGTH) {
                log.debug("Ignoring unusable domain hint of length {}", hint.length());
                hint = null;
            }
        }
        return IngressResult.accepted(new DocumentInput(content, hint));
    }

    private static String textProblem(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\0') {
                return "contains NUL characters at offset " + i;
            }
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t' && c != '\f') {
                return "contains control character U+%04X at offset %d".formatted((int) c, i);
            }
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= content.length() || !Character.isLowSurrogate(content.charAt(i + 1))) {
                    return "broken surrogate pair at offset " + i;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return "broken surrogate pair at offset " + i;
            }
        }
        return null;
    }

    private static IngressResult malformed(String reason) {
        log.warn("Rejecting malformed document: {}", reason);
        return IngressResult.malformed(reason);
    }
}
