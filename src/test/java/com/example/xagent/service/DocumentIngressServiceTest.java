package com.example.xagent.service;

import com.example.xagent.config.PipelineProperties;
import com.example.xagent.model.DocumentInput;
import com.example.xagent.model.IngressResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentIngressServiceTest {

    private final DocumentIngressService service = new DocumentIngressService(
            new PipelineProperties(null, null, null, null, new PipelineProperties.Ingress(100)));

    @Test
    void acceptsPlainTextAndNormalizesHint() {
        IngressResult result = service.parse(new DocumentInput("Line one\n\tLine two\r\n", "  fintech "));

        assertThat(result.isMalformed()).isFalse();
        assertThat(result.document().content()).isEqualTo("Line one\n\tLine two\r\n");
        assertThat(result.document().domainHint()).isEqualTo("fintech");
    }

    @Test
    void dropsUnusableHints() {
        assertThat(service.parse(new DocumentInput("text", "   ")).document().domainHint()).isNull();
        assertThat(service.parse(new DocumentInput("text", "x".repeat(65))).document().domainHint()).isNull();
    }

    @Test
    void acceptsNonAsciiText() {
        assertThat(service.parse(new DocumentInput("Gestion des ruches 🐝 et du miel", null)).isMalformed())
                .isFalse();
    }

    @Test
    void rejectsMissingOrBlankContent() {
        assertThat(service.parse(null).error()).isEqualTo("Missing document content");
        assertThat(service.parse(new DocumentInput(null, "fintech")).error()).isEqualTo("Missing document content");
        assertThat(service.parse(new DocumentInput(" \n\t ", null)).error()).isEqualTo("Empty document");
    }

    @Test
    void rejectsOversizedContent() {
        IngressResult result = service.parse(new DocumentInput("a".repeat(101), null));

        assertThat(result.isMalformed()).isTrue();
        assertThat(result.error()).startsWith("Document too large: 101 characters");
    }

    @Test
    void rejectsBinaryContent() {
        assertThat(service.parse(new DocumentInput("PK\u0003\u0004zip", null)).error())
                .contains("control character U+0003");
        assertThat(service.parse(new DocumentInput("abc\u0000", null)).error()).contains("NUL");
        assertThat(service.parse(new DocumentInput("broken \uD83D pair", null)).error()).contains("surrogate");
        assertThat(service.parse(new DocumentInput("broken \uDC00 pair", null)).error()).contains("surrogate");
    }
}
