package com.example.xagent.model;

/**
 * Result of ingress validation: a usable document or a malformed-input reason.
 */
public record IngressResult(
        DocumentInput document,
        String error
) {
    public static IngressResult accepted(DocumentInput document) {
        return new IngressResult(document, null);
    }

    public static IngressResult malformed(String reason) {
        return new IngressResult(null, reason);
    }

    public boolean isMalformed() {
        return error != null;
    }
}
