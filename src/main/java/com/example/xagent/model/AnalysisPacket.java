package com.example.xagent.model;

/**
 * Immutable result of domain resolution, consumed by the requirements stage.
 *
 * @param domain     Resolved domain name ({@code general} when nothing matched)
 * @param complexity Rough size indicator, 0..5
 * @param content    Document content
 */
public record AnalysisPacket(
        String domain,
        int complexity,
        String content
) {
    public static final int MAX_COMPLEXITY = 5;

    /** One complexity point per 500 characters, capped at {@value #MAX_COMPLEXITY}. */
    public static AnalysisPacket of(String domain, String content) {
        int complexity = Math.min(content.length() / 500, MAX_COMPLEXITY);
        return new AnalysisPacket(domain, complexity, content);
    }
}
