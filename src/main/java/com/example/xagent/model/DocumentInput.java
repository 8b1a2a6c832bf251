package com.example.xagent.model;

/**
 * A free-text project description submitted to the pipeline.
 *
 * @param content    Document text
 * @param domainHint Optional domain name to short-circuit resolution
 */
public record DocumentInput(
        String content,
        String domainHint
) {}
