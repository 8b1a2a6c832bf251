package com.example.xagent.model;

import com.example.xagent.handler.DomainHandler;

/**
 * Outcome of domain resolution.
 *
 * @param handler        The handler to extract requirements with
 * @param domainName     Its domain name
 * @param score          Weighted confidence of the chosen handler (1.0 for a hint short-circuit)
 * @param wasSynthesized True only when the handler was minted during this call
 * @param cost           Synthesis cost reported for this call, 0 otherwise
 */
public record Resolution(
        DomainHandler handler,
        String domainName,
        double score,
        boolean wasSynthesized,
        double cost
) {}
