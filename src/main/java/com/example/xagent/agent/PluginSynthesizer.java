package com.example.xagent.agent;

import com.example.xagent.model.SynthesisResult;

import java.util.List;

/**
 * Produces a brand-new domain handler definition for content no existing handler fits.
 * <p>
 * A successful result carries a structured definition (never executable code) whose
 * name is not in {@code existingNames}, plus a cost estimate. Implementations may block
 * on a remote model; callers bound the call with a timeout.
 */
public interface PluginSynthesizer {

    /**
     * @param content       document content the new domain should fit
     * @param domainHint    suggested domain name, may be null
     * @param existingNames names already taken in the catalog
     */
    SynthesisResult synthesize(String content, String domainHint, List<String> existingNames);
}
