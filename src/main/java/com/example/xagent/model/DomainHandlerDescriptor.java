package com.example.xagent.model;

/**
 * Catalog entry for one domain handler.
 * <p>
 * Created at scan time with {@code loaded=false} and only the name resolved
 * ({@code priorityScore=0} stands for "not known yet"). Replaced by a loaded copy
 * exactly once, the first time the handler is needed.
 *
 * @param name          Unique domain name
 * @param loaded        Whether the handler instance has been created
 * @param priorityScore Handler priority, 1..5 once loaded
 * @param customCreated True for synthesized handlers
 * @param creationCost  Synthesis cost, 0 for built-ins
 * @param source        Where the definition lives (resource description)
 */
public record DomainHandlerDescriptor(
        String name,
        boolean loaded,
        int priorityScore,
        boolean customCreated,
        double creationCost,
        String source
) {
    public static DomainHandlerDescriptor unresolved(String name, String source, boolean customCreated) {
        return new DomainHandlerDescriptor(name, false, 0, customCreated, 0.0, source);
    }

    public static DomainHandlerDescriptor loadedFrom(DomainDefinition definition, String source) {
        return new DomainHandlerDescriptor(definition.name(), true, definition.priorityScore(),
                definition.customCreated(), definition.creationCost(), source);
    }
}
