package org.dxworks.celerrate.model;

/**
 * Span-preserving stand-in for a construct that could not be mapped with confidence.
 * The reason is always also reported as a diagnostic.
 */
public interface Placeholder {

    /**
     * Grammar kind of the concrete node that was replaced, as reported by the engine.
     */
    String getConcreteKind();

    String getReason();
}
