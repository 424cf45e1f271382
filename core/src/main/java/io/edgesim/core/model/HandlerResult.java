package io.edgesim.core.model;

/**
 * What a stage handler may hand back to the lifecycle engine: a
 * {@link RequestEvent} to continue with, or a {@link ResponseArtifact} to answer
 * with. Any other implementation is rejected as an invalid handler result.
 */
public interface HandlerResult {}
