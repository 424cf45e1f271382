package io.edgesim.standalone.config;

/**
 * One {@code origins} entry.
 *
 * @param pathPattern   path pattern the origin serves
 * @param target        base URL of the origin
 * @param defaultOrigin whether the origin also serves the catch-all behavior
 */
public record OriginMapping(String pathPattern, String target, boolean defaultOrigin) {}
