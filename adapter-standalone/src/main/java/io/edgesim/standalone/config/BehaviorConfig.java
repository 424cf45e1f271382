package io.edgesim.standalone.config;

/**
 * One {@code behaviors} entry: a handler class attached to one stage of the
 * behavior with the given path pattern.
 *
 * @param pattern   path pattern, {@code "*"} when omitted
 * @param eventType stage wire name, e.g. {@code viewer-request}
 * @param handler   fully qualified class name of a
 *                  {@link io.edgesim.core.spi.StageHandler}
 */
public record BehaviorConfig(String pattern, String eventType, String handler) {}
