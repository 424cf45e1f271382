package io.edgesim.core.model;

/**
 * Per-invocation metadata handed to a handler alongside the request, telling it
 * which distribution and which stage it runs in.
 *
 * @param distributionDomainName simulated distribution domain
 * @param distributionId         simulated distribution id
 * @param eventType              the stage being invoked
 * @param requestId              id shared by every stage of one request
 */
public record EventConfig(String distributionDomainName, String distributionId, EventType eventType, String requestId) {

    /** Returns a copy for another stage of the same request. */
    public EventConfig forStage(EventType stage) {
        return new EventConfig(distributionDomainName, distributionId, stage, requestId);
    }
}
