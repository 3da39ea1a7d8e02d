package com.example.campaign.shared.dto;

/**
 * A request that carries the caller's correlation id, so it can be attached to the trace span.
 */
public interface CorrelatedRequest {
    String getCorrelationId();
}
