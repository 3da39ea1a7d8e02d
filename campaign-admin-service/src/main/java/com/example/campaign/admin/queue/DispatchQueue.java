package com.example.campaign.admin.queue;

import com.example.campaign.shared.dto.DispatchJob;

/**
 * Durable FIFO work queue consumed by the sender process.
 */
public interface DispatchQueue {

    /**
     * Publishes one job. Returns only once the broker acknowledged it.
     *
     * @throws com.example.campaign.shared.exception.DispatchQueueException if the broker is
     *         unavailable or does not acknowledge within the publish timeout
     */
    void publish(DispatchJob job);

    /**
     * Human-readable destination, used in logs.
     */
    String destination();
}
