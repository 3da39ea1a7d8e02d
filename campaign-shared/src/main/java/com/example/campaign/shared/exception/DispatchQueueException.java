package com.example.campaign.shared.exception;

import lombok.Getter;

/**
 * Publishing a job onto the dispatch queue failed or timed out.
 */
@Getter
public class DispatchQueueException extends RuntimeException {

    private final Long campaignItemId;

    public DispatchQueueException(String message, Long campaignItemId, Throwable cause) {
        super(message, cause);
        this.campaignItemId = campaignItemId;
    }
}
