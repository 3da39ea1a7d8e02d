package com.example.campaign.shared.exception;

import lombok.Getter;

/**
 * A launch failed after it had claimed the campaign, which is therefore left PROCESSING
 * by this launch and not by a concurrent one.
 */
@Getter
public class LaunchAbortedException extends RuntimeException {

    private final Long campaignId;

    public LaunchAbortedException(Long campaignId, Throwable cause) {
        super("Launch of campaign " + campaignId + " failed after it was claimed: " + cause.getMessage(), cause);
        this.campaignId = campaignId;
    }
}
