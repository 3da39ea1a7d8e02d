package com.example.campaign.shared.exception;

import lombok.Getter;

/**
 * Raised when a campaign's target filter matches no eligible contact at launch time.
 */
@Getter
public class EmptyAudienceException extends RuntimeException {

    private final Long campaignId;

    public EmptyAudienceException(Long campaignId) {
        super("No eligible contacts match the target filter of campaign " + campaignId);
        this.campaignId = campaignId;
    }
}
