package com.example.campaign.shared.exception;

/**
 * A request the campaign's current state or configuration does not allow, such as
 * launching a campaign that is not a draft. The campaign is left unchanged.
 */
public class CampaignValidationException extends RuntimeException {

    public CampaignValidationException(String message) {
        super(message);
    }
}
