package com.example.campaign.shared.exception;

/**
 * The conditional PROCESSING claim matched no row: another launch or sweep changed the
 * campaign's status after it was read.
 */
public class LaunchClaimLostException extends CampaignValidationException {

    public LaunchClaimLostException(Long campaignId, String expectedStatus) {
        super("Campaign " + campaignId + " is no longer " + expectedStatus + "; it was claimed by another launch");
    }
}
