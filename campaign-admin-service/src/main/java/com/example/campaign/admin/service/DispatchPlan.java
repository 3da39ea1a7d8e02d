package com.example.campaign.admin.service;

import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignVariant;
import com.example.campaign.shared.model.MessageTemplate;

import java.util.List;
import java.util.Map;

/**
 * Everything a launch needs to build send jobs, resolved once before fan-out.
 *
 * @param variants          variants in letter order, empty for a single-template campaign
 * @param templatesByLetter the resolved template of each variant
 * @param defaultTemplate   the campaign template, or the first variant's template for A/B
 */
public record DispatchPlan(Campaign campaign,
                           List<CampaignVariant> variants,
                           Map<String, MessageTemplate> templatesByLetter,
                           MessageTemplate defaultTemplate) {

    public boolean isAbTest() {
        return !variants.isEmpty();
    }

    /**
     * Template for a recipient's variant letter; a recipient with no variant gets the default.
     */
    public MessageTemplate templateFor(String variantLetter) {
        if (variantLetter == null) {
            return defaultTemplate;
        }
        return templatesByLetter.getOrDefault(variantLetter, defaultTemplate);
    }
}
