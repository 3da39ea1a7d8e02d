package com.example.campaign.admin.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.dto.DispatchJob;
import com.example.campaign.shared.exception.CampaignValidationException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignVariant;
import com.example.campaign.shared.model.MessageTemplate;
import com.example.campaign.shared.repository.CampaignVariantRepository;
import com.example.campaign.shared.repository.MessageTemplateRepository;
import com.example.campaign.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates a campaign's template configuration and builds its send jobs.
 */
@Service
@RequiredArgsConstructor
public class DispatchPlanService {

    private final CampaignVariantRepository campaignVariantRepository;
    private final MessageTemplateRepository messageTemplateRepository;
    private final AppProperties appProperties;

    /**
     * An A/B campaign needs at least two variants whose templates exist for the tenant;
     * any other campaign needs its own template.
     *
     * @throws CampaignValidationException if the campaign cannot be sent as configured
     */
    public DispatchPlan planFor(Campaign campaign) {
        if (campaign.isAbTestEnabled()) {
            List<CampaignVariant> variants = campaignVariantRepository.findByCampaignIdOrderByVariantLetter(campaign.getId());
            Map<String, MessageTemplate> templatesByLetter = new LinkedHashMap<>();
            for (CampaignVariant variant : variants) {
                findTemplate(campaign.getTenantId(), variant.getTemplateId())
                        .ifPresent(template -> templatesByLetter.put(variant.getVariantLetter(), template));
            }
            if (templatesByLetter.size() < 2) {
                throw new CampaignValidationException("A/B campaign " + campaign.getId() + " needs at least 2 variants with templates");
            }
            List<CampaignVariant> usable = variants.stream()
                    .filter(variant -> templatesByLetter.containsKey(variant.getVariantLetter()))
                    .toList();
            MessageTemplate defaultTemplate = templatesByLetter.get(usable.get(0).getVariantLetter());
            return new DispatchPlan(campaign, usable, templatesByLetter, defaultTemplate);
        }

        MessageTemplate template = findTemplate(campaign.getTenantId(), campaign.getTemplateId())
                .orElseThrow(() -> new CampaignValidationException("Campaign " + campaign.getId() + " has no template"));
        return new DispatchPlan(campaign, List.of(), Map.of(), template);
    }

    public DispatchJob jobFor(DispatchPlan plan, Long campaignItemId, String variantLetter, String phone, String contactName) {
        Campaign campaign = plan.campaign();
        MessageTemplate template = plan.templateFor(variantLetter);
        String language = template.getLanguage() == null || template.getLanguage().isBlank()
                ? appProperties.getDispatch().getDefaultLanguage()
                : template.getLanguage();
        return DispatchJob.builder()
                .type(Constants.JobType.CAMPAIGN_SEND.name())
                .campaignItemId(campaignItemId)
                .campaignId(campaign.getId())
                .tenantId(campaign.getTenantId())
                .phone(phone)
                .contactName(contactName)
                .templateName(template.getName())
                .templateLanguage(language)
                .variantLetter(variantLetter)
                .build();
    }

    private Optional<MessageTemplate> findTemplate(String tenantId, Long templateId) {
        if (templateId == null) {
            return Optional.empty();
        }
        return messageTemplateRepository.findByIdAndTenantId(templateId, tenantId);
    }
}
