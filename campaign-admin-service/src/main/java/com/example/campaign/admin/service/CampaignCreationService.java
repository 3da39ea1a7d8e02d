package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.CreateCampaignRequest;
import com.example.campaign.admin.dto.VariantRequest;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.exception.CampaignValidationException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignVariant;
import com.example.campaign.shared.model.TargetFilter;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.CampaignVariantRepository;
import com.example.campaign.shared.repository.MessageTemplateRepository;
import com.example.campaign.shared.util.Constants;
import com.example.campaign.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Creates DRAFT campaigns and edits their audience filter while they are still drafts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("service")
public class CampaignCreationService {

    private final CampaignRepository campaignRepository;
    private final CampaignVariantRepository campaignVariantRepository;
    private final MessageTemplateRepository messageTemplateRepository;
    private final AudienceResolver audienceResolver;
    private final CampaignMapper campaignMapper;
    private final Clock clock;

    @Transactional
    public CampaignResponse createCampaign(String tenantId, CreateCampaignRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new CampaignValidationException("Campaign name is required");
        }
        TargetFilter filter = request.getTargetFilter() == null ? TargetFilter.empty() : request.getTargetFilter();

        List<VariantRequest> variants = List.of();
        int[] splits = new int[0];
        Long templateId = null;
        if (request.isAbTestEnabled()) {
            variants = request.getVariants() == null ? List.of() : request.getVariants();
            if (variants.size() < 2 || variants.size() > Constants.MAX_VARIANTS) {
                throw new CampaignValidationException("A/B campaigns need between 2 and " + Constants.MAX_VARIANTS + " variants");
            }
            for (VariantRequest variant : variants) {
                requireTemplate(tenantId, variant.getTemplateId());
            }
            splits = resolveSplits(variants);
        } else {
            templateId = request.getTemplateId();
            requireTemplate(tenantId, templateId);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        long audienceSize = audienceResolver.count(tenantId, filter);
        Campaign campaign = campaignRepository.save(Campaign.builder()
                .tenantId(tenantId)
                .name(request.getName().trim())
                .status(Constants.CampaignStatus.DRAFT.name())
                .templateId(templateId)
                .abTestEnabled(request.isAbTestEnabled())
                .targetFilter(JsonUtils.toJson(filter))
                .totalContacts((int) audienceSize)
                .recurrenceType(Constants.RecurrenceType.NONE.name())
                .createdAt(now)
                .updatedAt(now)
                .build());

        Constants.VariantLetter[] letters = Constants.VariantLetter.values();
        for (int i = 0; i < variants.size(); i++) {
            campaignVariantRepository.save(CampaignVariant.builder()
                    .campaignId(campaign.getId())
                    .variantLetter(letters[i].name())
                    .templateId(variants.get(i).getTemplateId())
                    .splitPercent(splits[i])
                    .createdAt(now)
                    .build());
        }

        log.info("Created {} campaign {} '{}' for tenant {} ({} contacts match)",
                campaign.isAbTestEnabled() ? "A/B" : "single-template", campaign.getId(), campaign.getName(), tenantId, audienceSize);
        return campaignMapper.toCampaignResponse(campaign);
    }

    @Transactional
    public CampaignResponse updateTargetFilter(String tenantId, Long campaignId, TargetFilter filter) {
        Campaign campaign = campaignRepository.findByIdAndTenantId(campaignId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
        if (!Constants.CampaignStatus.DRAFT.name().equals(campaign.getStatus())) {
            throw new CampaignValidationException("Filters can only be changed on DRAFT campaigns; campaign " + campaignId + " is " + campaign.getStatus());
        }
        TargetFilter effective = filter == null ? TargetFilter.empty() : filter;
        long audienceSize = audienceResolver.count(tenantId, effective);
        if (campaignRepository.updateTargetFilter(campaignId, tenantId, JsonUtils.toJson(effective), (int) audienceSize, OffsetDateTime.now(clock)) == 0) {
            throw new CampaignValidationException("Campaign " + campaignId + " left DRAFT while its filters were being updated");
        }
        log.info("Updated filters of campaign {}: {} contacts match", campaignId, audienceSize);
        return campaignRepository.findById(campaignId)
                .map(campaignMapper::toCampaignResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
    }

    /**
     * Splits left out on every variant are shared evenly, the remainder going to the last
     * variant. Explicit splits must be given on every variant and add up to 100.
     */
    static int[] resolveSplits(List<VariantRequest> variants) {
        long explicit = variants.stream().map(VariantRequest::getSplitPercent).filter(Objects::nonNull).count();
        int[] splits = new int[variants.size()];
        if (explicit == 0) {
            int share = Constants.FULL_SPLIT_PERCENT / variants.size();
            for (int i = 0; i < splits.length; i++) {
                splits[i] = share;
            }
            splits[splits.length - 1] = Constants.FULL_SPLIT_PERCENT - share * (splits.length - 1);
            return splits;
        }
        if (explicit != variants.size()) {
            throw new CampaignValidationException("Set a split percent on every variant or on none of them");
        }
        int total = 0;
        for (int i = 0; i < splits.length; i++) {
            splits[i] = variants.get(i).getSplitPercent();
            total += splits[i];
        }
        if (total != Constants.FULL_SPLIT_PERCENT) {
            throw new CampaignValidationException("Variant split percents must add up to 100 but add up to " + total);
        }
        return splits;
    }

    private void requireTemplate(String tenantId, Long templateId) {
        if (templateId == null) {
            throw new CampaignValidationException("A template is required");
        }
        if (messageTemplateRepository.findByIdAndTenantId(templateId, tenantId).isEmpty()) {
            throw new CampaignValidationException("Template " + templateId + " does not exist");
        }
    }
}
