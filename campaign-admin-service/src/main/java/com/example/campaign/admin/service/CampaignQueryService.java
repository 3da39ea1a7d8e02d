package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.AudiencePreviewResponse;
import com.example.campaign.admin.dto.CampaignDetailResponse;
import com.example.campaign.admin.dto.CampaignItemResponse;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.TargetFilter;
import com.example.campaign.shared.repository.CampaignItemRepository;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.CampaignVariantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class CampaignQueryService {

    static final int RECENT_ITEMS = 50;
    static final int MAX_ITEMS = 500;

    private final CampaignRepository campaignRepository;
    private final CampaignVariantRepository campaignVariantRepository;
    private final CampaignItemRepository campaignItemRepository;
    private final AudienceResolver audienceResolver;
    private final CampaignMapper campaignMapper;

    public AudiencePreviewResponse previewAudience(String tenantId, TargetFilter filter) {
        return new AudiencePreviewResponse(audienceResolver.count(tenantId, filter == null ? TargetFilter.empty() : filter));
    }

    @Transactional(readOnly = true)
    public List<CampaignResponse> listCampaigns(String tenantId) {
        return campaignMapper.toCampaignResponses(campaignRepository.findByTenantOrderedByCreatedAtDesc(tenantId));
    }

    @Transactional(readOnly = true)
    public CampaignDetailResponse getCampaign(String tenantId, Long campaignId) {
        Campaign campaign = findCampaign(tenantId, campaignId);
        return CampaignDetailResponse.builder()
                .campaign(campaignMapper.toCampaignResponse(campaign))
                .analytics(campaignMapper.toAnalytics(campaign))
                .variants(campaignMapper.toVariantStatsResponses(campaignVariantRepository.findByCampaignIdOrderByVariantLetter(campaignId)))
                .itemStatusCounts(campaignItemRepository.countByStatus(campaignId))
                .recentItems(campaignMapper.toCampaignItemResponses(campaignItemRepository.findByCampaignId(campaignId, RECENT_ITEMS)))
                .build();
    }

    @Transactional(readOnly = true)
    public List<CampaignItemResponse> listItems(String tenantId, Long campaignId, int limit) {
        findCampaign(tenantId, campaignId);
        int boundedLimit = Math.max(1, Math.min(limit, MAX_ITEMS));
        return campaignMapper.toCampaignItemResponses(campaignItemRepository.findByCampaignId(campaignId, boundedLimit));
    }

    private Campaign findCampaign(String tenantId, Long campaignId) {
        return campaignRepository.findByIdAndTenantId(campaignId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
    }
}
