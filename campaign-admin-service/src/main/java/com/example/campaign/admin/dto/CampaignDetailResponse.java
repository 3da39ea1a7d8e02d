package com.example.campaign.admin.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class CampaignDetailResponse {
    private CampaignResponse campaign;
    private CampaignAnalytics analytics;
    private List<VariantStatsResponse> variants;
    private Map<String, Long> itemStatusCounts;
    private List<CampaignItemResponse> recentItems;
}
