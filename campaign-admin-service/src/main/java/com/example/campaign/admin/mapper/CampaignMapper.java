package com.example.campaign.admin.mapper;

import com.example.campaign.admin.dto.CampaignAnalytics;
import com.example.campaign.admin.dto.CampaignItemResponse;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.VariantStatsResponse;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignItem;
import com.example.campaign.shared.model.CampaignVariant;
import com.example.campaign.shared.util.JsonUtils;
import org.mapstruct.AfterMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

import java.util.List;

@Mapper(componentModel = "spring", imports = { JsonUtils.class })
public interface CampaignMapper {

    @Mapping(target = "targetFilter", expression = "java(JsonUtils.parseTargetFilter(campaign.getTargetFilter()))")
    CampaignResponse toCampaignResponse(Campaign campaign);

    List<CampaignResponse> toCampaignResponses(List<Campaign> campaigns);

    CampaignItemResponse toCampaignItemResponse(CampaignItem item);

    List<CampaignItemResponse> toCampaignItemResponses(List<CampaignItem> items);

    @Mapping(target = "deliveryRate", ignore = true)
    @Mapping(target = "openRate", ignore = true)
    VariantStatsResponse toVariantStatsResponse(CampaignVariant variant);

    List<VariantStatsResponse> toVariantStatsResponses(List<CampaignVariant> variants);

    @AfterMapping
    default void calculateRates(@MappingTarget VariantStatsResponse stats, CampaignVariant source) {
        stats.setDeliveryRate(percent(source.getSent() - source.getFailed(), source.getSent()));
        stats.setOpenRate(percent(source.getReadCount(), source.getSent()));
    }

    /**
     * Delivered is sent minus failed; every rate is relative to sent.
     */
    default CampaignAnalytics toAnalytics(Campaign campaign) {
        int sent = campaign.getTotalSent();
        int delivered = Math.max(sent - campaign.getTotalFailed(), 0);
        return CampaignAnalytics.builder()
                .totalContacts(campaign.getTotalContacts())
                .sent(sent)
                .delivered(delivered)
                .failed(campaign.getTotalFailed())
                .read(campaign.getReadCount())
                .responses(campaign.getResponseCount())
                .conversions(campaign.getConversionCount())
                .deliveryRate(percent(delivered, sent))
                .openRate(percent(campaign.getReadCount(), sent))
                .responseRate(percent(campaign.getResponseCount(), sent))
                .conversionRate(percent(campaign.getConversionCount(), sent))
                .build();
    }

    // Percentage with one decimal; 0 when nothing was sent.
    static double percent(int part, int whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return Math.round(part * 1000.0 / whole) / 10.0;
    }
}
