package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One arm of an A/B test. Split percentages act as cumulative thresholds in letter order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("campaign_variants")
public class CampaignVariant {
    @Id
    private Long id;
    private Long campaignId;
    private String variantLetter;
    private Long templateId;
    private int splitPercent;
    @Builder.Default
    private int sent = 0;
    @Builder.Default
    private int delivered = 0;
    @Builder.Default
    private int readCount = 0;
    @Builder.Default
    private int failed = 0;
    private OffsetDateTime createdAt;
}
