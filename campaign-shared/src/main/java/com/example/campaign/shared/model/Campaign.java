package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Tenant-owned marketing campaign. Either template-driven ({@code templateId} set,
 * no variants) or variant-driven ({@code abTestEnabled}, at least two variants, no template).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@Table("campaigns")
public class Campaign {
    @Id
    private Long id;
    private String tenantId;
    private String name;
    private String status;
    private Long templateId;
    @Builder.Default
    private boolean abTestEnabled = false;
    private String targetFilter;
    @Builder.Default
    private int totalContacts = 0;
    @Builder.Default
    private int totalSent = 0;
    @Builder.Default
    private int totalFailed = 0;
    @Builder.Default
    private int readCount = 0;
    @Builder.Default
    private int responseCount = 0;
    @Builder.Default
    private int conversionCount = 0;
    private OffsetDateTime scheduledAt;
    private String recurrenceType;
    private OffsetDateTime lastRunAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
