package com.example.campaign.admin.dto;

import com.example.campaign.shared.model.TargetFilter;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
public class CampaignResponse {
    private Long id;
    private String tenantId;
    private String name;
    private String status;
    private Long templateId;
    private boolean abTestEnabled;
    private TargetFilter targetFilter;
    private int totalContacts;
    private int totalSent;
    private int totalFailed;
    private int readCount;
    private int responseCount;
    private int conversionCount;
    private OffsetDateTime scheduledAt;
    private String recurrenceType;
    private OffsetDateTime lastRunAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
