package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Dispatch ledger row: one per (campaign, contact), tracking the delivery lifecycle
 * QUEUED -> SENT -> DELIVERED, or FAILED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignItem {
    private Long id;
    private Long campaignId;
    private Long contactId;
    private String variantLetter;
    private String status; // QUEUED, SENT, DELIVERED, FAILED
    private String errorCode; // ENQUEUE_FAILED, DELIVERY_FAILED
    private String errorMessage;
    private OffsetDateTime queuedAt;
    private OffsetDateTime sentAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime readAt;
    private OffsetDateTime responseAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
