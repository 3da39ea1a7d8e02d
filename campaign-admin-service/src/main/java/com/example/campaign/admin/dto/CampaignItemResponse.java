package com.example.campaign.admin.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
public class CampaignItemResponse {
    private Long id;
    private Long contactId;
    private String variantLetter;
    private String status;
    private String errorCode;
    private String errorMessage;
    private OffsetDateTime queuedAt;
    private OffsetDateTime sentAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime readAt;
    private OffsetDateTime responseAt;
}
