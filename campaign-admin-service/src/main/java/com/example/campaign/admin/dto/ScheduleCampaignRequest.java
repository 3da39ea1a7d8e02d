package com.example.campaign.admin.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleCampaignRequest {

    @NotNull(message = "scheduledAt is required")
    private OffsetDateTime scheduledAt;

    private String recurrenceType; // none, daily, weekly, monthly
}
