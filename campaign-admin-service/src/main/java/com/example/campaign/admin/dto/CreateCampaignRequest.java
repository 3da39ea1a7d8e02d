package com.example.campaign.admin.dto;

import com.example.campaign.shared.dto.CorrelatedRequest;
import com.example.campaign.shared.model.TargetFilter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Campaign creation request. A single-template campaign sets {@code templateId}; an A/B
 * campaign sets {@code abTestEnabled} and lists 2 or 3 variants, lettered A, B, C in order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCampaignRequest implements CorrelatedRequest {

    private String correlationId;

    @NotBlank(message = "Campaign name is required")
    private String name;

    private Long templateId;

    @Builder.Default
    private boolean abTestEnabled = false;

    private TargetFilter targetFilter;

    @Valid
    @Size(max = 3, message = "At most 3 variants are allowed")
    private List<VariantRequest> variants;
}
