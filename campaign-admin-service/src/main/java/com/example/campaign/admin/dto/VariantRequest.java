package com.example.campaign.admin.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantRequest {

    @NotNull(message = "Each variant needs a template")
    private Long templateId;

    // Omitted on every variant means an even split.
    @Min(value = 0, message = "Split percent cannot be negative")
    @Max(value = 100, message = "Split percent cannot exceed 100")
    private Integer splitPercent;
}
