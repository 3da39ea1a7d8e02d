package com.example.campaign.admin.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class VariantStatsResponse {
    private String variantLetter;
    private Long templateId;
    private int splitPercent;
    private int sent;
    private int delivered;
    private int readCount;
    private int failed;
    private double deliveryRate;
    private double openRate;
}
