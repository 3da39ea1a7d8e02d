package com.example.campaign.admin.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Summary of one scheduler sweep over due campaigns.
 */
@Data
@Builder
public class SweepResult {
    private int due;
    private int launched;
    private int failed;
    private int skipped;
}
