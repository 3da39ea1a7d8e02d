package com.example.campaign.admin.dto;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Outcome of one launch. {@code skippedDuplicates} counts recipients that already had a
 * ledger entry; {@code nextRunAt} is set when a recurring campaign was re-armed.
 */
@Data
@Builder
public class LaunchResult {
    private Long campaignId;
    private String trigger;
    private int recipients;
    private int queued;
    private int skippedDuplicates;
    private int failed;
    private OffsetDateTime nextRunAt;
}
