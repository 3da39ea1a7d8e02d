package com.example.campaign.admin.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of re-driving a campaign's failed enqueues. {@code skipped} counts items whose
 * contact opted out or no longer exists.
 */
@Data
@Builder
public class RedriveResult {
    private Long campaignId;
    private int candidates;
    private int requeued;
    private int skipped;
    private int failed;
    private List<Long> failedItemIds;
}
