package com.example.campaign.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One send job on the dispatch queue, consumed by the sender process. The sender
 * deduplicates on {@code campaignItemId}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class DispatchJob {
    private String type;
    private Long campaignItemId;
    private Long campaignId;
    private String tenantId;
    private String phone;
    private String contactName;
    private String templateName;
    private String templateLanguage;
    private String variantLetter;
    /** Extra sender input such as media or catalog references. */
    private Map<String, Object> payload;
}
