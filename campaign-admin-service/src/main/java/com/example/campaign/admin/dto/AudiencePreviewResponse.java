package com.example.campaign.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AudiencePreviewResponse {
    private long count;
}
