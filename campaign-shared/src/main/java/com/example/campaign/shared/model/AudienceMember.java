package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Projection of an eligible contact carrying only what a send job needs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AudienceMember {
    private Long contactId;
    private String phone;
    private String name;
}
