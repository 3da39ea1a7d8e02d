package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Approved WhatsApp message template, looked up by id when building send jobs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("templates")
public class MessageTemplate {
    @Id
    private Long id;
    private String tenantId;
    private String name;
    private String language;
    private String body;
    private String status;
    private OffsetDateTime createdAt;
}
