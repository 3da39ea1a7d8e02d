package com.example.campaign.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.MappedCollection;
import org.springframework.data.relational.core.mapping.Table;

/**
 * CRM contact. The dispatch engine only reads contacts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("contacts")
public class Contact {
    @Id
    private Long id;
    private String tenantId;
    private String phone;
    private String name;
    private String location;
    private String country;
    private OffsetDateTime lastInteraction;
    @Builder.Default
    private boolean optedOut = false;
    @Builder.Default
    @MappedCollection(idColumn = "contact_id")
    private Set<ContactTag> tags = new HashSet<>();
    private OffsetDateTime createdAt;
}
