package com.example.campaign.shared.repository.criteria;

import com.example.campaign.shared.model.TargetFilter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for the audience predicates. Preview counts and launches both go through
 * {@link #matching(String, TargetFilter, OffsetDateTime)} so the two can never disagree.
 */
public final class ContactSpecifications {

    private ContactSpecifications() {}

    public static ContactSpecification ofTenant(String tenantId) {
        return ContactSpecification.where("c.tenant_id = :tenantId", Map.of("tenantId", tenantId));
    }

    public static ContactSpecification notOptedOut() {
        return ContactSpecification.where("c.opted_out = FALSE", Map.of());
    }

    public static ContactSpecification hasAnyTag(List<String> tags) {
        List<String> cleaned = tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        if (cleaned.isEmpty()) {
            return ContactSpecification.all();
        }
        return ContactSpecification.where(
                "EXISTS (SELECT 1 FROM contact_tags t WHERE t.contact_id = c.id AND t.tag IN (:tags))",
                Map.of("tags", cleaned));
    }

    public static ContactSpecification locationContains(String location) {
        String needle = "%" + location.trim().toLowerCase(Locale.ROOT) + "%";
        return ContactSpecification.where("LOWER(c.location) LIKE :location", Map.of("location", needle));
    }

    public static ContactSpecification countryEquals(String country) {
        return ContactSpecification.where("c.country = :country", Map.of("country", country.trim().toUpperCase(Locale.ROOT)));
    }

    public static ContactSpecification interactedSince(OffsetDateTime since) {
        return ContactSpecification.where("c.last_interaction >= :interactedSince", Map.of("interactedSince", since));
    }

    /**
     * Eligible contacts of a tenant for the given filter. Blank fields are ignored and
     * {@code last_interaction_days} counts back from {@code now}.
     */
    public static ContactSpecification matching(String tenantId, TargetFilter filter, OffsetDateTime now) {
        ContactSpecification specification = ofTenant(tenantId).and(notOptedOut());
        if (filter == null) {
            return specification;
        }
        if (filter.hasTags()) {
            specification = specification.and(hasAnyTag(filter.getTags()));
        }
        if (filter.hasLocation()) {
            specification = specification.and(locationContains(filter.getLocation()));
        }
        if (filter.hasCountry()) {
            specification = specification.and(countryEquals(filter.getCountry()));
        }
        if (filter.hasLastInteractionDays()) {
            specification = specification.and(interactedSince(now.minusDays(filter.getLastInteractionDays())));
        }
        return specification;
    }
}
