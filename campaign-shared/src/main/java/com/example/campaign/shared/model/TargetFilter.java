package com.example.campaign.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Declarative audience predicate stored as JSON in {@code campaigns.target_filter}.
 * Every field is optional; the populated ones are combined with AND.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TargetFilter {

    /** Matches contacts carrying at least one of these tags. */
    private List<String> tags;

    /** Case-insensitive substring of the contact's location. */
    private String location;

    /** Country code, compared upper-cased. */
    private String country;

    @JsonProperty("last_interaction_days")
    private Integer lastInteractionDays;

    public static TargetFilter empty() {
        return new TargetFilter();
    }

    @JsonIgnore
    public boolean hasTags() {
        return tags != null && tags.stream().anyMatch(tag -> tag != null && !tag.isBlank());
    }

    @JsonIgnore
    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }

    @JsonIgnore
    public boolean hasCountry() {
        return country != null && !country.isBlank();
    }

    @JsonIgnore
    public boolean hasLastInteractionDays() {
        return lastInteractionDays != null && lastInteractionDays > 0;
    }
}
