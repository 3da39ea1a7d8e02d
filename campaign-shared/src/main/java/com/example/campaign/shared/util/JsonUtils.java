package com.example.campaign.shared.util;

import com.example.campaign.shared.model.TargetFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility class for the JSON columns of the campaign tables.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {}

    /**
     * Parses the {@code target_filter} column.
     *
     * @param json The stored JSON object.
     * @return The parsed filter, or an empty filter if the input is null/blank or unreadable.
     */
    public static TargetFilter parseTargetFilter(String json) {
        if (json == null || json.trim().isEmpty()) {
            return TargetFilter.empty();
        }
        try {
            return objectMapper.readValue(json, TargetFilter.class);
        } catch (Exception e) {
            log.warn("Failed to parse target filter JSON: {}", json, e);
            return TargetFilter.empty();
        }
    }

    /**
     * Serializes a filter for storage. A null filter is stored as an empty JSON object.
     */
    public static String toJson(TargetFilter filter) {
        if (filter == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(filter);
        } catch (Exception e) {
            log.error("Failed to serialize target filter {}", filter, e);
            return "{}";
        }
    }
}
