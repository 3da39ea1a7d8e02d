package com.example.campaign.shared.util;

import java.time.OffsetDateTime;
import java.util.Arrays;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String TENANT_HEADER = "X-Tenant-ID";

    public static final int MAX_VARIANTS = 3;

    public static final int FULL_SPLIT_PERCENT = 100;

    public enum CampaignStatus {
        DRAFT,
        SCHEDULED,
        PROCESSING,
        COMPLETED,
        FAILED
    }

    public enum ItemStatus {
        QUEUED,
        SENT,
        DELIVERED,
        FAILED
    }

    public enum ItemErrorCode {
        ENQUEUE_FAILED,
        DELIVERY_FAILED
    }

    public enum JobType {
        CAMPAIGN_SEND
    }

    public enum LaunchTrigger {
        INTERACTIVE,
        SCHEDULER
    }

    public enum VariantLetter {
        A,
        B,
        C
    }

    public enum RecurrenceType {
        NONE,
        DAILY,
        WEEKLY,
        MONTHLY;

        /**
         * Next occurrence counted from {@code from}: one day, seven days or one calendar month later.
         * Returns null for {@link #NONE}.
         */
        public OffsetDateTime nextRun(OffsetDateTime from) {
            return switch (this) {
                case DAILY -> from.plusDays(1);
                case WEEKLY -> from.plusDays(7);
                case MONTHLY -> from.plusMonths(1);
                case NONE -> null;
            };
        }

        /**
         * Lenient parse used for user input: null, blank or unknown values fall back to NONE.
         */
        public static RecurrenceType fromValue(String value) {
            if (value == null || value.isBlank()) {
                return NONE;
            }
            return Arrays.stream(values())
                    .filter(type -> type.name().equalsIgnoreCase(value.trim()))
                    .findFirst()
                    .orElse(NONE);
        }
    }
}
