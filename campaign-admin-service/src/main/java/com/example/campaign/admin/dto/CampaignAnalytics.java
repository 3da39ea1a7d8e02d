package com.example.campaign.admin.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Campaign KPIs. Rates are percentages of sent messages, rounded to one decimal.
 */
@Data
@Builder
public class CampaignAnalytics {
    private int totalContacts;
    private int sent;
    private int delivered;
    private int failed;
    private int read;
    private int responses;
    private int conversions;
    private double deliveryRate;
    private double openRate;
    private double responseRate;
    private double conversionRate;
}
