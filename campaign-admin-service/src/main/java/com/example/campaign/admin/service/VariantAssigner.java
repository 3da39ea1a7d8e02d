package com.example.campaign.admin.service;

import com.example.campaign.shared.model.CampaignVariant;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Weighted A/B assignment. Split percentages are accumulated in declaration order and a
 * uniform draw in [0, 100) picks the first variant whose cumulative threshold reaches it.
 * When the splits add up to less than 100 a draw above the last threshold assigns nothing.
 */
@Component
public class VariantAssigner {

    private final DoubleSupplier randomSource;

    public VariantAssigner() {
        this(() -> ThreadLocalRandom.current().nextDouble(100.0));
    }

    /**
     * @param randomSource supplies draws in [0, 100)
     */
    public VariantAssigner(DoubleSupplier randomSource) {
        this.randomSource = randomSource;
    }

    public Optional<CampaignVariant> assign(List<CampaignVariant> variants) {
        if (variants == null || variants.isEmpty()) {
            return Optional.empty();
        }
        double draw = randomSource.getAsDouble();
        int cumulative = 0;
        for (CampaignVariant variant : variants) {
            if (variant.getSplitPercent() <= 0) {
                continue;
            }
            cumulative += variant.getSplitPercent();
            if (draw <= cumulative) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }
}
