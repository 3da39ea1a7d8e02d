package com.example.campaign.admin.service;

import com.example.campaign.shared.model.CampaignVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VariantAssigner")
class VariantAssignerTest {

    private static CampaignVariant variant(String letter, int split) {
        return CampaignVariant.builder().variantLetter(letter).splitPercent(split).build();
    }

    private static final List<CampaignVariant> SIXTY_FORTY = List.of(variant("A", 60), variant("B", 40));

    @Test
    @DisplayName("draws are compared against cumulative thresholds in declaration order")
    void cumulativeThresholds() {
        assertEquals("A", new VariantAssigner(() -> 0.0).assign(SIXTY_FORTY).orElseThrow().getVariantLetter());
        assertEquals("A", new VariantAssigner(() -> 60.0).assign(SIXTY_FORTY).orElseThrow().getVariantLetter());
        assertEquals("B", new VariantAssigner(() -> 60.5).assign(SIXTY_FORTY).orElseThrow().getVariantLetter());
        assertEquals("B", new VariantAssigner(() -> 99.99).assign(SIXTY_FORTY).orElseThrow().getVariantLetter());
    }

    @Test
    @DisplayName("splits that add up to less than 100 leave the top of the range unassigned")
    void shortfallAssignsNothing() {
        List<CampaignVariant> variants = List.of(variant("A", 50), variant("B", 40));

        assertTrue(new VariantAssigner(() -> 95.0).assign(variants).isEmpty());
        assertEquals("B", new VariantAssigner(() -> 89.0).assign(variants).orElseThrow().getVariantLetter());
    }

    @Test
    @DisplayName("a variant with a zero split is never chosen")
    void zeroSplitIsSkipped() {
        List<CampaignVariant> variants = List.of(variant("A", 0), variant("B", 100));

        assertEquals("B", new VariantAssigner(() -> 0.0).assign(variants).orElseThrow().getVariantLetter());
    }

    @Test
    @DisplayName("no variants means no assignment")
    void noVariants() {
        assertEquals(Optional.empty(), new VariantAssigner().assign(List.of()));
        assertEquals(Optional.empty(), new VariantAssigner().assign(null));
    }

    @Test
    @DisplayName("10,000 random draws land within 3 points of a 50/30/20 split")
    void distributionFollowsSplits() {
        List<CampaignVariant> variants = List.of(variant("A", 50), variant("B", 30), variant("C", 20));
        VariantAssigner assigner = new VariantAssigner();
        Map<String, Integer> counts = new HashMap<>();

        int draws = 10_000;
        for (int i = 0; i < draws; i++) {
            assigner.assign(variants).ifPresent(v -> counts.merge(v.getVariantLetter(), 1, Integer::sum));
        }

        assertEquals(draws, counts.values().stream().mapToInt(Integer::intValue).sum());
        assertEquals(50.0, counts.get("A") * 100.0 / draws, 3.0);
        assertEquals(30.0, counts.get("B") * 100.0 / draws, 3.0);
        assertEquals(20.0, counts.get("C") * 100.0 / draws, 3.0);
    }
}
