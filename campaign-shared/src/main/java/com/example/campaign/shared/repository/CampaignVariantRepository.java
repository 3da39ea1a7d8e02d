package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.CampaignVariant;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CampaignVariantRepository extends CrudRepository<CampaignVariant, Long> {

    // Declaration order of the split thresholds
    List<CampaignVariant> findByCampaignIdOrderByVariantLetter(Long campaignId);

    @Modifying
    @Query("UPDATE campaign_variants SET sent = sent + 1 WHERE campaign_id = :campaignId AND variant_letter = :letter")
    int incrementSent(@Param("campaignId") Long campaignId, @Param("letter") String letter);

    @Modifying
    @Query("UPDATE campaign_variants SET delivered = delivered + 1 WHERE campaign_id = :campaignId AND variant_letter = :letter")
    int incrementDelivered(@Param("campaignId") Long campaignId, @Param("letter") String letter);

    @Modifying
    @Query("UPDATE campaign_variants SET read_count = read_count + 1 WHERE campaign_id = :campaignId AND variant_letter = :letter")
    int incrementRead(@Param("campaignId") Long campaignId, @Param("letter") String letter);

    @Modifying
    @Query("UPDATE campaign_variants SET failed = failed + 1 WHERE campaign_id = :campaignId AND variant_letter = :letter")
    int incrementFailed(@Param("campaignId") Long campaignId, @Param("letter") String letter);

    @Modifying
    @Query("UPDATE campaign_variants SET failed = failed - 1 WHERE campaign_id = :campaignId AND variant_letter = :letter AND failed > 0")
    int decrementFailed(@Param("campaignId") Long campaignId, @Param("letter") String letter);
}
