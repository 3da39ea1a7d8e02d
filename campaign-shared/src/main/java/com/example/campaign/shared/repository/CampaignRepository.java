package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.Campaign;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Every status change is a conditional write guarded by the expected current status,
 * so the status column doubles as the launch mutex. Callers check the returned row count.
 */
@Repository
public interface CampaignRepository extends CrudRepository<Campaign, Long> {

    Optional<Campaign> findByIdAndTenantId(Long id, String tenantId);

    @Query("SELECT * FROM campaigns WHERE tenant_id = :tenantId ORDER BY created_at DESC")
    List<Campaign> findByTenantOrderedByCreatedAtDesc(@Param("tenantId") String tenantId);

    @Query("SELECT * FROM campaigns WHERE status = 'SCHEDULED' AND scheduled_at <= :now ORDER BY scheduled_at LIMIT :limit")
    List<Campaign> findDueScheduledCampaigns(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    /**
     * PROCESSING campaigns with nothing left QUEUED. A one-off campaign qualifies once every
     * recipient has an item; a recurring one is re-armed by its launch and only qualifies here
     * when its launch started before {@code staleBefore} and never re-armed it.
     */
    @Query("""
        SELECT c.* FROM campaigns c
        WHERE c.status = 'PROCESSING'
          AND NOT EXISTS (SELECT 1 FROM campaign_items i WHERE i.campaign_id = c.id AND i.status = 'QUEUED')
          AND (
                (COALESCE(c.recurrence_type, 'NONE') = 'NONE'
                 AND (SELECT COUNT(*) FROM campaign_items i WHERE i.campaign_id = c.id) >= c.total_contacts)
             OR c.started_at <= :staleBefore
          )
        ORDER BY c.started_at
        LIMIT :limit
    """)
    List<Campaign> findCompletableCampaigns(@Param("staleBefore") OffsetDateTime staleBefore, @Param("limit") int limit);

    @Modifying
    @Query("""
        UPDATE campaigns
        SET status = 'PROCESSING', total_contacts = :total, total_sent = 0, total_failed = 0,
            read_count = 0, response_count = 0, conversion_count = 0,
            started_at = :now, last_run_at = :now, completed_at = NULL, updated_at = :now
        WHERE id = :id AND status = :expectedStatus
    """)
    int claimForLaunch(@Param("id") Long id, @Param("expectedStatus") String expectedStatus,
                       @Param("total") int total, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE campaigns SET status = :newStatus, updated_at = :now WHERE id = :id AND status = :expectedStatus")
    int transitionStatus(@Param("id") Long id, @Param("expectedStatus") String expectedStatus,
                         @Param("newStatus") String newStatus, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE campaigns SET status = 'SCHEDULED', scheduled_at = :scheduledAt, recurrence_type = :recurrenceType, updated_at = :now
        WHERE id = :id AND tenant_id = :tenantId AND status = 'DRAFT'
    """)
    int schedule(@Param("id") Long id, @Param("tenantId") String tenantId, @Param("scheduledAt") OffsetDateTime scheduledAt,
                 @Param("recurrenceType") String recurrenceType, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE campaigns SET status = 'DRAFT', scheduled_at = NULL, recurrence_type = 'NONE', updated_at = :now
        WHERE id = :id AND tenant_id = :tenantId AND status = 'SCHEDULED'
    """)
    int cancelSchedule(@Param("id") Long id, @Param("tenantId") String tenantId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE campaigns SET status = 'SCHEDULED', scheduled_at = :nextRun, updated_at = :now WHERE id = :id AND status = 'PROCESSING'")
    int rearmRecurring(@Param("id") Long id, @Param("nextRun") OffsetDateTime nextRun, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE campaigns SET status = 'COMPLETED', completed_at = :now, updated_at = :now WHERE id = :id AND status = 'PROCESSING'")
    int markCompleted(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE campaigns SET target_filter = :targetFilter, total_contacts = :total, updated_at = :now
        WHERE id = :id AND tenant_id = :tenantId AND status = 'DRAFT'
    """)
    int updateTargetFilter(@Param("id") Long id, @Param("tenantId") String tenantId, @Param("targetFilter") String targetFilter,
                           @Param("total") int total, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE campaigns SET total_sent = total_sent + 1 WHERE id = :id")
    int incrementSent(@Param("id") Long id);

    @Modifying
    @Query("UPDATE campaigns SET total_failed = total_failed + :count WHERE id = :id")
    int incrementFailed(@Param("id") Long id, @Param("count") int count);

    @Modifying
    @Query("UPDATE campaigns SET read_count = read_count + 1 WHERE id = :id")
    int incrementRead(@Param("id") Long id);

    @Modifying
    @Query("UPDATE campaigns SET response_count = response_count + 1 WHERE id = :id")
    int incrementResponse(@Param("id") Long id);
}
