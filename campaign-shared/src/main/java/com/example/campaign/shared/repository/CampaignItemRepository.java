package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.CampaignItem;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plain JDBC access to {@code campaign_items}. The UNIQUE(campaign_id, contact_id) constraint
 * makes {@link #insert(CampaignItem)} fail with a {@link org.springframework.dao.DuplicateKeyException}
 * for a recipient that already has an item.
 */
@Repository
@RequiredArgsConstructor
public class CampaignItemRepository {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<CampaignItem> campaignItemRowMapper = (rs, rowNum) -> CampaignItem.builder()
            .id(rs.getLong("id"))
            .campaignId(rs.getLong("campaign_id"))
            .contactId(rs.getLong("contact_id"))
            .variantLetter(rs.getString("variant_letter"))
            .status(rs.getString("status"))
            .errorCode(rs.getString("error_code"))
            .errorMessage(rs.getString("error_message"))
            .queuedAt(rs.getObject("queued_at", OffsetDateTime.class))
            .sentAt(rs.getObject("sent_at", OffsetDateTime.class))
            .deliveredAt(rs.getObject("delivered_at", OffsetDateTime.class))
            .readAt(rs.getObject("read_at", OffsetDateTime.class))
            .responseAt(rs.getObject("response_at", OffsetDateTime.class))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .build();

    /**
     * Inserts a new item and returns its generated id.
     */
    public Long insert(CampaignItem item) {
        String sql = """
            INSERT INTO campaign_items
            (campaign_id, contact_id, variant_letter, status, queued_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
            ps.setLong(1, item.getCampaignId());
            ps.setLong(2, item.getContactId());
            ps.setString(3, item.getVariantLetter());
            ps.setString(4, item.getStatus());
            ps.setObject(5, item.getQueuedAt());
            ps.setObject(6, item.getCreatedAt());
            ps.setObject(7, item.getCreatedAt());
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated key returned for campaign item of campaign " + item.getCampaignId());
        }
        return key.longValue();
    }

    public Optional<CampaignItem> findById(Long id) {
        String sql = "SELECT * FROM campaign_items WHERE id = ?";
        return jdbcTemplate.query(sql, campaignItemRowMapper, id).stream().findFirst();
    }

    public Optional<CampaignItem> findByCampaignIdAndContactId(Long campaignId, Long contactId) {
        String sql = "SELECT * FROM campaign_items WHERE campaign_id = ? AND contact_id = ?";
        return jdbcTemplate.query(sql, campaignItemRowMapper, campaignId, contactId).stream().findFirst();
    }

    public List<CampaignItem> findByCampaignId(Long campaignId, int limit) {
        String sql = "SELECT * FROM campaign_items WHERE campaign_id = ? ORDER BY sent_at DESC NULLS LAST, id LIMIT ?";
        return jdbcTemplate.query(sql, campaignItemRowMapper, campaignId, limit);
    }

    public List<CampaignItem> findByCampaignIdAndStatusAndErrorCode(Long campaignId, String status, String errorCode) {
        String sql = "SELECT * FROM campaign_items WHERE campaign_id = ? AND status = ? AND error_code = ? ORDER BY id";
        return jdbcTemplate.query(sql, campaignItemRowMapper, campaignId, status, errorCode);
    }

    public long countByCampaignId(Long campaignId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM campaign_items WHERE campaign_id = ?", Long.class, campaignId);
        return count == null ? 0 : count;
    }

    /**
     * Item count per status for one campaign, e.g. {QUEUED=3, SENT=10}.
     */
    public Map<String, Long> countByStatus(Long campaignId) {
        String sql = "SELECT status, COUNT(*) AS total FROM campaign_items WHERE campaign_id = ? GROUP BY status ORDER BY status";
        Map<String, Long> counts = new LinkedHashMap<>();
        RowCallbackHandler collector = rs -> counts.put(rs.getString("status"), rs.getLong("total"));
        jdbcTemplate.query(sql, collector, campaignId);
        return counts;
    }

    public int markSent(Long id, OffsetDateTime sentAt) {
        String sql = "UPDATE campaign_items SET status = 'SENT', sent_at = ?, updated_at = ? WHERE id = ? AND status = 'QUEUED'";
        return jdbcTemplate.update(sql, sentAt, sentAt, id);
    }

    public int markDelivered(Long id, OffsetDateTime deliveredAt) {
        String sql = "UPDATE campaign_items SET status = 'DELIVERED', delivered_at = ?, updated_at = ? WHERE id = ? AND status = 'SENT'";
        return jdbcTemplate.update(sql, deliveredAt, deliveredAt, id);
    }

    public int markFailed(Long id, String errorCode, String errorMessage, OffsetDateTime failedAt) {
        String sql = """
            UPDATE campaign_items SET status = 'FAILED', error_code = ?, error_message = ?, updated_at = ?
            WHERE id = ? AND status IN ('QUEUED', 'SENT')
            """;
        return jdbcTemplate.update(sql, errorCode, errorMessage, failedAt, id);
    }

    public int markRead(Long id, OffsetDateTime readAt) {
        String sql = "UPDATE campaign_items SET read_at = ?, updated_at = ? WHERE id = ? AND read_at IS NULL";
        return jdbcTemplate.update(sql, readAt, readAt, id);
    }

    public int markResponded(Long id, OffsetDateTime responseAt) {
        String sql = "UPDATE campaign_items SET response_at = ?, updated_at = ? WHERE id = ? AND response_at IS NULL";
        return jdbcTemplate.update(sql, responseAt, responseAt, id);
    }

    public int requeueFailedEnqueue(Long id, OffsetDateTime queuedAt) {
        String sql = """
            UPDATE campaign_items SET status = 'QUEUED', error_code = NULL, error_message = NULL, queued_at = ?, updated_at = ?
            WHERE id = ? AND status = 'FAILED' AND error_code = 'ENQUEUE_FAILED'
            """;
        return jdbcTemplate.update(sql, queuedAt, queuedAt, id);
    }
}
