package com.example.campaign.admin.service;

import com.example.campaign.shared.model.CampaignItem;
import com.example.campaign.shared.repository.CampaignItemRepository;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.CampaignVariantRepository;
import com.example.campaign.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * The dispatch ledger: at most one {@link CampaignItem} per (campaign, contact). The
 * UNIQUE(campaign_id, contact_id) constraint decides which of two concurrent inserts wins,
 * so no lock is taken here. Every status change is a conditional update and the campaign
 * and variant counters move only when the update matched a row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchLedgerService {

    private final CampaignItemRepository campaignItemRepository;
    private final CampaignRepository campaignRepository;
    private final CampaignVariantRepository campaignVariantRepository;
    private final Clock clock;

    /**
     * Result of {@link #createIfAbsent}: the ledger row and whether this call inserted it.
     */
    public record LedgerEntry(CampaignItem item, boolean created) {}

    public LedgerEntry createIfAbsent(Long campaignId, Long contactId, String variantLetter) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        CampaignItem item = CampaignItem.builder()
                .campaignId(campaignId)
                .contactId(contactId)
                .variantLetter(variantLetter)
                .status(Constants.ItemStatus.QUEUED.name())
                .queuedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            item.setId(campaignItemRepository.insert(item));
            return new LedgerEntry(item, true);
        } catch (DuplicateKeyException e) {
            CampaignItem existing = campaignItemRepository.findByCampaignIdAndContactId(campaignId, contactId)
                    .orElseThrow(() -> new IllegalStateException(
                            "Duplicate ledger entry reported for campaign " + campaignId + " and contact " + contactId + " but none found", e));
            log.debug("Ledger entry {} already exists for campaign {} and contact {}", existing.getId(), campaignId, contactId);
            return new LedgerEntry(existing, false);
        }
    }

    @Transactional
    public boolean markSent(Long itemId) {
        return campaignItemRepository.findById(itemId)
                .filter(item -> campaignItemRepository.markSent(itemId, OffsetDateTime.now(clock)) == 1)
                .map(item -> {
                    campaignRepository.incrementSent(item.getCampaignId());
                    if (item.getVariantLetter() != null) {
                        campaignVariantRepository.incrementSent(item.getCampaignId(), item.getVariantLetter());
                    }
                    return true;
                })
                .orElse(false);
    }

    @Transactional
    public boolean markDelivered(Long itemId) {
        return campaignItemRepository.findById(itemId)
                .filter(item -> campaignItemRepository.markDelivered(itemId, OffsetDateTime.now(clock)) == 1)
                .map(item -> {
                    if (item.getVariantLetter() != null) {
                        campaignVariantRepository.incrementDelivered(item.getCampaignId(), item.getVariantLetter());
                    }
                    return true;
                })
                .orElse(false);
    }

    @Transactional
    public boolean markFailed(Long itemId, Constants.ItemErrorCode errorCode, String errorMessage) {
        return campaignItemRepository.findById(itemId)
                .filter(item -> campaignItemRepository.markFailed(itemId, errorCode.name(), truncate(errorMessage), OffsetDateTime.now(clock)) == 1)
                .map(item -> {
                    campaignRepository.incrementFailed(item.getCampaignId(), 1);
                    if (item.getVariantLetter() != null) {
                        campaignVariantRepository.incrementFailed(item.getCampaignId(), item.getVariantLetter());
                    }
                    return true;
                })
                .orElse(false);
    }

    @Transactional
    public boolean markRead(Long itemId) {
        return campaignItemRepository.findById(itemId)
                .filter(item -> campaignItemRepository.markRead(itemId, OffsetDateTime.now(clock)) == 1)
                .map(item -> {
                    campaignRepository.incrementRead(item.getCampaignId());
                    if (item.getVariantLetter() != null) {
                        campaignVariantRepository.incrementRead(item.getCampaignId(), item.getVariantLetter());
                    }
                    return true;
                })
                .orElse(false);
    }

    @Transactional
    public boolean markResponded(Long itemId) {
        return campaignItemRepository.findById(itemId)
                .filter(item -> campaignItemRepository.markResponded(itemId, OffsetDateTime.now(clock)) == 1)
                .map(item -> {
                    campaignRepository.incrementResponse(item.getCampaignId());
                    return true;
                })
                .orElse(false);
    }

    /**
     * Puts an item whose enqueue failed back to QUEUED and takes it out of the failed counters.
     */
    @Transactional
    public boolean requeue(Long itemId) {
        return campaignItemRepository.findById(itemId)
                .filter(item -> campaignItemRepository.requeueFailedEnqueue(itemId, OffsetDateTime.now(clock)) == 1)
                .map(item -> {
                    campaignRepository.incrementFailed(item.getCampaignId(), -1);
                    if (item.getVariantLetter() != null) {
                        campaignVariantRepository.decrementFailed(item.getCampaignId(), item.getVariantLetter());
                    }
                    return true;
                })
                .orElse(false);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1024) {
            return message;
        }
        return message.substring(0, 1024);
    }
}
