package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.RedriveResult;
import com.example.campaign.shared.exception.DispatchQueueException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignItem;
import com.example.campaign.shared.model.Contact;
import com.example.campaign.shared.repository.CampaignItemRepository;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.ContactRepository;
import com.example.campaign.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-publishes the jobs of items whose enqueue failed after every retry. Each item is
 * moved back to QUEUED before publishing and returns to FAILED if publishing fails again.
 * Items whose contact has since opted out or been removed stay FAILED and are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchRedriveService {

    private final CampaignRepository campaignRepository;
    private final CampaignItemRepository campaignItemRepository;
    private final ContactRepository contactRepository;
    private final DispatchLedgerService dispatchLedgerService;
    private final DispatchPlanService dispatchPlanService;
    private final DispatchJobProducer dispatchJobProducer;

    public RedriveResult redriveFailedEnqueues(String tenantId, Long campaignId) {
        Campaign campaign = campaignRepository.findByIdAndTenantId(campaignId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
        List<CampaignItem> candidates = campaignItemRepository.findByCampaignIdAndStatusAndErrorCode(
                campaignId, Constants.ItemStatus.FAILED.name(), Constants.ItemErrorCode.ENQUEUE_FAILED.name());
        if (candidates.isEmpty()) {
            return RedriveResult.builder().campaignId(campaignId).failedItemIds(List.of()).build();
        }

        DispatchPlan plan = dispatchPlanService.planFor(campaign);
        int requeued = 0;
        int skipped = 0;
        List<Long> failedItemIds = new ArrayList<>();
        for (CampaignItem item : candidates) {
            Contact contact = contactRepository.findById(item.getContactId()).orElse(null);
            if (contact == null) {
                log.warn("Contact {} of item {} no longer exists; not re-driving", item.getContactId(), item.getId());
                skipped++;
                continue;
            }
            if (contact.isOptedOut()) {
                log.info("Contact {} of item {} opted out since the launch; not re-driving", contact.getId(), item.getId());
                skipped++;
                continue;
            }
            if (!dispatchLedgerService.requeue(item.getId())) {
                log.debug("Item {} is no longer a failed enqueue; skipping", item.getId());
                continue;
            }
            try {
                dispatchJobProducer.enqueue(dispatchPlanService.jobFor(plan, item.getId(), item.getVariantLetter(), contact.getPhone(), contact.getName()));
                requeued++;
            } catch (DispatchQueueException e) {
                log.warn("Re-drive of item {} failed again: {}", item.getId(), e.getMessage());
                dispatchLedgerService.markFailed(item.getId(), Constants.ItemErrorCode.ENQUEUE_FAILED, e.getMessage());
                failedItemIds.add(item.getId());
            }
        }

        log.info("Re-drove campaign {}: {} of {} failed enqueues queued again, {} skipped", campaignId, requeued, candidates.size(), skipped);
        return RedriveResult.builder()
                .campaignId(campaignId)
                .candidates(candidates.size())
                .requeued(requeued)
                .skipped(skipped)
                .failed(failedItemIds.size())
                .failedItemIds(failedItemIds)
                .build();
    }
}
