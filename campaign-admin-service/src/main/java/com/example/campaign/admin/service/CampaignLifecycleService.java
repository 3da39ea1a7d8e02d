package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.LaunchResult;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.dto.DispatchJob;
import com.example.campaign.shared.exception.CampaignValidationException;
import com.example.campaign.shared.exception.DispatchQueueException;
import com.example.campaign.shared.exception.EmptyAudienceException;
import com.example.campaign.shared.exception.LaunchAbortedException;
import com.example.campaign.shared.exception.LaunchClaimLostException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.model.AudienceMember;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignVariant;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.util.Constants;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import com.example.campaign.shared.util.Constants.LaunchTrigger;
import com.example.campaign.shared.util.Constants.RecurrenceType;
import com.example.campaign.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The campaign state machine: DRAFT -> SCHEDULED -> PROCESSING -> COMPLETED | FAILED,
 * plus PROCESSING -> SCHEDULED when a recurring campaign is re-armed.
 *
 * Every transition is a conditional write against the expected status. A launch claims
 * the campaign (status := PROCESSING) before any ledger entry is created, so two launches
 * racing for the same campaign cannot both fan out.
 */
@Service
@Slf4j
@Monitored("lifecycle")
public class CampaignLifecycleService {

    enum RecipientOutcome { QUEUED, SKIPPED, FAILED }

    private final CampaignRepository campaignRepository;
    private final AudienceResolver audienceResolver;
    private final VariantAssigner variantAssigner;
    private final DispatchLedgerService dispatchLedgerService;
    private final DispatchJobProducer dispatchJobProducer;
    private final DispatchPlanService dispatchPlanService;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Clock clock;
    private final Executor dispatchExecutor;

    public CampaignLifecycleService(CampaignRepository campaignRepository,
                                    AudienceResolver audienceResolver,
                                    VariantAssigner variantAssigner,
                                    DispatchLedgerService dispatchLedgerService,
                                    DispatchJobProducer dispatchJobProducer,
                                    DispatchPlanService dispatchPlanService,
                                    MonitoringConfig.CampaignMetricsCollector metricsCollector,
                                    Clock clock,
                                    @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        this.campaignRepository = campaignRepository;
        this.audienceResolver = audienceResolver;
        this.variantAssigner = variantAssigner;
        this.dispatchLedgerService = dispatchLedgerService;
        this.dispatchJobProducer = dispatchJobProducer;
        this.dispatchPlanService = dispatchPlanService;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Launches a DRAFT campaign now. An empty audience leaves the campaign in DRAFT.
     *
     * @throws ResourceNotFoundException    if the campaign does not exist for the tenant
     * @throws CampaignValidationException  if the campaign is not a sendable DRAFT
     * @throws EmptyAudienceException       if no eligible contact matches the filter
     */
    public LaunchResult launch(String tenantId, Long campaignId) {
        Campaign campaign = campaignRepository.findByIdAndTenantId(campaignId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
        return launch(campaign, CampaignStatus.DRAFT, LaunchTrigger.INTERACTIVE);
    }

    /**
     * Launches a due SCHEDULED campaign on behalf of the scheduler. The caller decides what
     * an exception means for the campaign's status.
     *
     * @throws LaunchAbortedException if the launch failed after claiming the campaign
     */
    public LaunchResult launchScheduled(Campaign campaign) {
        return launch(campaign, CampaignStatus.SCHEDULED, LaunchTrigger.SCHEDULER);
    }

    public Campaign schedule(String tenantId, Long campaignId, OffsetDateTime scheduledAt, String recurrence) {
        Campaign campaign = campaignRepository.findByIdAndTenantId(campaignId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
        if (!CampaignStatus.DRAFT.name().equals(campaign.getStatus())) {
            throw new CampaignValidationException("Only DRAFT campaigns can be scheduled; campaign " + campaignId + " is " + campaign.getStatus());
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (scheduledAt == null || !scheduledAt.isAfter(now)) {
            throw new CampaignValidationException("Scheduled time must be in the future");
        }
        RecurrenceType recurrenceType = RecurrenceType.fromValue(recurrence);
        OffsetDateTime scheduledAtUtc = scheduledAt.withOffsetSameInstant(ZoneOffset.UTC);
        if (campaignRepository.schedule(campaignId, tenantId, scheduledAtUtc, recurrenceType.name(), now) == 0) {
            throw new CampaignValidationException("Campaign " + campaignId + " changed status while being scheduled");
        }
        log.info("Campaign {} scheduled for {} (recurrence {})", campaignId, scheduledAtUtc, recurrenceType);
        return reload(campaignId);
    }

    public Campaign cancelSchedule(String tenantId, Long campaignId) {
        Campaign campaign = campaignRepository.findByIdAndTenantId(campaignId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
        if (!CampaignStatus.SCHEDULED.name().equals(campaign.getStatus())) {
            throw new CampaignValidationException("Only SCHEDULED campaigns can be cancelled; campaign " + campaignId + " is " + campaign.getStatus());
        }
        if (campaignRepository.cancelSchedule(campaignId, tenantId, OffsetDateTime.now(clock)) == 0) {
            throw new CampaignValidationException("Campaign " + campaignId + " was launched before the schedule could be cancelled");
        }
        log.info("Schedule of campaign {} cancelled; back to DRAFT", campaignId);
        return reload(campaignId);
    }

    private LaunchResult launch(Campaign campaign, CampaignStatus expectedStatus, LaunchTrigger trigger) {
        long startTime = System.currentTimeMillis();
        Long campaignId = campaign.getId();
        if (!expectedStatus.name().equals(campaign.getStatus())) {
            throw new CampaignValidationException("Campaign " + campaignId + " must be " + expectedStatus + " to launch but is " + campaign.getStatus());
        }

        DispatchPlan plan = dispatchPlanService.planFor(campaign);
        List<AudienceMember> audience = audienceResolver.resolve(campaign.getTenantId(), JsonUtils.parseTargetFilter(campaign.getTargetFilter()));
        if (audience.isEmpty()) {
            throw new EmptyAudienceException(campaignId);
        }

        if (campaignRepository.claimForLaunch(campaignId, expectedStatus.name(), audience.size(), OffsetDateTime.now(clock)) == 0) {
            throw new LaunchClaimLostException(campaignId, expectedStatus.name());
        }
        log.info("Campaign {} is PROCESSING ({} trigger, {} recipients)", campaignId, trigger, audience.size());

        try {
            return dispatchClaimed(campaign, plan, audience, trigger, startTime);
        } catch (RuntimeException e) {
            throw new LaunchAbortedException(campaignId, e);
        }
    }

    private LaunchResult dispatchClaimed(Campaign campaign, DispatchPlan plan, List<AudienceMember> audience,
                                         LaunchTrigger trigger, long startTime) {
        Long campaignId = campaign.getId();
        Map<RecipientOutcome, Long> outcomes = dispatchAll(plan, audience);

        OffsetDateTime nextRunAt = null;
        RecurrenceType recurrence = RecurrenceType.fromValue(campaign.getRecurrenceType());
        if (recurrence != RecurrenceType.NONE) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            nextRunAt = recurrence.nextRun(now);
            if (campaignRepository.rearmRecurring(campaignId, nextRunAt, now) == 1) {
                log.info("Recurring campaign {} re-armed for {}", campaignId, nextRunAt);
            } else {
                log.warn("Recurring campaign {} left PROCESSING before it could be re-armed", campaignId);
                nextRunAt = null;
            }
        }

        LaunchResult result = LaunchResult.builder()
                .campaignId(campaignId)
                .trigger(trigger.name())
                .recipients(audience.size())
                .queued(outcomes.getOrDefault(RecipientOutcome.QUEUED, 0L).intValue())
                .skippedDuplicates(outcomes.getOrDefault(RecipientOutcome.SKIPPED, 0L).intValue())
                .failed(outcomes.getOrDefault(RecipientOutcome.FAILED, 0L).intValue())
                .nextRunAt(nextRunAt)
                .build();

        metricsCollector.incrementCounter(MonitoringConfig.CAMPAIGNS_LAUNCHED, "trigger", trigger.name(), "status", "success");
        metricsCollector.incrementCounter(MonitoringConfig.RECIPIENTS_SKIPPED, result.getSkippedDuplicates());
        metricsCollector.recordTimer("campaign.launch.latency", System.currentTimeMillis() - startTime);
        log.info("Campaign {} launched: {} queued, {} already dispatched, {} failed", campaignId,
                result.getQueued(), result.getSkippedDuplicates(), result.getFailed());
        return result;
    }

    private Map<RecipientOutcome, Long> dispatchAll(DispatchPlan plan, List<AudienceMember> audience) {
        List<CompletableFuture<RecipientOutcome>> futures = audience.stream()
                .map(member -> CompletableFuture.supplyAsync(() -> dispatchOne(plan, member), dispatchExecutor))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    /**
     * Assign, record, enqueue. Never throws: a failure is logged and only affects this recipient.
     */
    private RecipientOutcome dispatchOne(DispatchPlan plan, AudienceMember member) {
        Long campaignId = plan.campaign().getId();
        try {
            String variantLetter = plan.isAbTest()
                    ? variantAssigner.assign(plan.variants()).map(CampaignVariant::getVariantLetter).orElse(null)
                    : null;
            DispatchLedgerService.LedgerEntry entry = dispatchLedgerService.createIfAbsent(campaignId, member.getContactId(), variantLetter);
            if (!entry.created()) {
                return RecipientOutcome.SKIPPED;
            }
            Long itemId = entry.item().getId();
            DispatchJob job = dispatchPlanService.jobFor(plan, itemId, variantLetter, member.getPhone(), member.getName());
            try {
                dispatchJobProducer.enqueue(job);
                return RecipientOutcome.QUEUED;
            } catch (DispatchQueueException e) {
                log.warn("Enqueue failed for item {} of campaign {}: {}", itemId, campaignId, e.getMessage());
                dispatchLedgerService.markFailed(itemId, Constants.ItemErrorCode.ENQUEUE_FAILED, e.getMessage());
                return RecipientOutcome.FAILED;
            }
        } catch (RuntimeException e) {
            log.warn("Dispatch failed for contact {} of campaign {}", member.getContactId(), campaignId, e);
            return RecipientOutcome.FAILED;
        }
    }

    private Campaign reload(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign not found with ID: " + campaignId));
    }
}
