package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.LaunchResult;
import com.example.campaign.admin.dto.SweepResult;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.exception.EmptyAudienceException;
import com.example.campaign.shared.exception.LaunchAbortedException;
import com.example.campaign.shared.exception.LaunchClaimLostException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.util.Constants.CampaignStatus;
import com.example.campaign.shared.util.Constants.LaunchTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Periodic sweep that launches due SCHEDULED campaigns. Each campaign is launched in its
 * own failure boundary: a campaign that cannot be launched is marked FAILED and the sweep
 * moves on. {@link #processDueCampaigns()} can be called directly with a controlled clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("scheduler")
public class CampaignSchedulingService {

    private final CampaignRepository campaignRepository;
    private final CampaignLifecycleService campaignLifecycleService;
    private final AppProperties appProperties;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Clock clock;

    @Scheduled(fixedRateString = "${campaign.scheduler.interval-ms:60000}")
    @SchedulerLock(name = "processDueCampaigns", lockAtMostFor = "PT10M")
    public void scheduledSweep() {
        SweepResult result = processDueCampaigns();
        if (result.getDue() > 0) {
            log.info("Scheduler sweep: {} due, {} launched, {} failed, {} skipped",
                    result.getDue(), result.getLaunched(), result.getFailed(), result.getSkipped());
        }
    }

    public SweepResult processDueCampaigns() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Campaign> due = campaignRepository.findDueScheduledCampaigns(now, appProperties.getScheduler().getBatchLimit());
        int launched = 0;
        int failed = 0;
        int skipped = 0;

        for (Campaign campaign : due) {
            try {
                LaunchResult result = campaignLifecycleService.launchScheduled(campaign);
                launched++;
                log.info("Scheduled campaign {} launched with {} jobs queued", campaign.getId(), result.getQueued());
            } catch (LaunchClaimLostException e) {
                skipped++;
                log.info("Skipping campaign {}: {}", campaign.getId(), e.getMessage());
            } catch (EmptyAudienceException e) {
                failed++;
                log.warn("Scheduled campaign {} has no eligible recipients; marking FAILED", campaign.getId());
                markFailed(campaign, CampaignStatus.SCHEDULED);
            } catch (LaunchAbortedException e) {
                failed++;
                log.error("Scheduled launch of campaign {} failed after its claim; marking FAILED", campaign.getId(), e);
                markFailed(campaign, CampaignStatus.PROCESSING);
            } catch (Exception e) {
                failed++;
                log.error("Scheduled launch of campaign {} failed; marking FAILED", campaign.getId(), e);
                markFailed(campaign, CampaignStatus.SCHEDULED);
            }
        }

        return SweepResult.builder()
                .due(due.size())
                .launched(launched)
                .failed(failed)
                .skipped(skipped)
                .build();
    }

    // PROCESSING is only expected when this sweep's own claim succeeded; a campaign another
    // instance claimed is left to that instance.
    private void markFailed(Campaign campaign, CampaignStatus expectedStatus) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            int updated = campaignRepository.transitionStatus(campaign.getId(), expectedStatus.name(), CampaignStatus.FAILED.name(), now);
            if (updated == 0) {
                log.warn("Campaign {} changed status concurrently and was not marked FAILED", campaign.getId());
                return;
            }
            metricsCollector.incrementCounter(MonitoringConfig.CAMPAIGNS_LAUNCHED, "trigger", LaunchTrigger.SCHEDULER.name(), "status", "failed");
        } catch (DataAccessException e) {
            log.error("Could not mark campaign {} FAILED", campaign.getId(), e);
        }
    }
}
