package com.example.campaign.admin.service;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Moves PROCESSING campaigns to COMPLETED once none of their dispatch items is still QUEUED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignCompletionService {

    private final CampaignRepository campaignRepository;
    private final AppProperties appProperties;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${campaign.completion.interval-ms:30000}")
    @SchedulerLock(name = "completeFinishedCampaigns", lockAtMostFor = "PT5M")
    public void scheduledSweep() {
        completeFinishedCampaigns();
    }

    public int completeFinishedCampaigns() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime staleBefore = now.minus(Duration.ofMillis(appProperties.getCompletion().getStaleAfterMs()));
        List<Campaign> candidates = campaignRepository.findCompletableCampaigns(staleBefore, appProperties.getCompletion().getBatchLimit());

        int completed = 0;
        for (Campaign campaign : candidates) {
            if (campaignRepository.markCompleted(campaign.getId(), now) == 1) {
                completed++;
                metricsCollector.incrementCounter(MonitoringConfig.CAMPAIGNS_COMPLETED);
                log.info("Campaign {} COMPLETED ({} sent, {} failed)", campaign.getId(), campaign.getTotalSent(), campaign.getTotalFailed());
            }
        }
        return completed;
    }
}
