package com.example.campaign.admin.controller;

import com.example.campaign.admin.dto.AudiencePreviewResponse;
import com.example.campaign.admin.dto.CampaignDetailResponse;
import com.example.campaign.admin.dto.CampaignItemResponse;
import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.CreateCampaignRequest;
import com.example.campaign.admin.dto.LaunchResult;
import com.example.campaign.admin.dto.RedriveResult;
import com.example.campaign.admin.dto.ScheduleCampaignRequest;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.admin.service.CampaignCreationService;
import com.example.campaign.admin.service.CampaignLifecycleService;
import com.example.campaign.admin.service.CampaignQueryService;
import com.example.campaign.admin.service.DispatchRedriveService;
import com.example.campaign.shared.model.TargetFilter;
import com.example.campaign.shared.util.Constants;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * Tenant-scoped campaign administration. Every handler runs its blocking JDBC work on the
 * {@code jdbcScheduler}.
 */
@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
@Slf4j
public class CampaignAdminController {

    private final CampaignCreationService campaignCreationService;
    private final CampaignQueryService campaignQueryService;
    private final CampaignLifecycleService campaignLifecycleService;
    private final DispatchRedriveService dispatchRedriveService;
    private final CampaignMapper campaignMapper;
    private final Scheduler jdbcScheduler;

    @PostMapping
    public Mono<ResponseEntity<CampaignResponse>> createCampaign(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateCampaignRequest request) {
        log.info("Received campaign creation request '{}' for tenant {}", request.getName(), tenantId);
        return Mono.fromCallable(() -> campaignCreationService.createCampaign(tenantId, request))
                .subscribeOn(jdbcScheduler)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @GetMapping
    public Mono<ResponseEntity<List<CampaignResponse>>> listCampaigns(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId) {
        return Mono.fromCallable(() -> campaignQueryService.listCampaigns(tenantId))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<CampaignDetailResponse>> getCampaign(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id) {
        return Mono.fromCallable(() -> campaignQueryService.getCampaign(tenantId, id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PutMapping("/{id}/filters")
    public Mono<ResponseEntity<CampaignResponse>> updateFilters(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id,
            @RequestBody TargetFilter filter) {
        log.info("Updating filters of campaign {} for tenant {}", id, tenantId);
        return Mono.fromCallable(() -> campaignCreationService.updateTargetFilter(tenantId, id, filter))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/preview-contacts")
    public Mono<ResponseEntity<AudiencePreviewResponse>> previewContacts(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId,
            @RequestBody(required = false) TargetFilter filter) {
        return Mono.fromCallable(() -> campaignQueryService.previewAudience(tenantId, filter))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/launch")
    @RateLimiter(name = "launchCampaignLimiter")
    public Mono<ResponseEntity<LaunchResult>> launchCampaign(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id) {
        log.info("Launch requested for campaign {} by tenant {}", id, tenantId);
        return Mono.fromCallable(() -> campaignLifecycleService.launch(tenantId, id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/schedule")
    public Mono<ResponseEntity<CampaignResponse>> scheduleCampaign(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id,
            @Valid @RequestBody ScheduleCampaignRequest request) {
        log.info("Scheduling campaign {} at {} ({})", id, request.getScheduledAt(), request.getRecurrenceType());
        return Mono.fromCallable(() -> campaignLifecycleService.schedule(tenantId, id, request.getScheduledAt(), request.getRecurrenceType()))
                .subscribeOn(jdbcScheduler)
                .map(campaignMapper::toCampaignResponse)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/cancel-schedule")
    public Mono<ResponseEntity<CampaignResponse>> cancelSchedule(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id) {
        log.info("Cancelling schedule of campaign {}", id);
        return Mono.fromCallable(() -> campaignLifecycleService.cancelSchedule(tenantId, id))
                .subscribeOn(jdbcScheduler)
                .map(campaignMapper::toCampaignResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/items")
    public Mono<ResponseEntity<List<CampaignItemResponse>>> listItems(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id,
            @RequestParam(defaultValue = "100") int limit) {
        return Mono.fromCallable(() -> campaignQueryService.listItems(tenantId, id, limit))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/redrive")
    public Mono<ResponseEntity<RedriveResult>> redriveFailedEnqueues(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId, @PathVariable Long id) {
        log.info("Re-driving failed enqueues of campaign {}", id);
        return Mono.fromCallable(() -> dispatchRedriveService.redriveFailedEnqueues(tenantId, id))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }
}
