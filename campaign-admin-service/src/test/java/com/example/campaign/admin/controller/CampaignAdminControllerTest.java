package com.example.campaign.admin.controller;

import com.example.campaign.admin.dto.CampaignResponse;
import com.example.campaign.admin.dto.CreateCampaignRequest;
import com.example.campaign.admin.dto.LaunchResult;
import com.example.campaign.admin.dto.RedriveResult;
import com.example.campaign.admin.mapper.CampaignMapper;
import com.example.campaign.admin.service.CampaignCreationService;
import com.example.campaign.admin.service.CampaignLifecycleService;
import com.example.campaign.admin.service.CampaignQueryService;
import com.example.campaign.admin.service.DispatchRedriveService;
import com.example.campaign.shared.exception.DispatchQueueException;
import com.example.campaign.shared.exception.EmptyAudienceException;
import com.example.campaign.shared.exception.ResourceNotFoundException;
import com.example.campaign.shared.util.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@WebFluxTest(CampaignAdminController.class)
class CampaignAdminControllerTest {

    private static final String TENANT = "tenant-1";

    @TestConfiguration
    static class SchedulerConfig {
        @Bean
        Scheduler jdbcScheduler() {
            return Schedulers.immediate();
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CampaignCreationService campaignCreationService;
    @MockBean
    private CampaignQueryService campaignQueryService;
    @MockBean
    private CampaignLifecycleService campaignLifecycleService;
    @MockBean
    private DispatchRedriveService dispatchRedriveService;
    @MockBean
    private CampaignMapper campaignMapper;

    @Test
    @DisplayName("POST /api/campaigns creates a draft and answers 201")
    void createCampaign() {
        CampaignResponse response = new CampaignResponse();
        response.setId(7L);
        response.setName("Spring sale");
        response.setStatus("DRAFT");
        when(campaignCreationService.createCampaign(eq(TENANT), any(CreateCampaignRequest.class))).thenReturn(response);

        webTestClient.post().uri("/api/campaigns")
                .header(Constants.TENANT_HEADER, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"Spring sale\",\"templateId\":5,\"targetFilter\":{\"tags\":[\"vip\"]}}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(7)
                .jsonPath("$.status").isEqualTo("DRAFT");
    }

    @Test
    @DisplayName("a blank campaign name is rejected before reaching the service")
    void createCampaignValidation() {
        webTestClient.post().uri("/api/campaigns")
                .header(Constants.TENANT_HEADER, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"\",\"templateId\":5}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Validation Failed");

        verifyNoInteractions(campaignCreationService);
    }

    @Test
    @DisplayName("requests without a tenant header are rejected")
    void missingTenantHeader() {
        webTestClient.get().uri("/api/campaigns")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(campaignQueryService);
    }

    @Test
    @DisplayName("an unknown campaign answers 404")
    void unknownCampaign() {
        when(campaignQueryService.getCampaign(TENANT, 99L)).thenThrow(new ResourceNotFoundException("Campaign not found with ID: 99"));

        webTestClient.get().uri("/api/campaigns/99")
                .header(Constants.TENANT_HEADER, TENANT)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Campaign not found with ID: 99")
                .jsonPath("$.path").isEqualTo("/api/campaigns/99");
    }

    @Test
    @DisplayName("a launch returns the per-recipient outcome counts")
    void launchCampaign() {
        when(campaignLifecycleService.launch(TENANT, 7L)).thenReturn(LaunchResult.builder()
                .campaignId(7L)
                .trigger("INTERACTIVE")
                .recipients(3)
                .queued(2)
                .failed(1)
                .build());

        webTestClient.post().uri("/api/campaigns/7/launch")
                .header(Constants.TENANT_HEADER, TENANT)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.queued").isEqualTo(2)
                .jsonPath("$.failed").isEqualTo(1);
    }

    @Test
    @DisplayName("launching a campaign with no eligible contacts answers 400")
    void launchWithEmptyAudience() {
        when(campaignLifecycleService.launch(TENANT, 7L)).thenThrow(new EmptyAudienceException(7L));

        webTestClient.post().uri("/api/campaigns/7/launch")
                .header(Constants.TENANT_HEADER, TENANT)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("No Recipients");
    }

    @Test
    @DisplayName("a re-drive during a queue outage answers 503")
    void redriveDuringOutage() {
        when(dispatchRedriveService.redriveFailedEnqueues(TENANT, 7L))
                .thenThrow(new DispatchQueueException("Redis push to marketing_queue failed", 12L, null));

        webTestClient.post().uri("/api/campaigns/7/redrive")
                .header(Constants.TENANT_HEADER, TENANT)
                .exchange()
                .expectStatus().isEqualTo(503);
    }

    @Test
    @DisplayName("a successful re-drive reports the requeued items")
    void redrive() {
        when(dispatchRedriveService.redriveFailedEnqueues(TENANT, 7L))
                .thenReturn(RedriveResult.builder().campaignId(7L).requeued(2).build());

        webTestClient.post().uri("/api/campaigns/7/redrive")
                .header(Constants.TENANT_HEADER, TENANT)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.requeued").isEqualTo(2);
    }

    @Test
    @DisplayName("a schedule without a timestamp is rejected")
    void scheduleValidation() {
        webTestClient.post().uri("/api/campaigns/7/schedule")
                .header(Constants.TENANT_HEADER, TENANT)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"recurrenceType\":\"daily\"}")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(campaignLifecycleService);
    }
}
