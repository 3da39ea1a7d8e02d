package com.example.campaign.admin.service;

import com.example.campaign.admin.dto.LaunchResult;
import com.example.campaign.admin.support.AbstractCampaignJdbcTest;
import com.example.campaign.shared.dto.DispatchJob;
import com.example.campaign.shared.exception.CampaignValidationException;
import com.example.campaign.shared.exception.EmptyAudienceException;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignItem;
import com.example.campaign.shared.model.CampaignVariant;
import com.example.campaign.shared.model.Contact;
import com.example.campaign.shared.model.MessageTemplate;
import com.example.campaign.shared.model.TargetFilter;
import com.example.campaign.shared.util.Constants;
import com.example.campaign.shared.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Interactive launch on H2")
class CampaignLaunchIntegrationTest extends AbstractCampaignJdbcTest {

    @Autowired
    private CampaignLifecycleService campaignLifecycleService;

    @Autowired
    private DispatchLedgerService dispatchLedgerService;

    @Test
    @DisplayName("a single-template launch records one QUEUED item and publishes one job per contact")
    void singleTemplateLaunch() {
        MessageTemplate template = template("spring_sale", "en");
        contact("+212600000001");
        contact("+212600000002");
        contact("+212600000003");
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.empty());

        LaunchResult result = campaignLifecycleService.launch(TENANT, campaign.getId());

        assertEquals(3, result.getRecipients());
        assertEquals(3, result.getQueued());
        assertEquals(0, result.getSkippedDuplicates());
        assertNull(result.getNextRunAt());

        Campaign launched = reload(campaign.getId());
        assertEquals(Constants.CampaignStatus.PROCESSING.name(), launched.getStatus());
        assertEquals(3, launched.getTotalContacts());
        assertNotNull(launched.getStartedAt());

        List<CampaignItem> items = items(campaign.getId());
        assertEquals(3, items.size());
        assertTrue(items.stream().allMatch(item -> Constants.ItemStatus.QUEUED.name().equals(item.getStatus())));
        assertTrue(items.stream().allMatch(item -> item.getVariantLetter() == null));

        List<DispatchJob> jobs = dispatchQueue.getPublished();
        assertEquals(3, jobs.size());
        DispatchJob job = jobs.get(0);
        assertEquals(Constants.JobType.CAMPAIGN_SEND.name(), job.getType());
        assertEquals("spring_sale", job.getTemplateName());
        assertEquals("en", job.getTemplateLanguage());
        assertEquals(TENANT, job.getTenantId());
        assertEquals(items.stream().map(CampaignItem::getId).collect(Collectors.toSet()),
                jobs.stream().map(DispatchJob::getCampaignItemId).collect(Collectors.toSet()));
    }

    @Test
    @DisplayName("a template without a language is sent in the default language")
    void defaultLanguage() {
        MessageTemplate template = template("promo", null);
        contact("+212600000001");
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.empty());

        campaignLifecycleService.launch(TENANT, campaign.getId());

        assertEquals("fr", dispatchQueue.getPublished().get(0).getTemplateLanguage());
    }

    @Test
    @DisplayName("a launched campaign cannot be launched again")
    void relaunchIsRejected() {
        MessageTemplate template = template("spring_sale", "en");
        contact("+212600000001");
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.empty());
        campaignLifecycleService.launch(TENANT, campaign.getId());

        assertThrows(CampaignValidationException.class, () -> campaignLifecycleService.launch(TENANT, campaign.getId()));

        assertEquals(1, dispatchQueue.getPublished().size());
        assertEquals(1, items(campaign.getId()).size());
    }

    @Test
    @DisplayName("an empty audience fails the launch and leaves the campaign in DRAFT")
    void emptyAudienceLeavesDraft() {
        MessageTemplate template = template("spring_sale", "en");
        contact("+212600000001", "new");
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.builder().tags(List.of("vip")).build());

        assertThrows(EmptyAudienceException.class, () -> campaignLifecycleService.launch(TENANT, campaign.getId()));

        assertEquals(Constants.CampaignStatus.DRAFT.name(), reload(campaign.getId()).getStatus());
        assertTrue(items(campaign.getId()).isEmpty());
        assertTrue(dispatchQueue.getPublished().isEmpty());
    }

    @Test
    @DisplayName("an A/B launch assigns every recipient a variant and sends that variant's template")
    void abLaunchUsesVariantTemplates() {
        MessageTemplate templateA = template("offer_a", "en");
        MessageTemplate templateB = template("offer_b", "en");
        for (int i = 0; i < 20; i++) {
            contact(String.format("+2126000001%02d", i));
        }
        Campaign campaign = campaignRepository.save(Campaign.builder()
                .tenantId(TENANT)
                .name("A/B offer")
                .status(Constants.CampaignStatus.DRAFT.name())
                .abTestEnabled(true)
                .targetFilter(JsonUtils.toJson(TargetFilter.empty()))
                .recurrenceType(Constants.RecurrenceType.NONE.name())
                .createdAt(now())
                .build());
        campaignVariantRepository.save(CampaignVariant.builder().campaignId(campaign.getId()).variantLetter("A").templateId(templateA.getId()).splitPercent(50).build());
        campaignVariantRepository.save(CampaignVariant.builder().campaignId(campaign.getId()).variantLetter("B").templateId(templateB.getId()).splitPercent(50).build());

        LaunchResult result = campaignLifecycleService.launch(TENANT, campaign.getId());

        assertEquals(20, result.getQueued());
        Map<String, String> templateByLetter = Map.of("A", "offer_a", "B", "offer_b");
        for (DispatchJob job : dispatchQueue.getPublished()) {
            assertTrue(Set.of("A", "B").contains(job.getVariantLetter()));
            assertEquals(templateByLetter.get(job.getVariantLetter()), job.getTemplateName());
        }
        assertTrue(items(campaign.getId()).stream().allMatch(item -> item.getVariantLetter() != null));
    }

    @Test
    @DisplayName("an A/B campaign with one resolvable variant is rejected before anything is claimed")
    void abLaunchNeedsTwoVariants() {
        MessageTemplate templateA = template("offer_a", "en");
        MessageTemplate foreignTemplate = messageTemplateRepository.save(MessageTemplate.builder()
                .tenantId("tenant-2")
                .name("offer_b")
                .language("en")
                .body("Hello {{1}}")
                .status("APPROVED")
                .createdAt(now())
                .build());
        contact("+212600000001");
        Campaign campaign = campaignRepository.save(Campaign.builder()
                .tenantId(TENANT)
                .name("Broken A/B")
                .status(Constants.CampaignStatus.DRAFT.name())
                .abTestEnabled(true)
                .targetFilter("{}")
                .recurrenceType(Constants.RecurrenceType.NONE.name())
                .build());
        campaignVariantRepository.save(CampaignVariant.builder().campaignId(campaign.getId()).variantLetter("A").templateId(templateA.getId()).splitPercent(50).build());
        campaignVariantRepository.save(CampaignVariant.builder().campaignId(campaign.getId()).variantLetter("B").templateId(foreignTemplate.getId()).splitPercent(50).build());

        assertThrows(CampaignValidationException.class, () -> campaignLifecycleService.launch(TENANT, campaign.getId()));

        assertEquals(Constants.CampaignStatus.DRAFT.name(), reload(campaign.getId()).getStatus());
    }

    @Test
    @DisplayName("a queue outage marks the items FAILED with ENQUEUE_FAILED instead of leaving them QUEUED")
    void enqueueFailureIsRecorded() {
        MessageTemplate template = template("spring_sale", "en");
        contact("+212600000001");
        contact("+212600000002");
        contact("+212600000003");
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.empty());
        dispatchQueue.setUnavailable(true);

        LaunchResult result = campaignLifecycleService.launch(TENANT, campaign.getId());

        assertEquals(0, result.getQueued());
        assertEquals(3, result.getFailed());
        assertEquals(9, dispatchQueue.getAttempts());
        List<CampaignItem> items = items(campaign.getId());
        assertTrue(items.stream().allMatch(item -> Constants.ItemStatus.FAILED.name().equals(item.getStatus())
                && Constants.ItemErrorCode.ENQUEUE_FAILED.name().equals(item.getErrorCode())));
        assertEquals(3, reload(campaign.getId()).getTotalFailed());
    }

    @Test
    @DisplayName("two simultaneous launches of one campaign fan out once")
    void concurrentLaunchesFanOutOnce() throws Exception {
        MessageTemplate template = template("spring_sale", "en");
        for (int i = 0; i < 5; i++) {
            contact("+21260000000" + i);
        }
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.empty());

        CountDownLatch start = new CountDownLatch(1);
        Callable<Boolean> launch = () -> {
            start.await();
            try {
                campaignLifecycleService.launch(TENANT, campaign.getId());
                return true;
            } catch (CampaignValidationException e) {
                return false;
            }
        };
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> first = callers.submit(launch);
            Future<Boolean> second = callers.submit(launch);
            start.countDown();
            int successes = (first.get(30, TimeUnit.SECONDS) ? 1 : 0) + (second.get(30, TimeUnit.SECONDS) ? 1 : 0);
            assertEquals(1, successes);
        } finally {
            callers.shutdownNow();
        }

        assertEquals(5, items(campaign.getId()).size());
        assertEquals(5, dispatchQueue.getPublished().size());
    }

    @Test
    @DisplayName("racing ledger inserts for one recipient create exactly one entry")
    void ledgerInsertRace() throws Exception {
        MessageTemplate template = template("spring_sale", "en");
        Contact contact = contact("+212600000001");
        Campaign campaign = draftCampaign(template.getId(), TargetFilter.empty());

        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        List<Future<DispatchLedgerService.LedgerEntry>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(callers.submit(() -> {
                    start.await();
                    return dispatchLedgerService.createIfAbsent(campaign.getId(), contact.getId(), null);
                }));
            }
            start.countDown();
            int created = 0;
            Set<Long> itemIds = new HashSet<>();
            for (Future<DispatchLedgerService.LedgerEntry> future : futures) {
                DispatchLedgerService.LedgerEntry entry = future.get(30, TimeUnit.SECONDS);
                created += entry.created() ? 1 : 0;
                itemIds.add(entry.item().getId());
            }
            assertEquals(1, created);
            assertEquals(1, itemIds.size());
        } finally {
            callers.shutdownNow();
        }
        assertEquals(1, campaignItemRepository.countByCampaignId(campaign.getId()));
    }
}
