package com.example.campaign.admin.support;

import com.example.campaign.admin.service.AudienceResolver;
import com.example.campaign.admin.service.CampaignCompletionService;
import com.example.campaign.admin.service.CampaignLifecycleService;
import com.example.campaign.admin.service.CampaignSchedulingService;
import com.example.campaign.admin.service.DispatchJobProducer;
import com.example.campaign.admin.service.DispatchLedgerService;
import com.example.campaign.admin.service.DispatchPlanService;
import com.example.campaign.admin.service.DispatchRedriveService;
import com.example.campaign.admin.service.VariantAssigner;
import com.example.campaign.shared.config.JdbcConfig;
import com.example.campaign.shared.config.PropertiesConfig;
import com.example.campaign.shared.model.Campaign;
import com.example.campaign.shared.model.CampaignItem;
import com.example.campaign.shared.model.Contact;
import com.example.campaign.shared.model.ContactTag;
import com.example.campaign.shared.model.MessageTemplate;
import com.example.campaign.shared.model.TargetFilter;
import com.example.campaign.shared.repository.CampaignItemRepository;
import com.example.campaign.shared.repository.CampaignRepository;
import com.example.campaign.shared.repository.CampaignVariantRepository;
import com.example.campaign.shared.repository.ContactAudienceRepository;
import com.example.campaign.shared.repository.ContactRepository;
import com.example.campaign.shared.repository.MessageTemplateRepository;
import com.example.campaign.shared.util.Constants;
import com.example.campaign.shared.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base for tests running the dispatch engine against the embedded H2 schema. Transactions
 * are not rolled back because launches write from the dispatch pool threads; every table is
 * emptied before each test instead. The application's H2 datasource is kept so that its
 * lower-case identifier settings match the quoted table names Spring Data JDBC generates.
 */
@DataJdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({
        CampaignTestConfig.class,
        PropertiesConfig.class,
        JdbcConfig.class,
        CampaignItemRepository.class,
        ContactAudienceRepository.class,
        AudienceResolver.class,
        VariantAssigner.class,
        DispatchLedgerService.class,
        DispatchJobProducer.class,
        DispatchPlanService.class,
        CampaignLifecycleService.class,
        CampaignSchedulingService.class,
        CampaignCompletionService.class,
        DispatchRedriveService.class
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
public abstract class AbstractCampaignJdbcTest {

    protected static final String TENANT = "tenant-1";

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected InMemoryDispatchQueue dispatchQueue;

    @Autowired
    protected CampaignRepository campaignRepository;

    @Autowired
    protected CampaignVariantRepository campaignVariantRepository;

    @Autowired
    protected CampaignItemRepository campaignItemRepository;

    @Autowired
    protected ContactRepository contactRepository;

    @Autowired
    protected MessageTemplateRepository messageTemplateRepository;

    @BeforeEach
    void resetDatabase() {
        jdbcTemplate.update("DELETE FROM campaign_items");
        jdbcTemplate.update("DELETE FROM campaign_variants");
        jdbcTemplate.update("DELETE FROM campaigns");
        jdbcTemplate.update("DELETE FROM contact_tags");
        jdbcTemplate.update("DELETE FROM contacts");
        jdbcTemplate.update("DELETE FROM templates");
        clock.setInstant(CampaignTestConfig.START);
        dispatchQueue.reset();
    }

    protected OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    protected MessageTemplate template(String name, String language) {
        return messageTemplateRepository.save(MessageTemplate.builder()
                .tenantId(TENANT)
                .name(name)
                .language(language)
                .body("Hello {{1}}")
                .status("APPROVED")
                .createdAt(now())
                .build());
    }

    protected Contact contact(String phone, String... tags) {
        return contact(Contact.builder().tenantId(TENANT).phone(phone).name("Contact " + phone), tags);
    }

    protected Contact contact(Contact.ContactBuilder builder, String... tags) {
        Contact contact = builder
                .tags(Arrays.stream(tags).map(ContactTag::new).collect(Collectors.toSet()))
                .createdAt(now())
                .build();
        return contactRepository.save(contact);
    }

    protected Campaign draftCampaign(Long templateId, TargetFilter filter) {
        return campaignRepository.save(Campaign.builder()
                .tenantId(TENANT)
                .name("Spring sale")
                .status(Constants.CampaignStatus.DRAFT.name())
                .templateId(templateId)
                .targetFilter(JsonUtils.toJson(filter))
                .recurrenceType(Constants.RecurrenceType.NONE.name())
                .createdAt(now())
                .updatedAt(now())
                .build());
    }

    protected Campaign reload(Long campaignId) {
        return campaignRepository.findById(campaignId).orElseThrow();
    }

    protected List<CampaignItem> items(Long campaignId) {
        return campaignItemRepository.findByCampaignId(campaignId, 1000);
    }
}
