package com.example.campaign.admin.service;

import com.example.campaign.admin.support.AbstractCampaignJdbcTest;
import com.example.campaign.shared.model.AudienceMember;
import com.example.campaign.shared.model.Contact;
import com.example.campaign.shared.model.TargetFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AudienceResolver on H2")
class AudienceResolverIntegrationTest extends AbstractCampaignJdbcTest {

    @Autowired
    private AudienceResolver audienceResolver;

    @Test
    @DisplayName("a tag filter keeps tagged contacts of the tenant and never an opted-out one")
    void tagFilterExcludesOptedOutContacts() {
        Contact vip = contact("+212600000001", "vip");
        contact("+212600000002", "new");
        contact(Contact.builder().tenantId(TENANT).phone("+212600000003").name("Opted out").optedOut(true), "vip");
        contact(Contact.builder().tenantId("tenant-2").phone("+212600000004").name("Other tenant"), "vip");

        List<AudienceMember> members = audienceResolver.resolve(TENANT, TargetFilter.builder().tags(List.of("vip")).build());

        assertEquals(1, members.size());
        assertEquals(vip.getId(), members.get(0).getContactId());
        assertEquals("+212600000001", members.get(0).getPhone());
        assertEquals(1, audienceResolver.count(TENANT, TargetFilter.builder().tags(List.of("vip")).build()));
    }

    @Test
    @DisplayName("several tags match contacts carrying any of them, once each")
    void anyTagMatches() {
        contact("+212600000001", "vip", "new");
        contact("+212600000002", "new");
        contact("+212600000003", "churned");

        List<AudienceMember> members = audienceResolver.resolve(TENANT, TargetFilter.builder().tags(List.of("vip", "new")).build());

        assertEquals(List.of("+212600000001", "+212600000002"), members.stream().map(AudienceMember::getPhone).toList());
    }

    @Test
    @DisplayName("location is a case-insensitive substring and country an exact upper-cased match")
    void locationAndCountry() {
        contact(Contact.builder().tenantId(TENANT).phone("+212600000001").location("Casablanca Centre").country("MA"));
        contact(Contact.builder().tenantId(TENANT).phone("+212600000002").location("Rabat").country("MA"));
        contact(Contact.builder().tenantId(TENANT).phone("+33600000003").location("Casablanca").country("FR"));

        TargetFilter filter = TargetFilter.builder().location(" casablanca ").country("ma").build();

        List<AudienceMember> members = audienceResolver.resolve(TENANT, filter);

        assertEquals(List.of("+212600000001"), members.stream().map(AudienceMember::getPhone).toList());
    }

    @Test
    @DisplayName("the interaction window counts back from the injected clock")
    void lastInteractionWindow() {
        contact(Contact.builder().tenantId(TENANT).phone("+212600000001").lastInteraction(now().minusDays(10)));
        contact(Contact.builder().tenantId(TENANT).phone("+212600000002").lastInteraction(now().minusDays(40)));
        contact(Contact.builder().tenantId(TENANT).phone("+212600000003"));

        TargetFilter filter = TargetFilter.builder().lastInteractionDays(30).build();

        assertEquals(List.of("+212600000001"), audienceResolver.resolve(TENANT, filter).stream().map(AudienceMember::getPhone).toList());
        assertEquals(3, audienceResolver.count(TENANT, TargetFilter.empty()));
    }

    @Test
    @DisplayName("a filter nobody matches gives an empty audience")
    void emptyAudienceIsValid() {
        contact("+212600000001", "vip");

        assertTrue(audienceResolver.resolve(TENANT, TargetFilter.builder().tags(List.of("nobody")).build()).isEmpty());
    }
}
