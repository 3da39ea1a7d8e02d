package com.example.campaign.admin.service;

import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.model.AudienceMember;
import com.example.campaign.shared.model.TargetFilter;
import com.example.campaign.shared.repository.ContactAudienceRepository;
import com.example.campaign.shared.repository.criteria.ContactSpecification;
import com.example.campaign.shared.repository.criteria.ContactSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Turns a campaign's target filter into its eligible contacts. Preview and launch share
 * the same predicate, so a preview count always matches what a launch at the same instant
 * would fan out to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("audience")
public class AudienceResolver {

    private final ContactAudienceRepository contactAudienceRepository;
    private final Clock clock;

    public List<AudienceMember> resolve(String tenantId, TargetFilter filter) {
        ContactSpecification specification = specificationFor(tenantId, filter);
        List<AudienceMember> members = contactAudienceRepository.findMembers(specification);
        log.info("Resolved {} eligible contacts for tenant {}", members.size(), tenantId);
        return members;
    }

    public long count(String tenantId, TargetFilter filter) {
        return contactAudienceRepository.count(specificationFor(tenantId, filter));
    }

    private ContactSpecification specificationFor(String tenantId, TargetFilter filter) {
        return ContactSpecifications.matching(tenantId, filter, OffsetDateTime.now(clock));
    }
}
