package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.MessageTemplate;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MessageTemplateRepository extends CrudRepository<MessageTemplate, Long> {

    Optional<MessageTemplate> findByIdAndTenantId(Long id, String tenantId);
}
