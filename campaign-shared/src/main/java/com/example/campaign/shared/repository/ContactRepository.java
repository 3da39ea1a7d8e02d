package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.Contact;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContactRepository extends CrudRepository<Contact, Long> {

    Optional<Contact> findByTenantIdAndPhone(String tenantId, String phone);
}
