package com.example.campaign.shared.repository;

import com.example.campaign.shared.model.AudienceMember;
import com.example.campaign.shared.repository.criteria.ContactSpecification;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read-only audience queries over {@code contacts}, driven by a {@link ContactSpecification}.
 */
@Repository
@RequiredArgsConstructor
public class ContactAudienceRepository {

    private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

    private final RowMapper<AudienceMember> audienceMemberRowMapper = (rs, rowNum) -> AudienceMember.builder()
            .contactId(rs.getLong("id"))
            .phone(rs.getString("phone"))
            .name(rs.getString("name"))
            .build();

    public List<AudienceMember> findMembers(ContactSpecification specification) {
        String sql = "SELECT c.id, c.phone, c.name FROM contacts c WHERE " + specification.toSql() + " ORDER BY c.id";
        return namedParameterJdbcTemplate.query(sql, specification.getParameters(), audienceMemberRowMapper);
    }

    public long count(ContactSpecification specification) {
        String sql = "SELECT COUNT(*) FROM contacts c WHERE " + specification.toSql();
        Long count = namedParameterJdbcTemplate.queryForObject(sql, specification.getParameters(), Long.class);
        return count == null ? 0 : count;
    }
}
