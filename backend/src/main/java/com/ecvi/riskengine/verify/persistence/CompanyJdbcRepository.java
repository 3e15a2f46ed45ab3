package com.ecvi.riskengine.verify.persistence;

import com.ecvi.riskengine.verify.model.ApprovedCorrection;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Read access to the company records and approved data corrections owned by the
 * surrounding CRUD layer. The insert methods exist for seeding and tests.
 */
@Repository
public class CompanyJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public CompanyJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public CompanySnapshot findCompany(long companyId) {
        List<CompanySnapshot> rows = jdbc.query(
            """
                SELECT id, legal_name, registration_number, jurisdiction, domain, email, phone,
                       address_street, address_city, address_state, address_postal_code, address_country
                FROM companies
                WHERE id = :companyId
                """,
            new MapSqlParameterSource("companyId", companyId),
            (rs, rowNum) -> mapCompany(rs)
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Approved corrections in approval order, so later entries win when applied in sequence. */
    public List<ApprovedCorrection> findApprovedCorrections(long companyId) {
        return jdbc.query(
            """
                SELECT company_id, field_name, new_value, approved_at
                FROM data_corrections
                WHERE company_id = :companyId
                  AND status = 'APPROVED'
                ORDER BY approved_at, id
                """,
            new MapSqlParameterSource("companyId", companyId),
            (rs, rowNum) -> new ApprovedCorrection(
                rs.getLong("company_id"),
                rs.getString("field_name"),
                rs.getString("new_value"),
                toInstant(rs.getTimestamp("approved_at"))
            )
        );
    }

    public long insertCompany(CompanySnapshot company) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("legalName", company.legalName())
            .addValue("registrationNumber", company.registrationNumber())
            .addValue("jurisdiction", company.jurisdiction())
            .addValue("domain", company.domain())
            .addValue("email", company.email())
            .addValue("phone", company.phone())
            .addValue("addressStreet", company.addressStreet())
            .addValue("addressCity", company.addressCity())
            .addValue("addressState", company.addressState())
            .addValue("addressPostalCode", company.addressPostalCode())
            .addValue("addressCountry", company.addressCountry());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO companies (
                    legal_name, registration_number, jurisdiction, domain, email, phone,
                    address_street, address_city, address_state, address_postal_code, address_country
                )
                VALUES (
                    :legalName, :registrationNumber, :jurisdiction, :domain, :email, :phone,
                    :addressStreet, :addressCity, :addressState, :addressPostalCode, :addressCountry
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert company");
        }
        return key.longValue();
    }

    public long insertApprovedCorrection(long companyId, CompanyField field, String newValue, Instant approvedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("fieldName", field.key())
            .addValue("newValue", newValue)
            .addValue("approvedAt", toTimestamp(approvedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO data_corrections (company_id, field_name, new_value, status, approved_at)
                VALUES (:companyId, :fieldName, :newValue, 'APPROVED', :approvedAt)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert data correction");
        }
        return key.longValue();
    }

    private CompanySnapshot mapCompany(ResultSet rs) throws SQLException {
        return new CompanySnapshot(
            rs.getLong("id"),
            rs.getString("legal_name"),
            rs.getString("registration_number"),
            rs.getString("jurisdiction"),
            rs.getString("domain"),
            rs.getString("email"),
            rs.getString("phone"),
            rs.getString("address_street"),
            rs.getString("address_city"),
            rs.getString("address_state"),
            rs.getString("address_postal_code"),
            rs.getString("address_country")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
