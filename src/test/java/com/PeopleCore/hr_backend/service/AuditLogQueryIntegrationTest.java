package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.response.AuditLogResponse;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.model.AuditLog;
import com.PeopleCore.hr_backend.util.Constants;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@DisplayName("Audit log date filter")
class AuditLogQueryIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2020, 1, 15);

    @Autowired private AuditService auditService;
    @Autowired private EntityManager entityManager;
    @Autowired private JdbcTemplate jdbcTemplate;

    private Long recordAt(LocalDateTime actionTime, String targetId) {
        AuditLog entry = auditService.record(Constants.AUDIT_UPDATE, "leave_rules", targetId, null, null);
        entityManager.flush();
        jdbcTemplate.update("UPDATE audit_logs SET action_time = ? WHERE id = ?",
                Timestamp.valueOf(actionTime), entry.getId());
        return entry.getId();
    }

    @Test
    @DisplayName("End date includes the whole last day, up to its final fraction of a second")
    void endDateIsInclusiveOfWholeDay() {
        Long morning = recordAt(DAY.atTime(0, 0), "1");
        Long lastInstant = recordAt(DAY.atTime(23, 59, 59, 600_000_000), "2");
        recordAt(DAY.plusDays(1).atStartOfDay(), "3");
        recordAt(DAY.minusDays(1).atTime(23, 59, 59), "4");
        entityManager.clear();

        PaginatedResponse<AuditLogResponse> logs = auditService.getAuditLogs(DAY, DAY, 1, 20);

        assertThat(logs.getPagination().getTotal()).isEqualTo(2);
        assertThat(logs.getData()).extracting(AuditLogResponse::getId).containsExactlyInAnyOrder(morning, lastInstant);
    }

    @Test
    @DisplayName("Start after end is rejected")
    void invertedRangeRejected() {
        assertThatThrownBy(() -> auditService.getAuditLogs(DAY, DAY.minusDays(1), 1, 20))
                .isInstanceOf(ValidationException.class);
    }
}
