package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    @Query("SELECT a FROM AuditLog a WHERE " +
            "(:startTime IS NULL OR a.actionTime >= :startTime) AND " +
            "(:endBefore IS NULL OR a.actionTime < :endBefore)")
    Page<AuditLog> findByActionTimeRange(@Param("startTime") LocalDateTime startTime,
                                         @Param("endBefore") LocalDateTime endBefore,
                                         Pageable pageable);
}
