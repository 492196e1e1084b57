package com.PeopleCore.hr_backend.model;

import com.PeopleCore.hr_backend.enums.AuditStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long userId;

    @Column(nullable = false)
    private String actionType;

    @Column(nullable = false)
    private String targetTable;

    private String targetId;

    @Lob
    private String beforeState;

    @Lob
    private String afterState;

    @Enumerated(EnumType.STRING)
    private AuditStatus status;

    private String errorMessage;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime actionTime;
}
