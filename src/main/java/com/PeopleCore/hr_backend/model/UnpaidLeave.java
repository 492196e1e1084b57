package com.PeopleCore.hr_backend.model;

import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "unpaid_leaves")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UnpaidLeave {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    private LocalDate startDate;

    private LocalDate endDate;

    // excess days over the entitlement, not the request span
    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal totalDays;

    private String reason;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private UnpaidLeaveStatus status = UnpaidLeaveStatus.PENDING;

    @Column(precision = 12, scale = 2)
    private BigDecimal deductionAmount;

    private LocalDateTime processedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
