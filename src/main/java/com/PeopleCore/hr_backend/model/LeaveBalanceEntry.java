package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only ledger line. One row per approved leave request.
 */
@Entity
@Table(name = "leave_balance_entries")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveBalanceEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false, updatable = false)
    private Employee employee;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "leave_type_id", nullable = false, updatable = false)
    private LeaveType leaveType;

    @Column(name = "balance_year", nullable = false, updatable = false)
    private int year;

    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal deltaDays;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_request_id", nullable = false, unique = true, updatable = false)
    private LeaveRequest sourceRequest;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
