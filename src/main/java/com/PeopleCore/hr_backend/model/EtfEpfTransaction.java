package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "payroll_etf_epf_transactions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "period_year", "period_month"}))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EtfEpfTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false, updatable = false)
    private Employee employee;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int periodYear;

    @Column(name = "period_month", nullable = false, updatable = false)
    private int periodMonth;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal grossSalary;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal employeeEpfAmount;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal epfEmployerShare;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal employerEtfAmount;

    @Column(updatable = false)
    private Long processedBy;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime processedAt;
}
