package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One version of an employee's basic salary. Rows are only ever inserted; the highest id wins.
 */
@Entity
@Table(name = "salaries")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Salary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false, updatable = false)
    private Employee employee;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal basicSalary;

    @Column(updatable = false)
    private LocalDate effectiveDate;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
