package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "payroll_cycles")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "period_year", nullable = false)
    private int periodYear;

    @Column(name = "period_month", nullable = false)
    private int periodMonth;

    private int processedCount;

    private int skippedCount;

    private Long runBy;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime runAt;
}
