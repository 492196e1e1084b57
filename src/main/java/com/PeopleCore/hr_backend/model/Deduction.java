package com.PeopleCore.hr_backend.model;

import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.enums.DeductionBasis;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "deductions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Deduction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private DeductionBasis basis = DeductionBasis.FIXED;

    @Column(precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(precision = 6, scale = 2)
    private BigDecimal percent;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private ComponentStatus status = ComponentStatus.ACTIVE;

    @Column(nullable = false)
    private LocalDate effectiveDate;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
