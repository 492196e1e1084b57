package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "employee_etf_epf")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EtfEpfConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false, unique = true)
    private Employee employee;

    @Column(nullable = false)
    private String epfNumber;

    private String etfNumber;

    private LocalDate epfEffectiveDate;

    private LocalDate etfEffectiveDate;

    @Builder.Default
    private String epfStatus = "Active";

    @Builder.Default
    private String etfStatus = "Active";

    // percentages; null falls back to the configured statutory defaults
    @Column(precision = 5, scale = 2)
    private BigDecimal epfContributionRate;

    @Column(precision = 5, scale = 2)
    private BigDecimal employerEpfRate;

    @Column(precision = 5, scale = 2)
    private BigDecimal etfContributionRate;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
