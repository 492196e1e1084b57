package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "leave_rules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "grade_id", nullable = false, unique = true)
    private Grade grade;

    // days; zero means no limit configured
    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal annualLimit = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal medicalLimit = BigDecimal.ZERO;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
