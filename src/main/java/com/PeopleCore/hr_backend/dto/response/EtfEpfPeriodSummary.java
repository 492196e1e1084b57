package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtfEpfPeriodSummary {
    private int year;
    private int month;
    private String monthName;
    private long employeeCount;
    private BigDecimal totalGross;
    private BigDecimal totalEmployeeEpf;
    private BigDecimal totalEmployerEpf;
    private BigDecimal totalEtf;
    private LocalDateTime lastProcessedAt;
}
