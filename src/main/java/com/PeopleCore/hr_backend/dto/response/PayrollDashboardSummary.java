package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollDashboardSummary {
    private int year;
    private int month;
    private String monthName;
    private long employeeCount;
    private BigDecimal totalGross;
    private BigDecimal totalDeductions;
    private BigDecimal totalNet;
    private BigDecimal previousGross;
    private BigDecimal grossChangePercent;
    private long transfersCompleted;
    private long unpaidLeavesPending;
}
