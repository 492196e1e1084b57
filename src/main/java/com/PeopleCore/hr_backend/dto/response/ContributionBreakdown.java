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
public class ContributionBreakdown {
    private BigDecimal baseAmount;
    private BigDecimal epfRate;
    private BigDecimal employerEpfRate;
    private BigDecimal etfRate;
    private BigDecimal employeeEpf;
    private BigDecimal employerEpf;
    private BigDecimal employerEtf;
    private BigDecimal totalEpf;
    private BigDecimal totalContribution;
}
