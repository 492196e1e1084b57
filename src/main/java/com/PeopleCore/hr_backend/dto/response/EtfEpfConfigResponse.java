package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtfEpfConfigResponse {
    private Long id;
    private Long employeeId;
    private String employeeCode;
    private String employeeName;
    private boolean configured;
    private String epfNumber;
    private String etfNumber;
    private LocalDate epfEffectiveDate;
    private LocalDate etfEffectiveDate;
    private String epfStatus;
    private String etfStatus;
    private BigDecimal epfContributionRate;
    private BigDecimal employerEpfRate;
    private BigDecimal etfContributionRate;
}
