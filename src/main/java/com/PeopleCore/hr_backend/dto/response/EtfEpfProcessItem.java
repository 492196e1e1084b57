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
public class EtfEpfProcessItem {
    private Long employeeId;
    private String employeeCode;
    private String fullName;
    private String epfNumber;
    private boolean configured;
    private boolean processed;
    private BigDecimal basicSalary;
    private ContributionBreakdown contributions;
}
