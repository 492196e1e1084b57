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
public class EmployeeLeaveBalanceResponse {
    private Long employeeId;
    private String employeeCode;
    private String fullName;
    private String departmentName;
    private String gradeName;
    private int year;
    private BigDecimal annualUsed;
    private BigDecimal annualLimit;
    private BigDecimal annualRemaining;
    private BigDecimal medicalUsed;
    private BigDecimal medicalLimit;
    private BigDecimal medicalRemaining;
}
