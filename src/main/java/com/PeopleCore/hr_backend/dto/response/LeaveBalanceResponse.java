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
public class LeaveBalanceResponse {
    private Long employeeId;
    private Long leaveTypeId;
    private String leaveTypeName;
    private int year;
    private BigDecimal entitledDays;
    private BigDecimal usedDays;
}
