package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.LeaveStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveDecisionResponse {
    private Long id;
    private LeaveStatus status;
    private String message;
    private BigDecimal usedDays;
    private UnpaidLeaveResponse unpaidLeave;
}
