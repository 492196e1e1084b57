package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnpaidLeaveResponse {
    private Long id;
    private Long employeeId;
    private String employeeName;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal totalDays;
    private String reason;
    private UnpaidLeaveStatus status;
    private BigDecimal deductionAmount;
    private LocalDateTime processedAt;
    private LocalDateTime createdAt;
}
