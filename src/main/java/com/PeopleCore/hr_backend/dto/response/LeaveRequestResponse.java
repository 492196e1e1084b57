package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.LeaveCategory;
import com.PeopleCore.hr_backend.enums.LeaveStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveRequestResponse {
    private Long id;
    private Long employeeId;
    private String employeeCode;
    private String employeeName;
    private Long leaveTypeId;
    private String leaveTypeName;
    private LeaveCategory leaveCategory;
    private LocalDate startDate;
    private LocalDate endDate;
    private LocalTime startTime;
    private LocalTime endTime;
    private BigDecimal durationHours;
    private BigDecimal durationDays;
    private String departmentName;
    private String reason;
    private LeaveStatus status;
    private Long decidedByUserId;
    private LocalDateTime decidedAt;
    private String decisionNote;
    private LocalDateTime createdAt;
}
