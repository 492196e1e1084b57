package com.PeopleCore.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Data
public class LeaveApplicationRequest {

    @NotNull(message = "Employee ID is required")
    private Long employeeId;

    @NotNull(message = "Leave type is required")
    private Long leaveTypeId;

    @NotNull(message = "Start date is required")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    private LocalDate endDate;

    private LocalTime startTime;
    private LocalTime endTime;

    // Overrides the computed span when present
    @DecimalMin(value = "0.0", message = "Duration cannot be negative")
    private BigDecimal durationHours;

    private String reason;
}
