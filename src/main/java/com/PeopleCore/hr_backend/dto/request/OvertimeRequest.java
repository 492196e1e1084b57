package com.PeopleCore.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class OvertimeRequest {

    @NotNull(message = "Employee ID is required")
    private Long employeeId;

    @NotNull(message = "Overtime hours are required")
    @DecimalMin(value = "0.0", message = "Overtime hours cannot be negative")
    private BigDecimal otHours;

    @NotNull(message = "Overtime rate is required")
    @DecimalMin(value = "0.0", message = "Overtime rate cannot be negative")
    private BigDecimal otRate;

    private String note;
}
