package com.PeopleCore.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class LeaveRuleRequest {

    @NotNull(message = "Grade ID is required")
    private Long gradeId;

    @NotNull(message = "Annual limit is required")
    @DecimalMin(value = "0.0", message = "Annual limit cannot be negative")
    private BigDecimal annualLimit;

    @NotNull(message = "Medical limit is required")
    @DecimalMin(value = "0.0", message = "Medical limit cannot be negative")
    private BigDecimal medicalLimit;
}
