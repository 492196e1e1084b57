package com.PeopleCore.hr_backend.dto.request;

import com.PeopleCore.hr_backend.enums.ComponentStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class AllowanceRequest {

    @NotNull(message = "Employee ID is required")
    private Long employeeId;

    @NotBlank(message = "Allowance name is required")
    private String name;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", message = "Amount cannot be negative")
    private BigDecimal amount;

    private ComponentStatus status;
    private LocalDate effectiveFrom;
    private LocalDate effectiveTo;
}
