package com.PeopleCore.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class BonusRequest {

    @NotNull(message = "Employee ID is required")
    private Long employeeId;

    private String description;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", message = "Amount cannot be negative")
    private BigDecimal amount;

    @NotNull(message = "Effective date is required")
    private LocalDate effectiveDate;
}
