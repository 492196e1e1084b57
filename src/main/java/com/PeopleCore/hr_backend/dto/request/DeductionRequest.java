package com.PeopleCore.hr_backend.dto.request;

import com.PeopleCore.hr_backend.enums.DeductionBasis;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class DeductionRequest {

    @NotNull(message = "Employee ID is required")
    private Long employeeId;

    @NotBlank(message = "Deduction name is required")
    private String name;

    private DeductionBasis basis;

    @DecimalMin(value = "0.0", message = "Amount cannot be negative")
    private BigDecimal amount;

    @DecimalMin(value = "0.0", message = "Percent cannot be negative")
    private BigDecimal percent;

    @NotNull(message = "Effective date is required")
    private LocalDate effectiveDate;
}
