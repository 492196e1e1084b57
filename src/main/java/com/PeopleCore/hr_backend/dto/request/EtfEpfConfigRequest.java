package com.PeopleCore.hr_backend.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Used for both create and update. On update only the non-null fields are applied.
 */
@Data
public class EtfEpfConfigRequest {

    private Long employeeId;
    private String epfNumber;
    private String etfNumber;
    private LocalDate epfEffectiveDate;
    private LocalDate etfEffectiveDate;
    private String epfStatus;
    private String etfStatus;

    @DecimalMin(value = "0.0", message = "EPF rate cannot be negative")
    @DecimalMax(value = "100.0", message = "EPF rate cannot exceed 100")
    private BigDecimal epfContributionRate;

    @DecimalMin(value = "0.0", message = "Employer EPF rate cannot be negative")
    @DecimalMax(value = "100.0", message = "Employer EPF rate cannot exceed 100")
    private BigDecimal employerEpfRate;

    @DecimalMin(value = "0.0", message = "ETF rate cannot be negative")
    @DecimalMax(value = "100.0", message = "ETF rate cannot exceed 100")
    private BigDecimal etfContributionRate;
}
