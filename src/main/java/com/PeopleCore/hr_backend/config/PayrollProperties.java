package com.PeopleCore.hr_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@ConfigurationProperties(prefix = "hr.payroll")
@Data
public class PayrollProperties {
    // Statutory fallbacks, percent of gross
    private BigDecimal defaultEpfRate = new BigDecimal("8.00");
    private BigDecimal defaultEmployerEpfRate = new BigDecimal("12.00");
    private BigDecimal defaultEtfRate = new BigDecimal("3.00");

    // Deductions whose name contains this marker are statutory and priced separately
    private String epfDeductionMarker = "EPF";

    private int workingDaysPerMonth = 30;
}
