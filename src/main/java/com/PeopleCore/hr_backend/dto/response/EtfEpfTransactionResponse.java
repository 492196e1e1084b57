package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtfEpfTransactionResponse {
    private Long id;
    private Long employeeId;
    private String employeeCode;
    private String employeeName;
    private int periodYear;
    private int periodMonth;
    private BigDecimal grossSalary;
    private BigDecimal employeeEpfAmount;
    private BigDecimal epfEmployerShare;
    private BigDecimal employerEtfAmount;
    private LocalDateTime processedAt;
}
