package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.TransferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollTransferResponse {
    private Long id;
    private Long employeeId;
    private String employeeCode;
    private String employeeName;
    private int periodYear;
    private int periodMonth;
    private BigDecimal grossSalary;
    private BigDecimal totalDeductions;
    private BigDecimal netSalary;
    private LocalDate paymentDate;
    private TransferStatus status;
    private Long processedBy;
}
