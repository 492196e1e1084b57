package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.enums.DeductionBasis;
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
public class DeductionResponse {
    private Long id;
    private Long employeeId;
    private String name;
    private DeductionBasis basis;
    private BigDecimal amount;
    private BigDecimal percent;
    private ComponentStatus status;
    private LocalDate effectiveDate;
}
