package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.ComponentStatus;
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
public class AllowanceResponse {
    private Long id;
    private Long employeeId;
    private String name;
    private BigDecimal amount;
    private ComponentStatus status;
    private LocalDate effectiveFrom;
    private LocalDate effectiveTo;
}
