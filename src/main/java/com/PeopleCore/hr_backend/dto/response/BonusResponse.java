package com.PeopleCore.hr_backend.dto.response;

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
public class BonusResponse {
    private Long id;
    private Long employeeId;
    private String description;
    private BigDecimal amount;
    private LocalDate effectiveDate;
}
