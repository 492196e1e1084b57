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
public class OvertimeResponse {
    private Long id;
    private Long employeeId;
    private BigDecimal otHours;
    private BigDecimal otRate;
    private BigDecimal amount;
    private String note;
    private LocalDateTime createdAt;
}
