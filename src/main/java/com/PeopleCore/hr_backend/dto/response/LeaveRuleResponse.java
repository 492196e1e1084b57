package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveRuleResponse {
    private Long ruleId;
    private Long gradeId;
    private String gradeName;
    private BigDecimal annualLimit;
    private BigDecimal medicalLimit;
}
