package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeductionSummary {
    private Long employeeId;
    private int year;
    private int month;

    @Builder.Default
    private List<PayLine> regular = new ArrayList<>();

    private BigDecimal regularTotal;
    private BigDecimal unpaidLeaveTotal;
    private BigDecimal epfRate;
    private BigDecimal epfEmployeeAmount;
    private BigDecimal total;
}
