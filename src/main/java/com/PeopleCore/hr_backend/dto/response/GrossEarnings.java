package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Earnings for one employee and period. Components are kept unrounded; {@code gross}
 * is always their exact sum.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrossEarnings {
    private Long employeeId;
    private int year;
    private int month;
    private BigDecimal basic;
    private BigDecimal allowances;
    private BigDecimal overtime;
    private BigDecimal bonuses;
    private BigDecimal gross;

    @Builder.Default
    private List<PayLine> breakdown = new ArrayList<>();

    public boolean hasPositiveGross() {
        return gross != null && gross.signum() > 0;
    }
}
