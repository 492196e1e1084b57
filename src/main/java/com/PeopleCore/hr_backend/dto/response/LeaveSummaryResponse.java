package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveSummaryResponse {
    private int year;
    private List<TypeTotal> byType;
    private long onLeaveToday;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TypeTotal {
        private String leaveType;
        private BigDecimal hours;
        private BigDecimal days;
    }
}
