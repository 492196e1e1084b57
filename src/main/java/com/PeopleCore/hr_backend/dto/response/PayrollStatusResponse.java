package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollStatusResponse {
    private int year;
    private int month;
    private String monthName;
    private List<Step> steps;
    private int currentStep;
    private int totalSteps;
    private LocalDateTime lastRunAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Step {
        private String name;
        private String status;
        private String detail;
    }
}
