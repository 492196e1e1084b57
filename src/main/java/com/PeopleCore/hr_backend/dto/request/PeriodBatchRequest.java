package com.PeopleCore.hr_backend.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
public class PeriodBatchRequest {

    @NotEmpty(message = "At least one employee ID is required")
    private List<Long> employeeIds;

    @NotNull(message = "Year is required")
    @Min(value = 1, message = "Year must be positive")
    private Integer year;

    @NotNull(message = "Month is required")
    @Min(value = 1, message = "Month must be between 1 and 12")
    @Max(value = 12, message = "Month must be between 1 and 12")
    private Integer month;

    private LocalDate paymentDate;
}
