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
public class CalendarEventResponse {
    private String id;
    private String eventType;
    private String title;
    private LocalDate start;
    private LocalDate end;
    private BigDecimal hours;
    private String leaveType;
    private String employeeName;
    private String reason;
}
