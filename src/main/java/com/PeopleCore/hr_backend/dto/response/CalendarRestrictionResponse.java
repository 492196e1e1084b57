package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarRestrictionResponse {
    private Long id;
    private LocalDate date;
    private String type;
    private String reason;
}
