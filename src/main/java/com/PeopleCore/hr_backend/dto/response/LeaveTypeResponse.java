package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.LeaveCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveTypeResponse {
    private Long id;
    private String name;
    private LeaveCategory category;
}
