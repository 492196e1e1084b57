package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeResponse {
    private Long id;
    private String employeeCode;
    private String fullName;
    private String email;
    private String phone;
    private String designation;
    private Long departmentId;
    private String departmentName;
    private Long gradeId;
    private String gradeName;
    private LocalDate joiningDate;
    private String epfNo;
    private EmployeeStatus status;
    private LocalDateTime createdAt;
}
