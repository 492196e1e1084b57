package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.dto.request.EmployeeRequest;
import com.PeopleCore.hr_backend.dto.response.ApiResponse;
import com.PeopleCore.hr_backend.dto.response.EmployeeResponse;
import com.PeopleCore.hr_backend.dto.response.LookupResponse;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import com.PeopleCore.hr_backend.service.EmployeeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employeeService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<PaginatedResponse<EmployeeResponse>>> getAllEmployees(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Long departmentId,
            @RequestParam(required = false) EmployeeStatus status) {

        PaginatedResponse<EmployeeResponse> employees = employeeService.getAllEmployees(
                page, limit, search, departmentId, status);
        return ResponseEntity.ok(ApiResponse.success(employees));
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<List<EmployeeResponse>>> getActiveEmployees() {
        return ResponseEntity.ok(ApiResponse.success(employeeService.getActiveEmployees()));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<EmployeeResponse>> getEmployeeById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(employeeService.getEmployeeById(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<EmployeeResponse>> createEmployee(
            @Valid @RequestBody EmployeeRequest request) {

        EmployeeResponse employee = employeeService.createEmployee(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(employee, "Employee created successfully"));
    }

    @GetMapping("/departments")
    public ResponseEntity<ApiResponse<List<LookupResponse>>> getDepartments() {
        return ResponseEntity.ok(ApiResponse.success(employeeService.getDepartments()));
    }

    @PostMapping("/departments")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LookupResponse>> createDepartment(@RequestParam String name) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(employeeService.createDepartment(name), "Department created successfully"));
    }

    @GetMapping("/grades")
    public ResponseEntity<ApiResponse<List<LookupResponse>>> getGrades() {
        return ResponseEntity.ok(ApiResponse.success(employeeService.getGrades()));
    }

    @PostMapping("/grades")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LookupResponse>> createGrade(@RequestParam String name) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(employeeService.createGrade(name), "Grade created successfully"));
    }
}
