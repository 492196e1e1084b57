package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.dto.request.AllowanceRequest;
import com.PeopleCore.hr_backend.dto.request.BasicSalaryRequest;
import com.PeopleCore.hr_backend.dto.request.BonusRequest;
import com.PeopleCore.hr_backend.dto.request.DeductionRequest;
import com.PeopleCore.hr_backend.dto.request.OvertimeRequest;
import com.PeopleCore.hr_backend.dto.response.AllowanceResponse;
import com.PeopleCore.hr_backend.dto.response.ApiResponse;
import com.PeopleCore.hr_backend.dto.response.BonusResponse;
import com.PeopleCore.hr_backend.dto.response.DeductionResponse;
import com.PeopleCore.hr_backend.dto.response.OvertimeResponse;
import com.PeopleCore.hr_backend.dto.response.SalaryResponse;
import com.PeopleCore.hr_backend.service.SalaryComponentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/salary-components")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
public class SalaryComponentController {

    private final SalaryComponentService salaryComponentService;

    @PostMapping("/basic")
    public ResponseEntity<ApiResponse<SalaryResponse>> setBasicSalary(@Valid @RequestBody BasicSalaryRequest request) {
        SalaryResponse salary = salaryComponentService.setBasicSalary(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(salary, "Basic salary updated successfully"));
    }

    @GetMapping("/basic/{employeeId}")
    public ResponseEntity<ApiResponse<SalaryResponse>> getCurrentBasicSalary(@PathVariable Long employeeId) {
        return ResponseEntity.ok(ApiResponse.success(salaryComponentService.getCurrentBasicSalary(employeeId)));
    }

    @GetMapping("/basic/{employeeId}/history")
    public ResponseEntity<ApiResponse<List<SalaryResponse>>> getSalaryHistory(@PathVariable Long employeeId) {
        return ResponseEntity.ok(ApiResponse.success(salaryComponentService.getSalaryHistory(employeeId)));
    }

    @PostMapping("/allowances")
    public ResponseEntity<ApiResponse<AllowanceResponse>> addAllowance(@Valid @RequestBody AllowanceRequest request) {
        AllowanceResponse allowance = salaryComponentService.addAllowance(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(allowance, "Allowance added successfully"));
    }

    @GetMapping("/allowances/{employeeId}")
    public ResponseEntity<ApiResponse<List<AllowanceResponse>>> getAllowances(@PathVariable Long employeeId) {
        return ResponseEntity.ok(ApiResponse.success(salaryComponentService.getAllowances(employeeId)));
    }

    @PutMapping("/allowances/{id}")
    public ResponseEntity<ApiResponse<AllowanceResponse>> updateAllowance(
            @PathVariable Long id,
            @Valid @RequestBody AllowanceRequest request) {

        AllowanceResponse allowance = salaryComponentService.updateAllowance(id, request);
        return ResponseEntity.ok(ApiResponse.success(allowance, "Allowance updated successfully"));
    }

    @DeleteMapping("/allowances/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteAllowance(@PathVariable Long id) {
        salaryComponentService.deleteAllowance(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Allowance deleted successfully"));
    }

    @PostMapping("/deductions")
    public ResponseEntity<ApiResponse<DeductionResponse>> addDeduction(@Valid @RequestBody DeductionRequest request) {
        DeductionResponse deduction = salaryComponentService.addDeduction(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(deduction, "Deduction added successfully"));
    }

    @GetMapping("/deductions/{employeeId}")
    public ResponseEntity<ApiResponse<List<DeductionResponse>>> getDeductions(@PathVariable Long employeeId) {
        return ResponseEntity.ok(ApiResponse.success(salaryComponentService.getDeductions(employeeId)));
    }

    @PostMapping("/bonuses")
    public ResponseEntity<ApiResponse<BonusResponse>> addBonus(@Valid @RequestBody BonusRequest request) {
        BonusResponse bonus = salaryComponentService.addBonus(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(bonus, "Bonus added successfully"));
    }

    @PostMapping("/overtime")
    public ResponseEntity<ApiResponse<OvertimeResponse>> addOvertime(@Valid @RequestBody OvertimeRequest request) {
        OvertimeResponse overtime = salaryComponentService.addOvertime(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(overtime, "Overtime recorded successfully"));
    }
}
