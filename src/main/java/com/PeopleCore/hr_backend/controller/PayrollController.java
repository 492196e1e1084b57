package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.dto.request.PeriodBatchRequest;
import com.PeopleCore.hr_backend.dto.response.ApiResponse;
import com.PeopleCore.hr_backend.dto.response.AvailableMonth;
import com.PeopleCore.hr_backend.dto.response.BatchResult;
import com.PeopleCore.hr_backend.dto.response.DepartmentPayrollReport;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.dto.response.PayrollDashboardSummary;
import com.PeopleCore.hr_backend.dto.response.PayrollStatusResponse;
import com.PeopleCore.hr_backend.dto.response.PayrollTransferResponse;
import com.PeopleCore.hr_backend.dto.response.PayslipResponse;
import com.PeopleCore.hr_backend.dto.response.TransferOverviewItem;
import com.PeopleCore.hr_backend.enums.TransferStatus;
import com.PeopleCore.hr_backend.service.CurrentUserService;
import com.PeopleCore.hr_backend.service.PayrollService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/payroll")
@RequiredArgsConstructor
public class PayrollController {

    private final PayrollService payrollService;
    private final CurrentUserService currentUserService;

    @GetMapping("/employees/{employeeId}/payslip")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<PayslipResponse>> getPayslip(
            @PathVariable Long employeeId,
            @RequestParam Integer year,
            @RequestParam Integer month) {

        return ResponseEntity.ok(ApiResponse.success(payrollService.getPayslip(employeeId, year, month)));
    }

    @PostMapping("/transfers/process")
    @PreAuthorize("hasAnyRole('ADMIN', 'FINANCE')")
    public ResponseEntity<ApiResponse<BatchResult<PayrollTransferResponse>>> processSalaryTransfer(
            @Valid @RequestBody PeriodBatchRequest request) {

        BatchResult<PayrollTransferResponse> result = payrollService.processSalaryTransfer(
                request, currentUserService.currentUserId());
        return ResponseEntity.ok(ApiResponse.success(result,
                "Processed " + result.getProcessedCount() + ", skipped " + result.getSkippedCount()));
    }

    @PostMapping("/transfers/initiate")
    @PreAuthorize("hasAnyRole('ADMIN', 'FINANCE')")
    public ResponseEntity<ApiResponse<BatchResult<PayrollTransferResponse>>> initiateBankTransfer(
            @Valid @RequestBody PeriodBatchRequest request) {

        BatchResult<PayrollTransferResponse> result = payrollService.initiateBankTransfer(
                request, currentUserService.currentUserId());
        return ResponseEntity.ok(ApiResponse.success(result,
                "Initiated " + result.getProcessedCount() + ", skipped " + result.getSkippedCount()));
    }

    @GetMapping("/transfers")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<List<PayrollTransferResponse>>> getTransfers(
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) TransferStatus status) {

        return ResponseEntity.ok(ApiResponse.success(payrollService.getTransfers(year, month, status)));
    }

    @GetMapping("/transfers/overview")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<PaginatedResponse<TransferOverviewItem>>> getTransferOverview(
            @RequestParam Integer year,
            @RequestParam Integer month,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) Long departmentId) {

        return ResponseEntity.ok(ApiResponse.success(
                payrollService.getTransferOverview(year, month, page, limit, departmentId)));
    }

    @GetMapping("/departments/summary")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<DepartmentPayrollReport>> getDepartmentSummary(
            @RequestParam Integer year,
            @RequestParam Integer month,
            @RequestParam(required = false) Long departmentId) {

        return ResponseEntity.ok(ApiResponse.success(
                payrollService.getDepartmentSummary(year, month, departmentId)));
    }

    @GetMapping("/summary")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<PayrollDashboardSummary>> getDashboardSummary(
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month) {

        return ResponseEntity.ok(ApiResponse.success(payrollService.getDashboardSummary(year, month)));
    }

    @GetMapping("/status")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<PayrollStatusResponse>> getPayrollStatus(
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month) {

        return ResponseEntity.ok(ApiResponse.success(payrollService.getPayrollStatus(year, month)));
    }

    @GetMapping("/available-months")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<List<AvailableMonth>>> getAvailableMonths() {
        return ResponseEntity.ok(ApiResponse.success(payrollService.getAvailableMonths()));
    }
}
