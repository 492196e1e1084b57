package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.dto.request.EtfEpfConfigRequest;
import com.PeopleCore.hr_backend.dto.request.PeriodBatchRequest;
import com.PeopleCore.hr_backend.dto.response.ApiResponse;
import com.PeopleCore.hr_backend.dto.response.BatchResult;
import com.PeopleCore.hr_backend.dto.response.ContributionBreakdown;
import com.PeopleCore.hr_backend.dto.response.EmployeeResponse;
import com.PeopleCore.hr_backend.dto.response.EtfEpfConfigResponse;
import com.PeopleCore.hr_backend.dto.response.EtfEpfHistoryResponse;
import com.PeopleCore.hr_backend.dto.response.EtfEpfPeriodSummary;
import com.PeopleCore.hr_backend.dto.response.EtfEpfProcessItem;
import com.PeopleCore.hr_backend.dto.response.EtfEpfTransactionResponse;
import com.PeopleCore.hr_backend.service.CurrentUserService;
import com.PeopleCore.hr_backend.service.EtfEpfService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/etf-epf")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
public class EtfEpfController {

    private final EtfEpfService etfEpfService;
    private final CurrentUserService currentUserService;

    @GetMapping("/configs")
    public ResponseEntity<ApiResponse<List<EtfEpfConfigResponse>>> getAllConfigs() {
        return ResponseEntity.ok(ApiResponse.success(etfEpfService.getAllConfigs()));
    }

    @GetMapping("/configs/{id}")
    public ResponseEntity<ApiResponse<EtfEpfConfigResponse>> getConfigById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(etfEpfService.getConfigById(id)));
    }

    @PostMapping("/configs")
    public ResponseEntity<ApiResponse<EtfEpfConfigResponse>> createConfig(
            @Valid @RequestBody EtfEpfConfigRequest request) {

        EtfEpfConfigResponse config = etfEpfService.createConfig(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(config, "ETF/EPF configuration created successfully"));
    }

    @PutMapping("/configs/{id}")
    public ResponseEntity<ApiResponse<EtfEpfConfigResponse>> updateConfig(
            @PathVariable Long id,
            @Valid @RequestBody EtfEpfConfigRequest request) {

        EtfEpfConfigResponse config = etfEpfService.updateConfig(id, request);
        return ResponseEntity.ok(ApiResponse.success(config, "ETF/EPF configuration updated successfully"));
    }

    @DeleteMapping("/configs/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<Void>> deleteConfig(@PathVariable Long id) {
        etfEpfService.deleteConfig(id);
        return ResponseEntity.ok(ApiResponse.success(null, "ETF/EPF configuration deleted successfully"));
    }

    @GetMapping("/employees/unconfigured")
    public ResponseEntity<ApiResponse<List<EmployeeResponse>>> getEmployeesWithoutConfig() {
        return ResponseEntity.ok(ApiResponse.success(etfEpfService.getEmployeesWithoutConfig()));
    }

    @GetMapping("/calculate")
    public ResponseEntity<ApiResponse<ContributionBreakdown>> calculateContributions(
            @RequestParam Long employeeId,
            @RequestParam BigDecimal basicSalary) {

        return ResponseEntity.ok(ApiResponse.success(
                etfEpfService.calculateContributions(employeeId, basicSalary)));
    }

    @GetMapping("/process-list")
    public ResponseEntity<ApiResponse<List<EtfEpfProcessItem>>> getProcessList(
            @RequestParam Integer year,
            @RequestParam Integer month) {

        return ResponseEntity.ok(ApiResponse.success(etfEpfService.getProcessList(year, month)));
    }

    @PostMapping("/process")
    @PreAuthorize("hasAnyRole('ADMIN', 'FINANCE')")
    public ResponseEntity<ApiResponse<BatchResult<EtfEpfTransactionResponse>>> processPayments(
            @Valid @RequestBody PeriodBatchRequest request) {

        BatchResult<EtfEpfTransactionResponse> result = etfEpfService.processPayments(
                request, currentUserService.currentUserId());
        return ResponseEntity.ok(ApiResponse.success(result,
                "Processed " + result.getProcessedCount() + ", skipped " + result.getSkippedCount()));
    }

    @GetMapping("/payments/summary")
    public ResponseEntity<ApiResponse<List<EtfEpfPeriodSummary>>> getPaymentSummary() {
        return ResponseEntity.ok(ApiResponse.success(etfEpfService.getPaymentSummary()));
    }

    @GetMapping("/payments/history")
    public ResponseEntity<ApiResponse<EtfEpfHistoryResponse>> getPaymentHistory(
            @RequestParam Integer year,
            @RequestParam Integer month) {

        return ResponseEntity.ok(ApiResponse.success(etfEpfService.getPaymentHistory(year, month)));
    }
}
