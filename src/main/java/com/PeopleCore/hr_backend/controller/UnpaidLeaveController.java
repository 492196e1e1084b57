package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.dto.response.ApiResponse;
import com.PeopleCore.hr_backend.dto.response.UnpaidLeaveResponse;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.service.UnpaidLeaveService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/unpaid-leaves")
@RequiredArgsConstructor
public class UnpaidLeaveController {

    private final UnpaidLeaveService unpaidLeaveService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<List<UnpaidLeaveResponse>>> getUnpaidLeaves(
            @RequestParam(required = false) Long employeeId,
            @RequestParam(required = false) UnpaidLeaveStatus status) {

        return ResponseEntity.ok(ApiResponse.success(unpaidLeaveService.getUnpaidLeaves(employeeId, status)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<UnpaidLeaveResponse>> getUnpaidLeave(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(unpaidLeaveService.getUnpaidLeave(id)));
    }

    @PatchMapping("/{id}/process")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'FINANCE')")
    public ResponseEntity<ApiResponse<UnpaidLeaveResponse>> processUnpaidLeave(@PathVariable Long id) {
        UnpaidLeaveResponse unpaidLeave = unpaidLeaveService.processUnpaidLeave(id);
        return ResponseEntity.ok(ApiResponse.success(unpaidLeave, "Unpaid leave processed successfully"));
    }
}
