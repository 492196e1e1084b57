package com.PeopleCore.hr_backend.controller;

import com.PeopleCore.hr_backend.dto.request.CalendarRestrictionRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveApplicationRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveDecisionRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveRuleRequest;
import com.PeopleCore.hr_backend.dto.response.ApiResponse;
import com.PeopleCore.hr_backend.dto.response.CalendarEventResponse;
import com.PeopleCore.hr_backend.dto.response.CalendarRestrictionResponse;
import com.PeopleCore.hr_backend.dto.response.EmployeeLeaveBalanceResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveBalanceResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveDecisionResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveRequestResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveRuleResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveSummaryResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveTypeResponse;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.enums.LeaveStatus;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.service.CurrentUserService;
import com.PeopleCore.hr_backend.service.LeaveService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/leave")
@RequiredArgsConstructor
public class LeaveController {

    private final LeaveService leaveService;
    private final CurrentUserService currentUserService;

    @GetMapping("/requests")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PaginatedResponse<LeaveRequestResponse>>> getLeaveRequests(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize,
            @RequestParam(required = false) LeaveStatus status,
            @RequestParam(required = false) Long departmentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String search) {

        PaginatedResponse<LeaveRequestResponse> requests = leaveService.listLeaveRequests(
                page, pageSize, status, departmentId, from, to, search);
        return ResponseEntity.ok(ApiResponse.success(requests));
    }

    @GetMapping("/requests/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LeaveRequestResponse>> getLeaveRequest(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(leaveService.getLeaveRequest(id)));
    }

    @PostMapping("/requests")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<LeaveRequestResponse>> createLeaveRequest(
            @Valid @RequestBody LeaveApplicationRequest request) {

        LeaveRequestResponse leaveRequest = leaveService.createLeaveRequest(request, currentUserService.currentUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(leaveRequest, "Leave request submitted successfully"));
    }

    @PostMapping("/requests/{id}/decision")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LeaveDecisionResponse>> decide(
            @PathVariable Long id,
            @Valid @RequestBody LeaveDecisionRequest request) {

        LeaveDecisionResponse decision = leaveService.decide(id, request, currentUserService.currentUserId());
        return ResponseEntity.ok(ApiResponse.success(decision, decision.getMessage()));
    }

    @GetMapping("/calendar")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<List<CalendarEventResponse>>> getCalendar(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        return ResponseEntity.ok(ApiResponse.success(leaveService.getCalendarFeed(from, to)));
    }

    @PostMapping("/calendar/restrictions")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<CalendarRestrictionResponse>> saveRestriction(
            @Valid @RequestBody CalendarRestrictionRequest request) {

        CalendarRestrictionResponse restriction = leaveService.saveRestriction(
                request, currentUserService.currentUserId());
        return ResponseEntity.ok(ApiResponse.success(restriction, "Calendar restriction saved"));
    }

    @DeleteMapping("/calendar/restrictions")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<Object>> deleteRestriction(
            @RequestParam(required = false) Long id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        if (id == null && date == null) {
            throw new ValidationException("Either id or date is required");
        }
        int removed = id != null ? leaveService.deleteRestriction(id) : leaveService.deleteRestrictionByDate(date);

        var result = new Object() {
            public final int deleted = removed;
        };
        return ResponseEntity.ok(ApiResponse.success(result, "Calendar restriction removed"));
    }

    @GetMapping("/summary")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LeaveSummaryResponse>> getSummary(@RequestParam(required = false) Integer year) {
        int resolvedYear = year != null ? year : LocalDate.now().getYear();
        return ResponseEntity.ok(ApiResponse.success(leaveService.getSummary(resolvedYear)));
    }

    @GetMapping("/balances")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<PaginatedResponse<EmployeeLeaveBalanceResponse>>> getEmployeeBalances(
            @RequestParam(required = false) Integer year,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize,
            @RequestParam(required = false) Long departmentId,
            @RequestParam(required = false) String search) {

        int resolvedYear = year != null ? year : LocalDate.now().getYear();
        return ResponseEntity.ok(ApiResponse.success(
                leaveService.getEmployeeBalances(resolvedYear, page, pageSize, departmentId, search)));
    }

    @GetMapping("/balances/{employeeId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR', 'EMPLOYEE')")
    public ResponseEntity<ApiResponse<List<LeaveBalanceResponse>>> getEmployeeBalance(
            @PathVariable Long employeeId,
            @RequestParam(required = false) Integer year) {

        int resolvedYear = year != null ? year : LocalDate.now().getYear();
        return ResponseEntity.ok(ApiResponse.success(leaveService.getEmployeeBalance(employeeId, resolvedYear)));
    }

    @GetMapping("/rules")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<List<LeaveRuleResponse>>> getRules() {
        return ResponseEntity.ok(ApiResponse.success(leaveService.getRules()));
    }

    @PutMapping("/rules")
    @PreAuthorize("hasAnyRole('ADMIN', 'HR')")
    public ResponseEntity<ApiResponse<LeaveRuleResponse>> saveRule(@Valid @RequestBody LeaveRuleRequest request) {
        return ResponseEntity.ok(ApiResponse.success(leaveService.saveRule(request), "Leave rule saved"));
    }

    @GetMapping("/types")
    public ResponseEntity<ApiResponse<List<LeaveTypeResponse>>> getLeaveTypes() {
        return ResponseEntity.ok(ApiResponse.success(leaveService.getLeaveTypes()));
    }
}
