package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.CalendarRestrictionRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveApplicationRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveDecisionRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveRuleRequest;
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
import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import com.PeopleCore.hr_backend.enums.LeaveAction;
import com.PeopleCore.hr_backend.enums.LeaveCategory;
import com.PeopleCore.hr_backend.enums.LeaveStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.model.CalendarRestriction;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.Grade;
import com.PeopleCore.hr_backend.model.LeaveBalance;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import com.PeopleCore.hr_backend.model.LeaveRule;
import com.PeopleCore.hr_backend.model.LeaveType;
import com.PeopleCore.hr_backend.model.UnpaidLeave;
import com.PeopleCore.hr_backend.repository.CalendarRestrictionRepository;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.GradeRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceRepository;
import com.PeopleCore.hr_backend.repository.LeaveRequestRepository;
import com.PeopleCore.hr_backend.repository.LeaveRuleRepository;
import com.PeopleCore.hr_backend.repository.LeaveTypeRepository;
import com.PeopleCore.hr_backend.util.Constants;
import com.PeopleCore.hr_backend.util.DateUtil;
import com.PeopleCore.hr_backend.util.LeaveDurationCalculator;
import com.PeopleCore.hr_backend.util.LeaveTypeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveService {

    private static final String TABLE_LEAVE_REQUESTS = "leave_requests";
    private static final String TABLE_RESTRICTIONS = "calendar_restrictions";
    private static final String TABLE_LEAVE_RULES = "leave_rules";

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final LeaveRuleRepository leaveRuleRepository;
    private final LeaveBalanceRepository leaveBalanceRepository;
    private final CalendarRestrictionRepository calendarRestrictionRepository;
    private final EmployeeRepository employeeRepository;
    private final GradeRepository gradeRepository;
    private final LeaveBalanceService leaveBalanceService;
    private final EntitlementBreachService entitlementBreachService;
    private final UnpaidLeaveService unpaidLeaveService;
    private final LeaveDurationCalculator durationCalculator;
    private final LeaveTypeResolver leaveTypeResolver;
    private final AuditService auditService;

    @Transactional
    public LeaveRequestResponse createLeaveRequest(LeaveApplicationRequest request, Long createdByUserId) {
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", request.getEmployeeId()));
        LeaveType leaveType = leaveTypeRepository.findById(request.getLeaveTypeId())
                .orElseThrow(() -> new ResourceNotFoundException("LeaveType", "id", request.getLeaveTypeId()));

        BigDecimal durationHours = durationCalculator.computeDurationHours(
                request.getStartDate(), request.getEndDate(),
                request.getStartTime(), request.getEndTime(),
                request.getDurationHours());

        LeaveRequest leaveRequest = LeaveRequest.builder()
                .employee(employee)
                .leaveType(leaveType)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .durationHours(durationHours)
                .department(employee.getDepartment())
                .reason(request.getReason())
                .status(LeaveStatus.PENDING)
                .createdByUserId(createdByUserId)
                .build();

        LeaveRequest saved = leaveRequestRepository.save(leaveRequest);
        LeaveRequestResponse response = mapToLeaveRequestResponse(saved);
        auditService.record(Constants.AUDIT_CREATE, TABLE_LEAVE_REQUESTS, saved.getId(), null, response);

        log.info("Leave request {} created for employee {} ({} hours)", saved.getId(), employee.getId(), durationHours);
        return response;
    }

    @Transactional(readOnly = true)
    public LeaveRequestResponse getLeaveRequest(Long id) {
        return mapToLeaveRequestResponse(findLeaveRequest(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<LeaveRequestResponse> listLeaveRequests(int page, int pageSize, LeaveStatus status,
                                                                    Long departmentId, LocalDate from,
                                                                    LocalDate to, String search) {
        int safePage = Math.max(page, 1);
        int safeSize = clampPageSize(pageSize);
        Pageable pageable = PageRequest.of(safePage - 1, safeSize,
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));

        Page<LeaveRequest> requests = leaveRequestRepository.searchRequests(
                status, departmentId, from, to, EmployeeService.blankToNull(search), pageable);

        List<LeaveRequestResponse> responses = requests.getContent()
                .stream()
                .map(this::mapToLeaveRequestResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, safePage, safeSize, requests.getTotalElements());
    }

    /**
     * Applies a decision. APPROVE books the days against the balance and may file unpaid
     * leave, all in this transaction. RESPOND only updates the note and is allowed in any
     * state.
     */
    @Transactional
    public LeaveDecisionResponse decide(Long id, LeaveDecisionRequest request, Long decidedByUserId) {
        LeaveRequest leaveRequest = findLeaveRequest(id);
        LeaveAction action = request.getAction();

        if (action.changesStatus() && !leaveRequest.isPending()) {
            throw InvalidStateException.alreadyDecided(id);
        }

        LeaveRequestResponse before = mapToLeaveRequestResponse(leaveRequest);
        LeaveDecisionResponse.LeaveDecisionResponseBuilder result = LeaveDecisionResponse.builder().id(id);

        switch (action) {
            case RESPOND -> {
                if (request.getNote() != null) {
                    leaveRequest.setDecisionNote(request.getNote());
                }
                result.message(Constants.MSG_RESPONSE_SAVED);
            }
            case REJECT -> {
                markDecided(leaveRequest, LeaveStatus.REJECTED, request.getNote(), decidedByUserId);
                result.message(Constants.MSG_REQUEST_REJECTED);
            }
            case APPROVE -> {
                markDecided(leaveRequest, LeaveStatus.APPROVED, request.getNote(), decidedByUserId);
                applyApproval(leaveRequest, result);
                result.message(Constants.MSG_REQUEST_APPROVED);
            }
        }

        LeaveRequest saved = leaveRequestRepository.save(leaveRequest);
        auditService.record(Constants.AUDIT_DECIDE, TABLE_LEAVE_REQUESTS, id, before, mapToLeaveRequestResponse(saved));

        log.info("Leave request {} {}: status {}", id, action, saved.getStatus());
        return result.status(saved.getStatus()).build();
    }

    private void markDecided(LeaveRequest leaveRequest, LeaveStatus status, String note, Long decidedByUserId) {
        leaveRequest.setStatus(status);
        leaveRequest.setDecidedByUserId(decidedByUserId);
        leaveRequest.setDecidedAt(LocalDateTime.now());
        if (note != null) {
            leaveRequest.setDecisionNote(note);
        }
    }

    private void applyApproval(LeaveRequest leaveRequest, LeaveDecisionResponse.LeaveDecisionResponseBuilder result) {
        LeaveCategory category = leaveTypeResolver.resolve(leaveRequest.getLeaveType().getId());
        BigDecimal daysUsed = durationCalculator.hoursToDays(leaveRequest.getDurationHours());
        BigDecimal limit = entitlementBreachService.resolveLimit(leaveRequest.getEmployee(), category);

        LeaveBalance balance = leaveBalanceService.applyApprovedLeave(leaveRequest, daysUsed, limit);
        result.usedDays(balance.getUsedDays());

        Optional<UnpaidLeave> unpaidLeave = entitlementBreachService.generateForBreach(
                leaveRequest, category, balance.getUsedDays(), limit);
        unpaidLeave.ifPresent(u -> result.unpaidLeave(unpaidLeaveService.mapToUnpaidLeaveResponse(u)));
    }

    @Transactional(readOnly = true)
    public List<CalendarEventResponse> getCalendarFeed(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Both from and to dates are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("From date must be on or before to date");
        }

        List<CalendarEventResponse> events = new ArrayList<>();

        for (LeaveRequest request : leaveRequestRepository.findOverlapping(LeaveStatus.APPROVED, from, to)) {
            String employeeName = request.getEmployee().getFullName();
            String typeName = request.getLeaveType().getName();
            events.add(CalendarEventResponse.builder()
                    .id("leave-" + request.getId())
                    .eventType("leave")
                    .title(employeeName + " - " + typeName)
                    .start(request.getStartDate())
                    .end(request.getEndDate())
                    .hours(request.getDurationHours().setScale(1, RoundingMode.HALF_UP))
                    .leaveType(typeName)
                    .employeeName(employeeName)
                    .reason(request.getReason())
                    .build());
        }

        for (CalendarRestriction restriction : calendarRestrictionRepository.findByDateBetweenOrderByDateAsc(from, to)) {
            events.add(CalendarEventResponse.builder()
                    .id("restriction-" + restriction.getId())
                    .eventType("restriction")
                    .title(restriction.getReason() != null
                            ? restriction.getType() + ": " + restriction.getReason()
                            : restriction.getType())
                    .start(restriction.getDate())
                    .end(restriction.getDate())
                    .reason(restriction.getReason())
                    .build());
        }

        return events;
    }

    @Transactional
    public CalendarRestrictionResponse saveRestriction(CalendarRestrictionRequest request, Long userId) {
        CalendarRestriction restriction = calendarRestrictionRepository.findByDate(request.getDate())
                .orElseGet(() -> CalendarRestriction.builder()
                        .date(request.getDate())
                        .createdByUserId(userId)
                        .build());
        boolean isNew = restriction.getId() == null;

        restriction.setType(request.getType());
        restriction.setReason(request.getReason());
        CalendarRestriction saved = calendarRestrictionRepository.save(restriction);

        CalendarRestrictionResponse response = mapToRestrictionResponse(saved);
        auditService.record(isNew ? Constants.AUDIT_CREATE : Constants.AUDIT_UPDATE,
                TABLE_RESTRICTIONS, saved.getId(), null, response);

        log.info("Calendar restriction saved for {}", DateUtil.formatDate(saved.getDate()));
        return response;
    }

    @Transactional
    public int deleteRestriction(Long id) {
        int deleted = calendarRestrictionRepository.deleteByRestrictionId(id);
        if (deleted > 0) {
            auditService.record(Constants.AUDIT_DELETE, TABLE_RESTRICTIONS, id, null, null);
        }
        return deleted;
    }

    @Transactional
    public int deleteRestrictionByDate(LocalDate date) {
        int deleted = calendarRestrictionRepository.deleteByRestrictionDate(date);
        if (deleted > 0) {
            auditService.record(Constants.AUDIT_DELETE, TABLE_RESTRICTIONS, DateUtil.formatDate(date), null, null);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public LeaveSummaryResponse getSummary(int year) {
        List<LeaveSummaryResponse.TypeTotal> byType = leaveRequestRepository
                .sumHoursByType(LeaveStatus.APPROVED, DateUtil.getStartOfYear(year), DateUtil.getEndOfYear(year))
                .stream()
                .map(row -> {
                    BigDecimal hours = EarningsService.nullToZero((BigDecimal) row[1]);
                    return LeaveSummaryResponse.TypeTotal.builder()
                            .leaveType((String) row[0])
                            .hours(hours.setScale(2, RoundingMode.HALF_UP))
                            .days(durationCalculator.hoursToDays(hours))
                            .build();
                })
                .collect(Collectors.toList());

        return LeaveSummaryResponse.builder()
                .year(year)
                .byType(byType)
                .onLeaveToday(leaveRequestRepository.countEmployeesOnLeave(LeaveStatus.APPROVED, LocalDate.now()))
                .build();
    }

    @Transactional(readOnly = true)
    public List<LeaveBalanceResponse> getEmployeeBalance(Long employeeId, int year) {
        if (!employeeRepository.existsById(employeeId)) {
            throw new ResourceNotFoundException("Employee", "id", employeeId);
        }
        return leaveBalanceRepository.findByEmployeeIdAndYearOrderByLeaveTypeIdAsc(employeeId, year)
                .stream()
                .map(b -> LeaveBalanceResponse.builder()
                        .employeeId(employeeId)
                        .leaveTypeId(b.getLeaveType().getId())
                        .leaveTypeName(b.getLeaveType().getName())
                        .year(b.getYear())
                        .entitledDays(b.getEntitledDays())
                        .usedDays(b.getUsedDays())
                        .build())
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<EmployeeLeaveBalanceResponse> getEmployeeBalances(int year, int page, int pageSize,
                                                                              Long departmentId, String search) {
        int safePage = Math.max(page, 1);
        int safeSize = clampPageSize(pageSize);
        Pageable pageable = PageRequest.of(safePage - 1, safeSize, Sort.by("fullName").ascending());

        Page<Employee> employees = employeeRepository.searchEmployees(
                EmployeeService.blankToNull(search), departmentId, EmployeeStatus.ACTIVE, pageable);

        List<Long> employeeIds = employees.getContent().stream().map(Employee::getId).collect(Collectors.toList());
        List<LeaveBalance> balances = employeeIds.isEmpty()
                ? List.of()
                : leaveBalanceRepository.findByEmployeesAndYear(employeeIds, year);
        Map<Long, LeaveRule> rulesByGrade = leaveRuleRepository.findAll()
                .stream()
                .collect(Collectors.toMap(r -> r.getGrade().getId(), Function.identity()));

        List<EmployeeLeaveBalanceResponse> responses = employees.getContent()
                .stream()
                .map(employee -> {
                    LeaveRule rule = employee.getGrade() != null ? rulesByGrade.get(employee.getGrade().getId()) : null;
                    BigDecimal annualUsed = sumUsed(balances, employee.getId(), LeaveCategory.ANNUAL);
                    BigDecimal medicalUsed = sumUsed(balances, employee.getId(), LeaveCategory.MEDICAL);
                    BigDecimal annualLimit = rule != null ? rule.getAnnualLimit() : BigDecimal.ZERO;
                    BigDecimal medicalLimit = rule != null ? rule.getMedicalLimit() : BigDecimal.ZERO;

                    return EmployeeLeaveBalanceResponse.builder()
                            .employeeId(employee.getId())
                            .employeeCode(employee.getEmployeeCode())
                            .fullName(employee.getFullName())
                            .departmentName(employee.getDepartment() != null ? employee.getDepartment().getName() : null)
                            .gradeName(employee.getGrade() != null ? employee.getGrade().getName() : null)
                            .year(year)
                            .annualUsed(annualUsed)
                            .annualLimit(annualLimit)
                            .annualRemaining(remaining(annualLimit, annualUsed))
                            .medicalUsed(medicalUsed)
                            .medicalLimit(medicalLimit)
                            .medicalRemaining(remaining(medicalLimit, medicalUsed))
                            .build();
                })
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, safePage, safeSize, employees.getTotalElements());
    }

    @Transactional(readOnly = true)
    public List<LeaveRuleResponse> getRules() {
        Map<Long, LeaveRule> rulesByGrade = leaveRuleRepository.findAll()
                .stream()
                .collect(Collectors.toMap(r -> r.getGrade().getId(), Function.identity()));

        return gradeRepository.findAllByOrderByNameAsc()
                .stream()
                .map(grade -> {
                    LeaveRule rule = rulesByGrade.get(grade.getId());
                    return LeaveRuleResponse.builder()
                            .ruleId(rule != null ? rule.getId() : null)
                            .gradeId(grade.getId())
                            .gradeName(grade.getName())
                            .annualLimit(rule != null ? rule.getAnnualLimit() : BigDecimal.ZERO)
                            .medicalLimit(rule != null ? rule.getMedicalLimit() : BigDecimal.ZERO)
                            .build();
                })
                .collect(Collectors.toList());
    }

    @Transactional
    public LeaveRuleResponse saveRule(LeaveRuleRequest request) {
        Grade grade = gradeRepository.findById(request.getGradeId())
                .orElseThrow(() -> new ResourceNotFoundException("Grade", "id", request.getGradeId()));

        LeaveRule rule = leaveRuleRepository.findByGradeId(grade.getId())
                .orElseGet(() -> LeaveRule.builder().grade(grade).build());
        boolean isNew = rule.getId() == null;

        rule.setAnnualLimit(request.getAnnualLimit());
        rule.setMedicalLimit(request.getMedicalLimit());
        LeaveRule saved = leaveRuleRepository.save(rule);

        LeaveRuleResponse response = LeaveRuleResponse.builder()
                .ruleId(saved.getId())
                .gradeId(grade.getId())
                .gradeName(grade.getName())
                .annualLimit(saved.getAnnualLimit())
                .medicalLimit(saved.getMedicalLimit())
                .build();
        auditService.record(isNew ? Constants.AUDIT_CREATE : Constants.AUDIT_UPDATE,
                TABLE_LEAVE_RULES, saved.getId(), null, response);

        log.info("Leave rule saved for grade {}: annual {}, medical {}",
                grade.getName(), saved.getAnnualLimit(), saved.getMedicalLimit());
        return response;
    }

    @Transactional(readOnly = true)
    public List<LeaveTypeResponse> getLeaveTypes() {
        return leaveTypeRepository.findAll(Sort.by("id"))
                .stream()
                .map(type -> new LeaveTypeResponse(type.getId(), type.getName(), leaveTypeResolver.resolve(type.getId())))
                .collect(Collectors.toList());
    }

    private LeaveRequest findLeaveRequest(Long id) {
        return leaveRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("LeaveRequest", "id", id));
    }

    private BigDecimal sumUsed(List<LeaveBalance> balances, Long employeeId, LeaveCategory category) {
        return balances.stream()
                .filter(b -> b.getEmployee().getId().equals(employeeId))
                .filter(b -> leaveTypeResolver.resolve(b.getLeaveType().getId()) == category)
                .map(LeaveBalance::getUsedDays)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal remaining(BigDecimal limit, BigDecimal used) {
        if (limit == null || limit.signum() <= 0) {
            return null;
        }
        return limit.subtract(used).max(BigDecimal.ZERO);
    }

    private int clampPageSize(int pageSize) {
        return Math.min(Math.max(pageSize, 1), Constants.MAX_PAGE_SIZE);
    }

    private CalendarRestrictionResponse mapToRestrictionResponse(CalendarRestriction restriction) {
        return CalendarRestrictionResponse.builder()
                .id(restriction.getId())
                .date(restriction.getDate())
                .type(restriction.getType())
                .reason(restriction.getReason())
                .build();
    }

    LeaveRequestResponse mapToLeaveRequestResponse(LeaveRequest request) {
        return LeaveRequestResponse.builder()
                .id(request.getId())
                .employeeId(request.getEmployee().getId())
                .employeeCode(request.getEmployee().getEmployeeCode())
                .employeeName(request.getEmployee().getFullName())
                .leaveTypeId(request.getLeaveType().getId())
                .leaveTypeName(request.getLeaveType().getName())
                .leaveCategory(leaveTypeResolver.resolve(request.getLeaveType().getId()))
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .durationHours(request.getDurationHours())
                .durationDays(durationCalculator.hoursToDays(request.getDurationHours()))
                .departmentName(request.getDepartment() != null ? request.getDepartment().getName() : null)
                .reason(request.getReason())
                .status(request.getStatus())
                .decidedByUserId(request.getDecidedByUserId())
                .decidedAt(request.getDecidedAt())
                .decisionNote(request.getDecisionNote())
                .createdAt(request.getCreatedAt())
                .build();
    }
}
