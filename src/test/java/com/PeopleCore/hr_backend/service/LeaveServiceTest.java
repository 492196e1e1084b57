package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.LeaveDecisionRequest;
import com.PeopleCore.hr_backend.dto.response.LeaveDecisionResponse;
import com.PeopleCore.hr_backend.enums.LeaveAction;
import com.PeopleCore.hr_backend.enums.LeaveStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import com.PeopleCore.hr_backend.model.LeaveType;
import com.PeopleCore.hr_backend.repository.CalendarRestrictionRepository;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.GradeRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceRepository;
import com.PeopleCore.hr_backend.repository.LeaveRequestRepository;
import com.PeopleCore.hr_backend.repository.LeaveRuleRepository;
import com.PeopleCore.hr_backend.repository.LeaveTypeRepository;
import com.PeopleCore.hr_backend.util.Constants;
import com.PeopleCore.hr_backend.util.LeaveDurationCalculator;
import com.PeopleCore.hr_backend.util.LeaveTypeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaveService decisions")
class LeaveServiceTest {

    @Mock private LeaveRequestRepository leaveRequestRepository;
    @Mock private LeaveTypeRepository leaveTypeRepository;
    @Mock private LeaveRuleRepository leaveRuleRepository;
    @Mock private LeaveBalanceRepository leaveBalanceRepository;
    @Mock private CalendarRestrictionRepository calendarRestrictionRepository;
    @Mock private EmployeeRepository employeeRepository;
    @Mock private GradeRepository gradeRepository;
    @Mock private LeaveBalanceService leaveBalanceService;
    @Mock private EntitlementBreachService entitlementBreachService;
    @Mock private UnpaidLeaveService unpaidLeaveService;
    @Mock private LeaveDurationCalculator durationCalculator;
    @Mock private LeaveTypeResolver leaveTypeResolver;
    @Mock private AuditService auditService;

    @InjectMocks
    private LeaveService leaveService;

    private LeaveRequest leaveRequest;

    @BeforeEach
    void setUp() {
        leaveRequest = LeaveRequest.builder()
                .id(10L)
                .employee(Employee.builder().id(1L).employeeCode("E-001").fullName("Kamala Silva").build())
                .leaveType(LeaveType.builder().id(1L).name("Annual").build())
                .startDate(LocalDate.of(2026, 6, 1))
                .endDate(LocalDate.of(2026, 6, 1))
                .durationHours(new BigDecimal("9.00"))
                .status(LeaveStatus.PENDING)
                .build();
    }

    private static LeaveDecisionRequest decision(LeaveAction action, String note) {
        LeaveDecisionRequest request = new LeaveDecisionRequest();
        request.setAction(action);
        request.setNote(note);
        return request;
    }

    @Test
    @DisplayName("Approving an already decided request fails without writing anything")
    void approveDecidedRequestFails() {
        leaveRequest.setStatus(LeaveStatus.APPROVED);
        when(leaveRequestRepository.findById(10L)).thenReturn(Optional.of(leaveRequest));

        assertThatThrownBy(() -> leaveService.decide(10L, decision(LeaveAction.APPROVE, null), 99L))
                .isInstanceOf(InvalidStateException.class);

        verify(leaveRequestRepository, never()).save(any());
        verifyNoInteractions(leaveBalanceService, entitlementBreachService, auditService);
    }

    @Test
    @DisplayName("Rejecting a decided request fails too")
    void rejectDecidedRequestFails() {
        leaveRequest.setStatus(LeaveStatus.REJECTED);
        when(leaveRequestRepository.findById(10L)).thenReturn(Optional.of(leaveRequest));

        assertThatThrownBy(() -> leaveService.decide(10L, decision(LeaveAction.REJECT, "again"), 99L))
                .isInstanceOf(InvalidStateException.class);

        verify(leaveRequestRepository, never()).save(any());
    }

    @Test
    @DisplayName("Rejecting a pending request leaves balances alone")
    void rejectPendingRequest() {
        when(leaveRequestRepository.findById(10L)).thenReturn(Optional.of(leaveRequest));
        when(leaveRequestRepository.save(any(LeaveRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        LeaveDecisionResponse response = leaveService.decide(10L, decision(LeaveAction.REJECT, "Busy month"), 99L);

        assertThat(response.getStatus()).isEqualTo(LeaveStatus.REJECTED);
        assertThat(response.getMessage()).isEqualTo(Constants.MSG_REQUEST_REJECTED);
        assertThat(leaveRequest.getDecidedByUserId()).isEqualTo(99L);
        assertThat(leaveRequest.getDecisionNote()).isEqualTo("Busy month");
        verifyNoInteractions(leaveBalanceService, entitlementBreachService);
    }

    @Test
    @DisplayName("Responding is allowed on a decided request and keeps its status")
    void respondOnDecidedRequest() {
        leaveRequest.setStatus(LeaveStatus.APPROVED);
        when(leaveRequestRepository.findById(10L)).thenReturn(Optional.of(leaveRequest));
        when(leaveRequestRepository.save(any(LeaveRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        LeaveDecisionResponse response = leaveService.decide(10L, decision(LeaveAction.RESPOND, "Noted"), 99L);

        assertThat(response.getStatus()).isEqualTo(LeaveStatus.APPROVED);
        assertThat(response.getMessage()).isEqualTo(Constants.MSG_RESPONSE_SAVED);
        assertThat(leaveRequest.getDecisionNote()).isEqualTo("Noted");
        verifyNoInteractions(leaveBalanceService);
    }

    @Test
    @DisplayName("Unknown request is reported as not found")
    void unknownRequest() {
        when(leaveRequestRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> leaveService.decide(404L, decision(LeaveAction.APPROVE, null), 1L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
