package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.LeaveBalance;
import com.PeopleCore.hr_backend.model.LeaveBalanceEntry;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import com.PeopleCore.hr_backend.model.LeaveType;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceEntryRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaveBalanceService bookings")
class LeaveBalanceServiceTest {

    private static final int YEAR = 2026;

    @Mock private LeaveBalanceRepository leaveBalanceRepository;
    @Mock private LeaveBalanceEntryRepository leaveBalanceEntryRepository;
    @Mock private EmployeeRepository employeeRepository;

    @InjectMocks
    private LeaveBalanceService leaveBalanceService;

    private Employee employee;
    private LeaveRequest request;

    @BeforeEach
    void setUp() {
        employee = Employee.builder().id(1L).employeeCode("E-001").fullName("Kamala Silva").build();
        request = LeaveRequest.builder()
                .id(10L)
                .employee(employee)
                .leaveType(LeaveType.builder().id(1L).name("Annual").build())
                .startDate(LocalDate.of(YEAR, 6, 1))
                .endDate(LocalDate.of(YEAR, 6, 1))
                .build();
    }

    @Test
    @DisplayName("First booking locks the employee row, re-reads the balance, then inserts it")
    void firstBookingSerializesOnEmployee() {
        when(leaveBalanceRepository.findForUpdate(1L, 1L, YEAR)).thenReturn(Optional.empty(), Optional.empty());
        when(employeeRepository.findForUpdate(1L)).thenReturn(Optional.of(employee));
        when(leaveBalanceRepository.save(any(LeaveBalance.class))).thenAnswer(inv -> inv.getArgument(0));
        when(leaveBalanceEntryRepository.sumDeltaDays(1L, 1L, YEAR)).thenReturn(new BigDecimal("2.00"));

        LeaveBalance balance = leaveBalanceService.applyApprovedLeave(request, new BigDecimal("2.00"), null);

        assertThat(balance.getUsedDays()).isEqualByComparingTo("2.00");
        InOrder order = inOrder(leaveBalanceRepository, employeeRepository, leaveBalanceEntryRepository);
        order.verify(leaveBalanceRepository).findForUpdate(1L, 1L, YEAR);
        order.verify(employeeRepository).findForUpdate(1L);
        order.verify(leaveBalanceRepository).findForUpdate(1L, 1L, YEAR);
        order.verify(leaveBalanceRepository).save(any(LeaveBalance.class));
        order.verify(leaveBalanceEntryRepository).save(any(LeaveBalanceEntry.class));
    }

    @Test
    @DisplayName("A balance created while waiting on the employee lock is reused, not inserted again")
    void concurrentFirstBookingReusesRow() {
        LeaveBalance created = LeaveBalance.builder()
                .id(5L).employee(employee).leaveType(request.getLeaveType()).year(YEAR)
                .usedDays(new BigDecimal("3.00"))
                .build();
        when(leaveBalanceRepository.findForUpdate(1L, 1L, YEAR)).thenReturn(Optional.empty(), Optional.of(created));
        when(employeeRepository.findForUpdate(1L)).thenReturn(Optional.of(employee));
        when(leaveBalanceRepository.save(created)).thenReturn(created);
        when(leaveBalanceEntryRepository.sumDeltaDays(1L, 1L, YEAR)).thenReturn(new BigDecimal("4.00"));

        LeaveBalance balance = leaveBalanceService.applyApprovedLeave(request, new BigDecimal("1.00"), null);

        assertThat(balance.getId()).isEqualTo(5L);
        assertThat(balance.getUsedDays()).isEqualByComparingTo("4.00");
        verify(leaveBalanceRepository).save(created);
    }

    @Test
    @DisplayName("An existing balance is updated under its own lock")
    void existingBalanceSkipsEmployeeLock() {
        LeaveBalance existing = LeaveBalance.builder()
                .id(5L).employee(employee).leaveType(request.getLeaveType()).year(YEAR)
                .usedDays(new BigDecimal("13.00"))
                .build();
        when(leaveBalanceRepository.findForUpdate(1L, 1L, YEAR)).thenReturn(Optional.of(existing));
        when(leaveBalanceRepository.save(existing)).thenReturn(existing);
        when(leaveBalanceEntryRepository.sumDeltaDays(1L, 1L, YEAR)).thenReturn(new BigDecimal("15.00"));

        LeaveBalance balance = leaveBalanceService.applyApprovedLeave(request, new BigDecimal("2.00"),
                new BigDecimal("14"));

        assertThat(balance.getUsedDays()).isEqualByComparingTo("15.00");
        assertThat(balance.getEntitledDays()).isEqualByComparingTo("14");
        verify(employeeRepository, never()).findForUpdate(any());
    }

    @Test
    @DisplayName("First booking for a deleted employee fails before writing")
    void missingEmployeeFails() {
        when(leaveBalanceRepository.findForUpdate(1L, 1L, YEAR)).thenReturn(Optional.empty());
        when(employeeRepository.findForUpdate(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> leaveBalanceService.applyApprovedLeave(request, BigDecimal.ONE, null))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(leaveBalanceRepository, never()).save(any());
        verify(leaveBalanceEntryRepository, never()).save(any());
    }
}
