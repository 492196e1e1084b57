package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.config.LeavePolicyProperties;
import com.PeopleCore.hr_backend.enums.LeaveCategory;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.Grade;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import com.PeopleCore.hr_backend.model.LeaveRule;
import com.PeopleCore.hr_backend.model.UnpaidLeave;
import com.PeopleCore.hr_backend.repository.LeaveRuleRepository;
import com.PeopleCore.hr_backend.repository.UnpaidLeaveRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntitlementBreachService")
class EntitlementBreachServiceTest {

    @Mock
    private LeaveRuleRepository leaveRuleRepository;

    @Mock
    private UnpaidLeaveRepository unpaidLeaveRepository;

    private EntitlementBreachService breachService;
    private Employee employee;
    private LeaveRequest request;

    @BeforeEach
    void setUp() {
        breachService = new EntitlementBreachService(leaveRuleRepository, unpaidLeaveRepository,
                new LeavePolicyProperties());

        employee = Employee.builder()
                .id(7L)
                .employeeCode("E-007")
                .fullName("Nimal Perera")
                .grade(Grade.builder().id(3L).name("G3").build())
                .build();

        request = LeaveRequest.builder()
                .id(42L)
                .employee(employee)
                .startDate(LocalDate.of(2026, 5, 4))
                .endDate(LocalDate.of(2026, 5, 5))
                .durationHours(new BigDecimal("18"))
                .build();
    }

    @Test
    @DisplayName("Files one pending unpaid leave for the excess over the limit")
    void filesExcessAsUnpaidLeave() {
        when(unpaidLeaveRepository.save(any(UnpaidLeave.class))).thenAnswer(inv -> inv.getArgument(0));

        Optional<UnpaidLeave> result = breachService.generateForBreach(
                request, LeaveCategory.ANNUAL, new BigDecimal("15.00"), new BigDecimal("14"));

        ArgumentCaptor<UnpaidLeave> captor = ArgumentCaptor.forClass(UnpaidLeave.class);
        verify(unpaidLeaveRepository).save(captor.capture());
        UnpaidLeave saved = captor.getValue();

        assertThat(result).isPresent();
        assertThat(saved.getTotalDays()).isEqualByComparingTo("1.00");
        assertThat(saved.getStatus()).isEqualTo(UnpaidLeaveStatus.PENDING);
        assertThat(saved.getStartDate()).isEqualTo(request.getStartDate());
        assertThat(saved.getEndDate()).isEqualTo(request.getEndDate());
        assertThat(saved.getReason()).isEqualTo("Annual Leave limit (14 days) exceeded by 1.00 days by this request.");
    }

    @Test
    @DisplayName("No limit configured means no breach")
    void zeroLimitSkips() {
        Optional<UnpaidLeave> result = breachService.generateForBreach(
                request, LeaveCategory.ANNUAL, new BigDecimal("30.00"), BigDecimal.ZERO);

        assertThat(result).isEmpty();
        verify(unpaidLeaveRepository, never()).save(any());
    }

    @Test
    @DisplayName("Excess within tolerance is ignored")
    void withinToleranceSkips() {
        Optional<UnpaidLeave> result = breachService.generateForBreach(
                request, LeaveCategory.MEDICAL, new BigDecimal("7.01"), new BigDecimal("7"));

        assertThat(result).isEmpty();
        verify(unpaidLeaveRepository, never()).save(any());
    }

    @Test
    @DisplayName("Leave types outside annual and medical are never checked")
    void otherCategorySkips() {
        Optional<UnpaidLeave> result = breachService.generateForBreach(
                request, LeaveCategory.OTHER, new BigDecimal("50.00"), new BigDecimal("14"));

        assertThat(result).isEmpty();
        verify(unpaidLeaveRepository, never()).save(any());
    }

    @Test
    @DisplayName("Limit comes from the grade rule for the request's category")
    void resolvesLimitByCategory() {
        LeaveRule rule = LeaveRule.builder()
                .annualLimit(new BigDecimal("14"))
                .medicalLimit(new BigDecimal("7"))
                .build();
        when(leaveRuleRepository.findByGradeId(3L)).thenReturn(Optional.of(rule));

        assertThat(breachService.resolveLimit(employee, LeaveCategory.ANNUAL)).isEqualByComparingTo("14");
        assertThat(breachService.resolveLimit(employee, LeaveCategory.MEDICAL)).isEqualByComparingTo("7");
        assertThat(breachService.resolveLimit(employee, LeaveCategory.OTHER)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Employee without a grade has no limit")
    void noGradeNoLimit() {
        employee.setGrade(null);

        assertThat(breachService.resolveLimit(employee, LeaveCategory.ANNUAL)).isEqualByComparingTo(BigDecimal.ZERO);
        verify(leaveRuleRepository, never()).findByGradeId(any());
    }
}
