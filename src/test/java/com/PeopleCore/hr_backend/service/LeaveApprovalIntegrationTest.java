package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.BasicSalaryRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveApplicationRequest;
import com.PeopleCore.hr_backend.dto.request.LeaveDecisionRequest;
import com.PeopleCore.hr_backend.dto.response.DeductionSummary;
import com.PeopleCore.hr_backend.dto.response.LeaveDecisionResponse;
import com.PeopleCore.hr_backend.dto.response.LeaveRequestResponse;
import com.PeopleCore.hr_backend.dto.response.UnpaidLeaveResponse;
import com.PeopleCore.hr_backend.enums.LeaveAction;
import com.PeopleCore.hr_backend.enums.LeaveStatus;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.Grade;
import com.PeopleCore.hr_backend.model.LeaveBalance;
import com.PeopleCore.hr_backend.model.LeaveRule;
import com.PeopleCore.hr_backend.model.UnpaidLeave;
import com.PeopleCore.hr_backend.repository.AuditLogRepository;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.GradeRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceEntryRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceRepository;
import com.PeopleCore.hr_backend.repository.LeaveRuleRepository;
import com.PeopleCore.hr_backend.repository.UnpaidLeaveRepository;
import com.PeopleCore.hr_backend.util.PayPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@DisplayName("Leave approval flow")
class LeaveApprovalIntegrationTest {

    private static final long ANNUAL = 1L;
    private static final long MEDICAL = 2L;
    private static final int YEAR = 2026;

    @Autowired private LeaveService leaveService;
    @Autowired private LeaveBalanceService leaveBalanceService;
    @Autowired private UnpaidLeaveService unpaidLeaveService;
    @Autowired private SalaryComponentService salaryComponentService;
    @Autowired private DeductionService deductionService;
    @Autowired private EmployeeRepository employeeRepository;
    @Autowired private GradeRepository gradeRepository;
    @Autowired private LeaveRuleRepository leaveRuleRepository;
    @Autowired private LeaveBalanceRepository leaveBalanceRepository;
    @Autowired private LeaveBalanceEntryRepository leaveBalanceEntryRepository;
    @Autowired private UnpaidLeaveRepository unpaidLeaveRepository;
    @Autowired private AuditLogRepository auditLogRepository;

    private Employee employee;

    @BeforeEach
    void setUp() {
        Grade grade = gradeRepository.save(Grade.builder().name("Executive").build());
        leaveRuleRepository.save(LeaveRule.builder()
                .grade(grade)
                .annualLimit(new BigDecimal("14"))
                .medicalLimit(new BigDecimal("7"))
                .build());

        employee = employeeRepository.save(Employee.builder()
                .employeeCode("E-100")
                .fullName("Ayesha Fernando")
                .grade(grade)
                .joiningDate(LocalDate.of(2024, 1, 15))
                .build());
    }

    private LeaveRequestResponse apply(long leaveTypeId, LocalDate start, LocalDate end, String hours) {
        LeaveApplicationRequest request = new LeaveApplicationRequest();
        request.setEmployeeId(employee.getId());
        request.setLeaveTypeId(leaveTypeId);
        request.setStartDate(start);
        request.setEndDate(end);
        request.setDurationHours(hours != null ? new BigDecimal(hours) : null);
        return leaveService.createLeaveRequest(request, null);
    }

    private LeaveDecisionResponse approve(Long requestId) {
        LeaveDecisionRequest decision = new LeaveDecisionRequest();
        decision.setAction(LeaveAction.APPROVE);
        return leaveService.decide(requestId, decision, null);
    }

    @Test
    @DisplayName("Approval past the annual limit files unpaid leave for the excess")
    void breachFilesUnpaidLeave() {
        LeaveRequestResponse earlier = apply(ANNUAL, LocalDate.of(YEAR, 2, 2), LocalDate.of(YEAR, 2, 14), "117");
        LeaveDecisionResponse first = approve(earlier.getId());

        assertThat(first.getUsedDays()).isEqualByComparingTo("13.00");
        assertThat(first.getUnpaidLeave()).isNull();

        LeaveRequestResponse latest = apply(ANNUAL, LocalDate.of(YEAR, 5, 4), LocalDate.of(YEAR, 5, 5), "18");
        LeaveDecisionResponse second = approve(latest.getId());

        assertThat(second.getStatus()).isEqualTo(LeaveStatus.APPROVED);
        assertThat(second.getUsedDays()).isEqualByComparingTo("15.00");
        assertThat(second.getUnpaidLeave()).isNotNull();
        assertThat(second.getUnpaidLeave().getTotalDays()).isEqualByComparingTo("1.00");

        List<UnpaidLeave> unpaid = unpaidLeaveRepository.findByEmployeeIdOrderByIdAsc(employee.getId());
        assertThat(unpaid).hasSize(1);
        assertThat(unpaid.get(0).getStatus()).isEqualTo(UnpaidLeaveStatus.PENDING);
        assertThat(unpaid.get(0).getStartDate()).isEqualTo(LocalDate.of(YEAR, 5, 4));
    }

    @Test
    @DisplayName("Used days always equal the ledger total")
    void usedDaysMatchLedger() {
        approve(apply(MEDICAL, LocalDate.of(YEAR, 3, 2), LocalDate.of(YEAR, 3, 2), "9").getId());
        approve(apply(MEDICAL, LocalDate.of(YEAR, 3, 9), LocalDate.of(YEAR, 3, 9), "4").getId());

        LeaveBalance balance = leaveBalanceRepository.findBalance(employee.getId(), MEDICAL, YEAR).orElseThrow();
        BigDecimal ledger = leaveBalanceEntryRepository.sumDeltaDays(employee.getId(), MEDICAL, YEAR);

        assertThat(balance.getUsedDays()).isEqualByComparingTo("1.44");
        assertThat(balance.getUsedDays()).isEqualByComparingTo(ledger);
        assertThat(leaveBalanceEntryRepository.findLedger(employee.getId(), MEDICAL, YEAR)).hasSize(2);
    }

    @Test
    @DisplayName("A second approval of the same request is refused and books nothing")
    void secondApprovalRefused() {
        Long requestId = apply(ANNUAL, LocalDate.of(YEAR, 4, 6), LocalDate.of(YEAR, 4, 6), "9").getId();
        approve(requestId);
        long auditRows = auditLogRepository.count();

        assertThatThrownBy(() -> approve(requestId)).isInstanceOf(InvalidStateException.class);

        assertThat(leaveBalanceEntryRepository.findLedger(employee.getId(), ANNUAL, YEAR)).hasSize(1);
        assertThat(leaveBalanceService.usedDays(employee.getId(), ANNUAL, YEAR)).isEqualByComparingTo("1.00");
        assertThat(auditLogRepository.count()).isEqualTo(auditRows);
    }

    @Test
    @DisplayName("Processing unpaid leave prices it at the daily rate and feeds deductions")
    void processedUnpaidLeaveIsDeducted() {
        BasicSalaryRequest salary = new BasicSalaryRequest();
        salary.setEmployeeId(employee.getId());
        salary.setBasicSalary(new BigDecimal("30000"));
        salaryComponentService.setBasicSalary(salary);

        approve(apply(MEDICAL, LocalDate.of(YEAR, 1, 5), LocalDate.of(YEAR, 1, 12), "72").getId());
        UnpaidLeave pending = unpaidLeaveRepository.findByEmployeeIdOrderByIdAsc(employee.getId()).get(0);
        assertThat(pending.getTotalDays()).isEqualByComparingTo("1.00");

        UnpaidLeaveResponse processed = unpaidLeaveService.processUnpaidLeave(pending.getId());

        assertThat(processed.getStatus()).isEqualTo(UnpaidLeaveStatus.PROCESSED);
        assertThat(processed.getDeductionAmount()).isEqualByComparingTo("1000.00");
        assertThat(processed.getProcessedAt()).isNotNull();

        DeductionSummary deductions = deductionService.computeDeductions(
                employee.getId(), PayPeriod.containing(processed.getProcessedAt().toLocalDate()));
        assertThat(deductions.getUnpaidLeaveTotal()).isEqualByComparingTo("1000.00");

        assertThatThrownBy(() -> unpaidLeaveService.processUnpaidLeave(pending.getId()))
                .isInstanceOf(InvalidStateException.class);
    }
}
