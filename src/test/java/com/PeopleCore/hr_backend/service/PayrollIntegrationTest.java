package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.AllowanceRequest;
import com.PeopleCore.hr_backend.dto.request.BasicSalaryRequest;
import com.PeopleCore.hr_backend.dto.request.BonusRequest;
import com.PeopleCore.hr_backend.dto.request.DeductionRequest;
import com.PeopleCore.hr_backend.dto.request.EtfEpfConfigRequest;
import com.PeopleCore.hr_backend.dto.request.PeriodBatchRequest;
import com.PeopleCore.hr_backend.dto.response.BatchResult;
import com.PeopleCore.hr_backend.dto.response.EtfEpfProcessItem;
import com.PeopleCore.hr_backend.dto.response.EtfEpfTransactionResponse;
import com.PeopleCore.hr_backend.dto.response.GrossEarnings;
import com.PeopleCore.hr_backend.dto.response.PayrollStatusResponse;
import com.PeopleCore.hr_backend.dto.response.PayrollTransferResponse;
import com.PeopleCore.hr_backend.dto.response.PayslipResponse;
import com.PeopleCore.hr_backend.enums.DeductionBasis;
import com.PeopleCore.hr_backend.enums.TransferStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.EtfEpfTransaction;
import com.PeopleCore.hr_backend.model.OvertimeAdjustment;
import com.PeopleCore.hr_backend.model.PayrollTransfer;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.EtfEpfTransactionRepository;
import com.PeopleCore.hr_backend.repository.OvertimeAdjustmentRepository;
import com.PeopleCore.hr_backend.repository.PayrollTransferRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
@DisplayName("Payroll and EPF/ETF processing")
class PayrollIntegrationTest {

    private static final int YEAR = 2026;
    private static final int MONTH = 3;

    @Autowired private PayrollService payrollService;
    @Autowired private EtfEpfService etfEpfService;
    @Autowired private EarningsService earningsService;
    @Autowired private SalaryComponentService salaryComponentService;
    @Autowired private EmployeeRepository employeeRepository;
    @Autowired private PayrollTransferRepository transferRepository;
    @Autowired private EtfEpfTransactionRepository etfEpfTransactionRepository;
    @Autowired private OvertimeAdjustmentRepository overtimeAdjustmentRepository;

    private Employee employee;

    @BeforeEach
    void setUp() {
        employee = employeeRepository.save(Employee.builder()
                .employeeCode("E-200")
                .fullName("Ruwan Jayasinghe")
                .epfNo("EPF-200")
                .joiningDate(LocalDate.of(2023, 8, 1))
                .build());

        BasicSalaryRequest salary = new BasicSalaryRequest();
        salary.setEmployeeId(employee.getId());
        salary.setBasicSalary(new BigDecimal("50000"));
        salaryComponentService.setBasicSalary(salary);

        AllowanceRequest allowance = new AllowanceRequest();
        allowance.setEmployeeId(employee.getId());
        allowance.setName("Transport");
        allowance.setAmount(new BigDecimal("2000"));
        allowance.setEffectiveFrom(LocalDate.of(YEAR, MONTH, 1));
        salaryComponentService.addAllowance(allowance);

        EtfEpfConfigRequest config = new EtfEpfConfigRequest();
        config.setEmployeeId(employee.getId());
        etfEpfService.createConfig(config);
    }

    private PeriodBatchRequest batch(Long... employeeIds) {
        PeriodBatchRequest request = new PeriodBatchRequest();
        request.setEmployeeIds(List.of(employeeIds));
        request.setYear(YEAR);
        request.setMonth(MONTH);
        request.setPaymentDate(LocalDate.of(YEAR, MONTH, 28));
        return request;
    }

    @Test
    @DisplayName("Gross includes basic and a whole-month allowance")
    void grossForPeriod() {
        GrossEarnings earnings = earningsService.computeGross(employee.getId(), YEAR, MONTH);

        assertThat(earnings.getBasic()).isEqualByComparingTo("50000");
        assertThat(earnings.getAllowances()).isEqualByComparingTo("2000");
        assertThat(earnings.getGross()).isEqualByComparingTo("52000");
        assertThat(earnings.getBreakdown()).extracting("name").containsExactly("Basic Salary", "Transport");
    }

    private void overtimeAt(String hours, LocalDateTime createdAt) {
        overtimeAdjustmentRepository.save(OvertimeAdjustment.builder()
                .employee(employee)
                .otHours(new BigDecimal(hours))
                .otRate(new BigDecimal("100"))
                .createdAt(createdAt)
                .build());
    }

    private void bonusOn(String amount, LocalDate effectiveDate) {
        BonusRequest bonus = new BonusRequest();
        bonus.setEmployeeId(employee.getId());
        bonus.setDescription("Performance Bonus");
        bonus.setAmount(new BigDecimal(amount));
        bonus.setEffectiveDate(effectiveDate);
        salaryComponentService.addBonus(bonus);
    }

    @Test
    @DisplayName("Overtime recorded up to the last minute of the month counts; the next month's does not")
    void overtimeMonthBoundary() {
        overtimeAt("2.5", LocalDateTime.of(YEAR, MONTH, 31, 23, 59));
        overtimeAt("1", LocalDateTime.of(YEAR, MONTH + 1, 1, 0, 0));

        GrossEarnings march = earningsService.computeGross(employee.getId(), YEAR, MONTH);
        GrossEarnings april = earningsService.computeGross(employee.getId(), YEAR, MONTH + 1);

        assertThat(march.getOvertime()).isEqualByComparingTo("250");
        assertThat(march.getGross()).isEqualByComparingTo("52250");
        assertThat(april.getOvertime()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Bonus dated on the last day of the month counts; one dated the next day does not")
    void bonusMonthBoundary() {
        bonusOn("300", LocalDate.of(YEAR, MONTH, 31));
        bonusOn("999", LocalDate.of(YEAR, MONTH + 1, 1));

        GrossEarnings march = earningsService.computeGross(employee.getId(), YEAR, MONTH);

        assertThat(march.getBonuses()).isEqualByComparingTo("300");
        assertThat(march.getGross()).isEqualByComparingTo("52300");
        assertThat(earningsService.computeGross(employee.getId(), YEAR, MONTH + 1).getBonuses())
                .isEqualByComparingTo("999");
    }

    @Test
    @DisplayName("Gross is the sum of all four components")
    void grossSumsAllComponents() {
        overtimeAt("2.5", LocalDateTime.of(YEAR, MONTH, 15, 18, 0));
        bonusOn("300", LocalDate.of(YEAR, MONTH, 20));

        GrossEarnings earnings = earningsService.computeGross(employee.getId(), YEAR, MONTH);

        assertThat(earnings.getGross()).isEqualByComparingTo(earnings.getBasic()
                .add(earnings.getAllowances())
                .add(earnings.getOvertime())
                .add(earnings.getBonuses()));
        assertThat(earnings.getGross()).isEqualByComparingTo("52550");
        assertThat(payrollService.getPayslip(employee.getId(), YEAR, MONTH).getSummary().getGrossSalary())
                .isEqualByComparingTo("52550.00");
    }

    @Test
    @DisplayName("Unknown employee yields zero gross")
    void unknownEmployeeGross() {
        assertThat(earningsService.computeGross(999_999L, YEAR, MONTH).getGross()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Employees joining after the period are left out of its process list")
    void processListExcludesLaterJoiners() {
        employeeRepository.save(Employee.builder()
                .employeeCode("E-202")
                .fullName("Nuwan Perera")
                .joiningDate(LocalDate.of(YEAR, MONTH + 1, 2))
                .build());

        List<EtfEpfProcessItem> march = etfEpfService.getProcessList(YEAR, MONTH);
        List<EtfEpfProcessItem> april = etfEpfService.getProcessList(YEAR, MONTH + 1);

        assertThat(march).extracting(EtfEpfProcessItem::getEmployeeCode).contains("E-200").doesNotContain("E-202");
        assertThat(april).extracting(EtfEpfProcessItem::getEmployeeCode).contains("E-200", "E-202");
    }

    @Test
    @DisplayName("Allowance starting after the period is not counted")
    void allowanceOutsidePeriod() {
        assertThat(earningsService.computeGross(employee.getId(), YEAR, 2).getGross()).isEqualByComparingTo("50000");
    }

    @Test
    @DisplayName("EPF/ETF transaction applies default rates to gross and reprocessing is a no-op")
    void etfEpfProcessing() {
        BatchResult<EtfEpfTransactionResponse> first = etfEpfService.processPayments(batch(employee.getId()), null);

        assertThat(first.getProcessedCount()).isEqualTo(1);
        EtfEpfTransactionResponse tx = first.getProcessed().get(0);
        assertThat(tx.getGrossSalary()).isEqualByComparingTo("52000.00");
        assertThat(tx.getEmployeeEpfAmount()).isEqualByComparingTo("4160.00");
        assertThat(tx.getEpfEmployerShare()).isEqualByComparingTo("6240.00");
        assertThat(tx.getEmployerEtfAmount()).isEqualByComparingTo("1560.00");

        BatchResult<EtfEpfTransactionResponse> second = etfEpfService.processPayments(batch(employee.getId()), null);

        assertThat(second.getProcessedCount()).isZero();
        assertThat(second.getSkippedCount()).isEqualTo(1);
        assertThat(etfEpfTransactionRepository.countByEmployeeIdAndPeriodYearAndPeriodMonth(
                employee.getId(), YEAR, MONTH)).isEqualTo(1);
    }

    @Test
    @DisplayName("Unconfigured and unknown employees are skipped without failing the batch")
    void etfEpfSkipsUnconfigured() {
        Employee other = employeeRepository.save(Employee.builder()
                .employeeCode("E-201")
                .fullName("Dilani Wickramasinghe")
                .build());

        BatchResult<EtfEpfTransactionResponse> result = etfEpfService.processPayments(
                batch(other.getId(), 999_999L, employee.getId()), null);

        assertThat(result.getProcessedCount()).isEqualTo(1);
        assertThat(result.getSkippedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Running the salary transfer twice leaves one transfer per employee")
    void transferIsIdempotent() {
        BatchResult<PayrollTransferResponse> first = payrollService.processSalaryTransfer(batch(employee.getId()), null);
        BatchResult<PayrollTransferResponse> second = payrollService.processSalaryTransfer(batch(employee.getId()), null);

        assertThat(first.getProcessedCount()).isEqualTo(1);
        assertThat(second.getProcessedCount()).isZero();
        assertThat(second.getSkippedCount()).isEqualTo(1);
        assertThat(transferRepository.countByEmployeeIdAndPeriodYearAndPeriodMonth(
                employee.getId(), YEAR, MONTH)).isEqualTo(1);

        PayrollTransfer transfer = transferRepository.findByEmployeeIdAndPeriodYearAndPeriodMonth(
                employee.getId(), YEAR, MONTH).orElseThrow();
        assertThat(transfer.getStatus()).isEqualTo(TransferStatus.COMPLETED);
        assertThat(transfer.getGrossSalary()).isEqualByComparingTo("52000.00");
        assertThat(transfer.getTotalDeductions()).isEqualByComparingTo("4000.00");
        assertThat(transfer.getNetSalary()).isEqualByComparingTo("48000.00");
    }

    @Test
    @DisplayName("Payslip, transfer and EPF transaction report the same gross")
    void grossIsConsistentAcrossViews() {
        PayslipResponse payslip = payrollService.getPayslip(employee.getId(), YEAR, MONTH);
        payrollService.processSalaryTransfer(batch(employee.getId()), null);
        etfEpfService.processPayments(batch(employee.getId()), null);

        PayrollTransfer transfer = transferRepository.findByEmployeeIdAndPeriodYearAndPeriodMonth(
                employee.getId(), YEAR, MONTH).orElseThrow();
        EtfEpfTransaction tx = etfEpfTransactionRepository.findByPeriodYearAndPeriodMonthOrderByIdAsc(YEAR, MONTH)
                .get(0);

        assertThat(payslip.getSummary().getGrossSalary()).isEqualByComparingTo("52000.00");
        assertThat(transfer.getGrossSalary()).isEqualByComparingTo(payslip.getSummary().getGrossSalary());
        assertThat(tx.getGrossSalary()).isEqualByComparingTo(payslip.getSummary().getGrossSalary());
        assertThat(payslip.getSummary().getNetSalary()).isEqualByComparingTo(transfer.getNetSalary());
    }

    @Test
    @DisplayName("Payslip excludes EPF-named deductions and prices percent deductions on basic")
    void payslipDeductions() {
        DeductionRequest loan = new DeductionRequest();
        loan.setEmployeeId(employee.getId());
        loan.setName("Staff Loan");
        loan.setBasis(DeductionBasis.PERCENT);
        loan.setPercent(new BigDecimal("2"));
        loan.setEffectiveDate(LocalDate.of(YEAR, MONTH, 10));
        salaryComponentService.addDeduction(loan);

        DeductionRequest manualEpf = new DeductionRequest();
        manualEpf.setEmployeeId(employee.getId());
        manualEpf.setName("epf adjustment");
        manualEpf.setBasis(DeductionBasis.FIXED);
        manualEpf.setAmount(new BigDecimal("750"));
        manualEpf.setEffectiveDate(LocalDate.of(YEAR, MONTH, 10));
        salaryComponentService.addDeduction(manualEpf);

        PayslipResponse payslip = payrollService.getPayslip(employee.getId(), YEAR, MONTH);

        assertThat(payslip.getDeductions().getTotal()).isEqualByComparingTo("5000.00");
        assertThat(payslip.getDeductions().getBreakdown()).extracting("name")
                .contains("Staff Loan")
                .doesNotContain("epf adjustment");
        assertThat(payslip.getEmployerContributions().getEpf()).isEqualByComparingTo("6000.00");
        assertThat(payslip.getEmployerContributions().getEtf()).isEqualByComparingTo("1500.00");
        assertThat(payslip.getSummary().getNetSalary()).isEqualByComparingTo("47000.00");
    }

    @Test
    @DisplayName("Bank transfer refreshes pending rows and leaves completed ones")
    void initiateBankTransfer() {
        BatchResult<PayrollTransferResponse> initiated = payrollService.initiateBankTransfer(batch(employee.getId()), null);
        assertThat(initiated.getProcessed().get(0).getStatus()).isEqualTo(TransferStatus.PROCESSING);

        PayrollStatusResponse inProgress = payrollService.getPayrollStatus(YEAR, MONTH);
        assertThat(inProgress.getCurrentStep()).isEqualTo(1);
        assertThat(inProgress.getSteps().get(2).getStatus()).isEqualTo("In Progress");

        BatchResult<PayrollTransferResponse> again = payrollService.initiateBankTransfer(batch(employee.getId()), null);
        assertThat(again.getProcessedCount()).isEqualTo(1);
        assertThat(transferRepository.countByPeriodYearAndPeriodMonth(YEAR, MONTH)).isEqualTo(1);

        PayrollTransfer transfer = transferRepository.findByEmployeeIdAndPeriodYearAndPeriodMonth(
                employee.getId(), YEAR, MONTH).orElseThrow();
        transfer.setStatus(TransferStatus.COMPLETED);
        transferRepository.save(transfer);

        BatchResult<PayrollTransferResponse> skipped = payrollService.initiateBankTransfer(batch(employee.getId()), null);
        assertThat(skipped.getSkippedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Payroll status reaches the last step once transfers are completed")
    void payrollStatusSteps() {
        PayrollStatusResponse before = payrollService.getPayrollStatus(YEAR, MONTH);
        assertThat(before.getCurrentStep()).isEqualTo(1);
        assertThat(before.getSteps()).extracting("status").containsOnly("Not Started");

        payrollService.processSalaryTransfer(batch(employee.getId()), null);

        PayrollStatusResponse after = payrollService.getPayrollStatus(YEAR, MONTH);
        assertThat(after.getCurrentStep()).isEqualTo(4);
        assertThat(after.getTotalSteps()).isEqualTo(4);
        assertThat(after.getSteps()).extracting("status").containsOnly("Completed");
        assertThat(after.getLastRunAt()).isNotNull();
    }

    @Test
    @DisplayName("Only one statutory configuration per employee")
    void duplicateConfigRejected() {
        EtfEpfConfigRequest config = new EtfEpfConfigRequest();
        config.setEmployeeId(employee.getId());

        assertThatThrownBy(() -> etfEpfService.createConfig(config)).isInstanceOf(InvalidStateException.class);
    }
}
