package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.PeriodBatchRequest;
import com.PeopleCore.hr_backend.dto.response.AvailableMonth;
import com.PeopleCore.hr_backend.dto.response.BatchResult;
import com.PeopleCore.hr_backend.dto.response.ContributionBreakdown;
import com.PeopleCore.hr_backend.dto.response.DeductionSummary;
import com.PeopleCore.hr_backend.dto.response.DepartmentPayrollReport;
import com.PeopleCore.hr_backend.dto.response.DepartmentPayrollSummary;
import com.PeopleCore.hr_backend.dto.response.GrossEarnings;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.dto.response.PayLine;
import com.PeopleCore.hr_backend.dto.response.PayrollDashboardSummary;
import com.PeopleCore.hr_backend.dto.response.PayrollStatusResponse;
import com.PeopleCore.hr_backend.dto.response.PayrollTransferResponse;
import com.PeopleCore.hr_backend.dto.response.PayslipResponse;
import com.PeopleCore.hr_backend.dto.response.TransferOverviewItem;
import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import com.PeopleCore.hr_backend.enums.TransferStatus;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.EtfEpfConfig;
import com.PeopleCore.hr_backend.model.PayrollCycle;
import com.PeopleCore.hr_backend.model.PayrollTransfer;
import com.PeopleCore.hr_backend.repository.AllowanceRepository;
import com.PeopleCore.hr_backend.repository.BonusRepository;
import com.PeopleCore.hr_backend.repository.DeductionRepository;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.EtfEpfConfigRepository;
import com.PeopleCore.hr_backend.repository.OvertimeAdjustmentRepository;
import com.PeopleCore.hr_backend.repository.PayrollCycleRepository;
import com.PeopleCore.hr_backend.repository.PayrollTransferRepository;
import com.PeopleCore.hr_backend.repository.UnpaidLeaveRepository;
import com.PeopleCore.hr_backend.util.Constants;
import com.PeopleCore.hr_backend.util.ContributionCalculator;
import com.PeopleCore.hr_backend.util.PayPeriod;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Payroll views and batch runs. Gross and deductions always come from {@link EarningsService}
 * and {@link DeductionService}; net pay is computed on demand and only stored as a transfer
 * snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollService {

    private static final String UNASSIGNED_DEPARTMENT = "Unassigned";
    private static final String STATUS_COMPLETED = "Completed";
    private static final String STATUS_NOT_STARTED = "Not Started";
    private static final String STATUS_IN_PROGRESS = "In Progress";

    private final EmployeeRepository employeeRepository;
    private final PayrollTransferRepository transferRepository;
    private final PayrollCycleRepository cycleRepository;
    private final EtfEpfConfigRepository etfEpfConfigRepository;
    private final UnpaidLeaveRepository unpaidLeaveRepository;
    private final AllowanceRepository allowanceRepository;
    private final BonusRepository bonusRepository;
    private final DeductionRepository deductionRepository;
    private final OvertimeAdjustmentRepository overtimeAdjustmentRepository;
    private final EmployeeService employeeService;
    private final EarningsService earningsService;
    private final DeductionService deductionService;
    private final ContributionCalculator contributionCalculator;
    private final AuditService auditService;

    // ---------- Payslip ----------

    @Transactional(readOnly = true)
    public PayslipResponse getPayslip(Long employeeId, Integer year, Integer month) {
        PayPeriod period = PayPeriod.require(year, month);
        Employee employee = employeeService.findEmployee(employeeId);

        GrossEarnings earnings = earningsService.computeGross(employeeId, period);
        DeductionSummary deductions = deductionService.computeDeductions(employeeId, period);

        List<PayLine> deductionLines = new ArrayList<>(deductions.getRegular());
        if (deductions.getUnpaidLeaveTotal().signum() != 0) {
            deductionLines.add(new PayLine("Unpaid Leave", round(deductions.getUnpaidLeaveTotal())));
        }
        deductionLines.add(new PayLine("EPF Employee (" + deductions.getEpfRate().stripTrailingZeros().toPlainString() + "%)",
                round(deductions.getEpfEmployeeAmount())));

        // Employer shares are quoted on basic salary, matching the deduction side
        EtfEpfConfig config = etfEpfConfigRepository.findByEmployeeId(employeeId).orElse(null);
        ContributionBreakdown employerShares = contributionCalculator.calculate(earnings.getBasic(), config);

        BigDecimal gross = round(earnings.getGross());
        BigDecimal totalDeductions = round(deductions.getTotal());

        return PayslipResponse.builder()
                .employee(PayslipResponse.EmployeeInfo.builder()
                        .id(employee.getId())
                        .employeeCode(employee.getEmployeeCode())
                        .fullName(employee.getFullName())
                        .designation(employee.getDesignation())
                        .departmentName(employee.getDepartment() != null ? employee.getDepartment().getName() : null)
                        .epfNo(employee.getEpfNo())
                        .build())
                .period(PayslipResponse.PeriodInfo.builder()
                        .year(period.getYear())
                        .month(period.getMonth())
                        .monthName(period.getMonthName())
                        .build())
                .earnings(PayslipResponse.Section.builder()
                        .breakdown(earnings.getBreakdown())
                        .total(gross)
                        .build())
                .deductions(PayslipResponse.Section.builder()
                        .breakdown(deductionLines)
                        .total(totalDeductions)
                        .build())
                .employerContributions(PayslipResponse.EmployerContributions.builder()
                        .epf(employerShares.getEmployerEpf())
                        .etf(employerShares.getEmployerEtf())
                        .build())
                .summary(PayslipResponse.Summary.builder()
                        .grossSalary(gross)
                        .totalDeductions(totalDeductions)
                        .netSalary(gross.subtract(totalDeductions))
                        .build())
                .build();
    }

    // ---------- Batch runs ----------

    /**
     * Records a completed transfer per listed employee. Employees that already have a transfer
     * for the period are skipped, so running the batch twice leaves one row each.
     */
    @Transactional
    public BatchResult<PayrollTransferResponse> processSalaryTransfer(PeriodBatchRequest request, Long userId) {
        PayPeriod period = PayPeriod.require(request.getYear(), request.getMonth());
        BatchResult<PayrollTransferResponse> result = BatchResult.<PayrollTransferResponse>builder().build();

        for (Long employeeId : request.getEmployeeIds()) {
            if (transferRepository.countByEmployeeIdAndPeriodYearAndPeriodMonth(
                    employeeId, period.getYear(), period.getMonth()) > 0) {
                log.warn("{} employee={} period={} reason=already transferred",
                        Constants.EVENT_TRANSFER_SKIP, employeeId, period);
                result.setSkippedCount(result.getSkippedCount() + 1);
                continue;
            }
            Optional<Employee> employee = employeeRepository.findById(employeeId);
            if (employee.isEmpty()) {
                log.warn("{} employee={} period={} reason=unknown employee",
                        Constants.EVENT_TRANSFER_SKIP, employeeId, period);
                result.setSkippedCount(result.getSkippedCount() + 1);
                continue;
            }

            PayrollTransfer transfer = PayrollTransfer.builder()
                    .employee(employee.get())
                    .periodYear(period.getYear())
                    .periodMonth(period.getMonth())
                    .paymentDate(request.getPaymentDate())
                    .status(TransferStatus.COMPLETED)
                    .processedBy(userId)
                    .build();
            applyFigures(transfer, period);

            result.getProcessed().add(mapToTransferResponse(transferRepository.save(transfer)));
        }

        PayrollCycle cycle = cycleRepository.save(PayrollCycle.builder()
                .periodYear(period.getYear())
                .periodMonth(period.getMonth())
                .processedCount(result.getProcessedCount())
                .skippedCount(result.getSkippedCount())
                .runBy(userId)
                .build());

        auditService.record(Constants.AUDIT_PROCESS, "payroll_transfers", period.toString(), null, result);
        log.info("Salary transfer run {} for {}: {} processed, {} skipped",
                cycle.getId(), period, result.getProcessedCount(), result.getSkippedCount());
        return result;
    }

    /**
     * Starts bank transfers: existing non-completed rows are refreshed with current figures and
     * new rows are inserted, all with status Processing.
     */
    @Transactional
    public BatchResult<PayrollTransferResponse> initiateBankTransfer(PeriodBatchRequest request, Long userId) {
        PayPeriod period = PayPeriod.require(request.getYear(), request.getMonth());
        BatchResult<PayrollTransferResponse> result = BatchResult.<PayrollTransferResponse>builder().build();

        for (Long employeeId : request.getEmployeeIds()) {
            Optional<PayrollTransfer> existing = transferRepository.findByEmployeeIdAndPeriodYearAndPeriodMonth(
                    employeeId, period.getYear(), period.getMonth());
            if (existing.isPresent() && existing.get().getStatus() == TransferStatus.COMPLETED) {
                log.warn("{} employee={} period={} reason=already completed",
                        Constants.EVENT_TRANSFER_SKIP, employeeId, period);
                result.setSkippedCount(result.getSkippedCount() + 1);
                continue;
            }

            PayrollTransfer transfer;
            if (existing.isPresent()) {
                transfer = existing.get();
            } else {
                Optional<Employee> employee = employeeRepository.findById(employeeId);
                if (employee.isEmpty()) {
                    log.warn("{} employee={} period={} reason=unknown employee",
                            Constants.EVENT_TRANSFER_SKIP, employeeId, period);
                    result.setSkippedCount(result.getSkippedCount() + 1);
                    continue;
                }
                transfer = PayrollTransfer.builder()
                        .employee(employee.get())
                        .periodYear(period.getYear())
                        .periodMonth(period.getMonth())
                        .build();
            }

            applyFigures(transfer, period);
            transfer.setPaymentDate(request.getPaymentDate());
            transfer.setStatus(TransferStatus.PROCESSING);
            transfer.setProcessedBy(userId);

            result.getProcessed().add(mapToTransferResponse(transferRepository.save(transfer)));
        }

        auditService.record(Constants.AUDIT_PROCESS, "payroll_transfers", period.toString(), null, result);
        log.info("Bank transfer initiated for {}: {} processed, {} skipped",
                period, result.getProcessedCount(), result.getSkippedCount());
        return result;
    }

    private void applyFigures(PayrollTransfer transfer, PayPeriod period) {
        Long employeeId = transfer.getEmployee().getId();
        BigDecimal gross = round(earningsService.computeGross(employeeId, period).getGross());
        BigDecimal deductions = round(deductionService.computeDeductions(employeeId, period).getTotal());
        transfer.setGrossSalary(gross);
        transfer.setTotalDeductions(deductions);
        transfer.setNetSalary(gross.subtract(deductions));
    }

    // ---------- Reports ----------

    @Transactional(readOnly = true)
    public DepartmentPayrollReport getDepartmentSummary(Integer year, Integer month, Long departmentId) {
        PayPeriod period = PayPeriod.require(year, month);
        Map<String, DepartmentPayrollSummary> byDepartment = new LinkedHashMap<>();

        List<Employee> employees = new ArrayList<>(
                employeeRepository.findByStatusAndDepartment(EmployeeStatus.ACTIVE, departmentId));
        employees.sort(Comparator.comparing(this::departmentName).thenComparing(Employee::getFullName));

        for (Employee employee : employees) {
            BigDecimal gross = round(earningsService.computeGross(employee.getId(), period).getGross());
            BigDecimal deductions = round(deductionService.computeDeductions(employee.getId(), period).getTotal());

            DepartmentPayrollSummary summary = byDepartment.computeIfAbsent(departmentName(employee),
                    name -> DepartmentPayrollSummary.builder()
                            .departmentId(employee.getDepartment() != null ? employee.getDepartment().getId() : null)
                            .departmentName(name)
                            .totalGross(BigDecimal.ZERO)
                            .totalDeductions(BigDecimal.ZERO)
                            .totalNet(BigDecimal.ZERO)
                            .build());
            summary.setEmployeeCount(summary.getEmployeeCount() + 1);
            summary.setTotalGross(summary.getTotalGross().add(gross));
            summary.setTotalDeductions(summary.getTotalDeductions().add(deductions));
            summary.setTotalNet(summary.getTotalNet().add(gross.subtract(deductions)));
        }

        List<DepartmentPayrollSummary> departments = new ArrayList<>(byDepartment.values());
        return DepartmentPayrollReport.builder()
                .year(period.getYear())
                .month(period.getMonth())
                .monthName(period.getMonthName())
                .departments(departments)
                .totalGross(sum(departments, DepartmentPayrollSummary::getTotalGross))
                .totalDeductions(sum(departments, DepartmentPayrollSummary::getTotalDeductions))
                .totalNet(sum(departments, DepartmentPayrollSummary::getTotalNet))
                .build();
    }

    @Transactional(readOnly = true)
    public List<PayrollTransferResponse> getTransfers(Integer year, Integer month, TransferStatus status) {
        return transferRepository.search(year, month, status)
                .stream()
                .map(this::mapToTransferResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<TransferOverviewItem> getTransferOverview(Integer year, Integer month,
                                                                       int page, int limit, Long departmentId) {
        PayPeriod period = PayPeriod.require(year, month);
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE);
        Pageable pageable = PageRequest.of(safePage - 1, safeLimit, Sort.by("fullName").ascending());

        Page<Employee> employeesPage = employeeRepository.searchEmployees(
                null, departmentId, EmployeeStatus.ACTIVE, pageable);

        List<TransferOverviewItem> items = employeesPage.getContent()
                .stream()
                .map(employee -> {
                    BigDecimal gross = round(earningsService.computeGross(employee.getId(), period).getGross());
                    BigDecimal deductions = round(deductionService.computeDeductions(employee.getId(), period).getTotal());
                    TransferStatus bankStatus = transferRepository.findByEmployeeIdAndPeriodYearAndPeriodMonth(
                                    employee.getId(), period.getYear(), period.getMonth())
                            .map(PayrollTransfer::getStatus)
                            .orElse(TransferStatus.PENDING);
                    return TransferOverviewItem.builder()
                            .employeeId(employee.getId())
                            .employeeCode(employee.getEmployeeCode())
                            .fullName(employee.getFullName())
                            .departmentName(departmentName(employee))
                            .grossSalary(gross)
                            .totalDeductions(deductions)
                            .netSalary(gross.subtract(deductions))
                            .bankStatus(bankStatus.toValue())
                            .build();
                })
                .collect(Collectors.toList());

        return PaginatedResponse.of(items, safePage, safeLimit, employeesPage.getTotalElements());
    }

    /**
     * Totals over active employees for the period (defaulting to the current month) with the
     * gross change against the previous period.
     */
    @Transactional(readOnly = true)
    public PayrollDashboardSummary getDashboardSummary(Integer year, Integer month) {
        PayPeriod period = resolveOrCurrent(year, month);
        PayPeriod previous = period.previous();

        List<Employee> employees = employeeRepository.findByStatusOrderByFullNameAsc(EmployeeStatus.ACTIVE);
        BigDecimal totalGross = BigDecimal.ZERO;
        BigDecimal totalDeductions = BigDecimal.ZERO;
        BigDecimal previousGross = BigDecimal.ZERO;
        for (Employee employee : employees) {
            totalGross = totalGross.add(round(earningsService.computeGross(employee.getId(), period).getGross()));
            totalDeductions = totalDeductions.add(
                    round(deductionService.computeDeductions(employee.getId(), period).getTotal()));
            previousGross = previousGross.add(round(earningsService.computeGross(employee.getId(), previous).getGross()));
        }

        BigDecimal change = previousGross.signum() > 0
                ? totalGross.subtract(previousGross)
                    .multiply(BigDecimal.valueOf(100))
                    .divide(previousGross, 1, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return PayrollDashboardSummary.builder()
                .year(period.getYear())
                .month(period.getMonth())
                .monthName(period.getMonthName())
                .employeeCount(employees.size())
                .totalGross(totalGross)
                .totalDeductions(totalDeductions)
                .totalNet(totalGross.subtract(totalDeductions))
                .previousGross(previousGross)
                .grossChangePercent(change)
                .transfersCompleted(transferRepository.countByPeriodYearAndPeriodMonthAndStatus(
                        period.getYear(), period.getMonth(), TransferStatus.COMPLETED))
                .unpaidLeavesPending(unpaidLeaveRepository.countByStatus(UnpaidLeaveStatus.PENDING))
                .build();
    }

    /**
     * Four-step view of a period: calculation and approval complete once a cycle has run, bank
     * transfer is in progress while any transfer is not yet completed.
     */
    @Transactional(readOnly = true)
    public PayrollStatusResponse getPayrollStatus(Integer year, Integer month) {
        PayPeriod period = resolveOrCurrent(year, month);

        Optional<PayrollCycle> lastCycle = cycleRepository.findFirstByPeriodYearAndPeriodMonthOrderByIdDesc(
                period.getYear(), period.getMonth());
        boolean hasRun = lastCycle.isPresent();
        long transfers = transferRepository.countByPeriodYearAndPeriodMonth(period.getYear(), period.getMonth());
        long completed = transferRepository.countByPeriodYearAndPeriodMonthAndStatus(
                period.getYear(), period.getMonth(), TransferStatus.COMPLETED);
        long pending = transfers - completed;
        boolean hasTransfers = transfers > 0;

        String runStatus = hasRun ? STATUS_COMPLETED : STATUS_NOT_STARTED;
        String bankStatus = hasTransfers ? (pending > 0 ? STATUS_IN_PROGRESS : STATUS_COMPLETED) : STATUS_NOT_STARTED;
        String completion = hasTransfers && pending == 0 ? STATUS_COMPLETED : STATUS_NOT_STARTED;

        int currentStep = 1;
        if (hasRun) {
            currentStep = !hasTransfers ? 2 : (pending > 0 ? 3 : 4);
        }

        List<PayrollStatusResponse.Step> steps = List.of(
                new PayrollStatusResponse.Step("calculation", runStatus, null),
                new PayrollStatusResponse.Step("approval", runStatus, null),
                new PayrollStatusResponse.Step("bankTransfer", bankStatus,
                        hasTransfers ? completed + " of " + transfers + " completed" : null),
                new PayrollStatusResponse.Step("completion", completion, null));

        return PayrollStatusResponse.builder()
                .year(period.getYear())
                .month(period.getMonth())
                .monthName(period.getMonthName())
                .steps(steps)
                .currentStep(currentStep)
                .totalSteps(steps.size())
                .lastRunAt(lastCycle.map(PayrollCycle::getRunAt).orElse(null))
                .build();
    }

    /**
     * Months with payroll input or transfers, newest first. The current month is always listed.
     */
    @Transactional(readOnly = true)
    public List<AvailableMonth> getAvailableMonths() {
        TreeSet<Integer> keys = new TreeSet<>(Comparator.reverseOrder());
        addPeriods(keys, allowanceRepository.findActivityMonths());
        addPeriods(keys, bonusRepository.findActivityMonths());
        addPeriods(keys, deductionRepository.findActivityMonths());
        addPeriods(keys, overtimeAdjustmentRepository.findActivityMonths());
        addPeriods(keys, transferRepository.findTransferPeriods());

        LocalDate today = LocalDate.now();
        keys.add(today.getYear() * 100 + today.getMonthValue());

        return keys.stream()
                .map(key -> PayPeriod.of(key / 100, key % 100))
                .map(p -> new AvailableMonth(p.getYear(), p.getMonth(), p.getMonthName()))
                .collect(Collectors.toList());
    }

    private void addPeriods(TreeSet<Integer> keys, List<Object[]> rows) {
        for (Object[] row : rows) {
            if (row[0] != null && row[1] != null) {
                keys.add(((Number) row[0]).intValue() * 100 + ((Number) row[1]).intValue());
            }
        }
    }

    private PayPeriod resolveOrCurrent(Integer year, Integer month) {
        if (year == null && month == null) {
            return PayPeriod.containing(LocalDate.now());
        }
        return PayPeriod.require(year, month);
    }

    private String departmentName(Employee employee) {
        return employee.getDepartment() != null ? employee.getDepartment().getName() : UNASSIGNED_DEPARTMENT;
    }

    private static BigDecimal sum(List<DepartmentPayrollSummary> rows,
                                  Function<DepartmentPayrollSummary, BigDecimal> field) {
        return rows.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal round(BigDecimal value) {
        return ContributionCalculator.round(value);
    }

    private PayrollTransferResponse mapToTransferResponse(PayrollTransfer transfer) {
        Employee employee = transfer.getEmployee();
        return PayrollTransferResponse.builder()
                .id(transfer.getId())
                .employeeId(employee.getId())
                .employeeCode(employee.getEmployeeCode())
                .employeeName(employee.getFullName())
                .periodYear(transfer.getPeriodYear())
                .periodMonth(transfer.getPeriodMonth())
                .grossSalary(transfer.getGrossSalary())
                .totalDeductions(transfer.getTotalDeductions())
                .netSalary(transfer.getNetSalary())
                .paymentDate(transfer.getPaymentDate())
                .status(transfer.getStatus())
                .processedBy(transfer.getProcessedBy())
                .build();
    }
}
