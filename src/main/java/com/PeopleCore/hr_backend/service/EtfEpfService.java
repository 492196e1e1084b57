package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.EtfEpfConfigRequest;
import com.PeopleCore.hr_backend.dto.request.PeriodBatchRequest;
import com.PeopleCore.hr_backend.dto.response.BatchResult;
import com.PeopleCore.hr_backend.dto.response.ContributionBreakdown;
import com.PeopleCore.hr_backend.dto.response.EmployeeResponse;
import com.PeopleCore.hr_backend.dto.response.EtfEpfConfigResponse;
import com.PeopleCore.hr_backend.dto.response.EtfEpfHistoryResponse;
import com.PeopleCore.hr_backend.dto.response.EtfEpfPeriodSummary;
import com.PeopleCore.hr_backend.dto.response.EtfEpfProcessItem;
import com.PeopleCore.hr_backend.dto.response.EtfEpfTransactionResponse;
import com.PeopleCore.hr_backend.dto.response.GrossEarnings;
import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.EtfEpfConfig;
import com.PeopleCore.hr_backend.model.EtfEpfTransaction;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.EtfEpfConfigRepository;
import com.PeopleCore.hr_backend.repository.EtfEpfTransactionRepository;
import com.PeopleCore.hr_backend.util.Constants;
import com.PeopleCore.hr_backend.util.ContributionCalculator;
import com.PeopleCore.hr_backend.util.PayPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EtfEpfService {

    private final EtfEpfConfigRepository configRepository;
    private final EtfEpfTransactionRepository transactionRepository;
    private final EmployeeRepository employeeRepository;
    private final EmployeeService employeeService;
    private final EarningsService earningsService;
    private final ContributionCalculator contributionCalculator;
    private final AuditService auditService;

    // ---------- Configuration ----------

    /**
     * Every active employee with their statutory configuration. Employees without one are
     * listed as not configured; unset effective dates fall back to the employee's creation date.
     */
    @Transactional(readOnly = true)
    public List<EtfEpfConfigResponse> getAllConfigs() {
        Map<Long, EtfEpfConfig> configs = configRepository.findAll()
                .stream()
                .collect(Collectors.toMap(c -> c.getEmployee().getId(), Function.identity()));

        return employeeRepository.findByStatusOrderByFullNameAsc(EmployeeStatus.ACTIVE)
                .stream()
                .map(employee -> {
                    EtfEpfConfig config = configs.get(employee.getId());
                    if (config != null) {
                        return mapToConfigResponse(config);
                    }
                    LocalDate created = employee.getCreatedAt() != null ? employee.getCreatedAt().toLocalDate() : null;
                    return EtfEpfConfigResponse.builder()
                            .employeeId(employee.getId())
                            .employeeCode(employee.getEmployeeCode())
                            .employeeName(employee.getFullName())
                            .configured(false)
                            .epfNumber(employee.getEpfNo())
                            .epfEffectiveDate(created)
                            .etfEffectiveDate(created)
                            .build();
                })
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EtfEpfConfigResponse getConfigById(Long id) {
        return mapToConfigResponse(findConfig(id));
    }

    @Transactional
    public EtfEpfConfigResponse createConfig(EtfEpfConfigRequest request) {
        if (request.getEmployeeId() == null) {
            throw new ValidationException("Employee ID is required");
        }
        Employee employee = employeeService.findEmployee(request.getEmployeeId());
        if (configRepository.existsByEmployeeId(employee.getId())) {
            throw new InvalidStateException("ETF/EPF configuration already exists for employee " + employee.getId());
        }

        String epfNumber = EmployeeService.blankToNull(request.getEpfNumber());
        if (epfNumber == null) {
            epfNumber = EmployeeService.blankToNull(employee.getEpfNo());
        }
        if (epfNumber == null) {
            throw new ValidationException("EPF number is required");
        }

        EtfEpfConfig config = EtfEpfConfig.builder()
                .employee(employee)
                .epfNumber(epfNumber)
                .etfNumber(request.getEtfNumber())
                .epfEffectiveDate(request.getEpfEffectiveDate())
                .etfEffectiveDate(request.getEtfEffectiveDate())
                .epfContributionRate(request.getEpfContributionRate())
                .employerEpfRate(request.getEmployerEpfRate())
                .etfContributionRate(request.getEtfContributionRate())
                .build();
        if (request.getEpfStatus() != null) {
            config.setEpfStatus(request.getEpfStatus());
        }
        if (request.getEtfStatus() != null) {
            config.setEtfStatus(request.getEtfStatus());
        }

        EtfEpfConfig saved = configRepository.save(config);
        EtfEpfConfigResponse response = mapToConfigResponse(saved);
        auditService.record(Constants.AUDIT_CREATE, "employee_etf_epf", saved.getId(), null, response);

        log.info("ETF/EPF configuration created for employee {}", employee.getId());
        return response;
    }

    @Transactional
    public EtfEpfConfigResponse updateConfig(Long id, EtfEpfConfigRequest request) {
        EtfEpfConfig config = findConfig(id);
        EtfEpfConfigResponse before = mapToConfigResponse(config);

        if (request.getEpfNumber() != null) {
            config.setEpfNumber(request.getEpfNumber());
        }
        if (request.getEtfNumber() != null) {
            config.setEtfNumber(request.getEtfNumber());
        }
        if (request.getEpfEffectiveDate() != null) {
            config.setEpfEffectiveDate(request.getEpfEffectiveDate());
        }
        if (request.getEtfEffectiveDate() != null) {
            config.setEtfEffectiveDate(request.getEtfEffectiveDate());
        }
        if (request.getEpfStatus() != null) {
            config.setEpfStatus(request.getEpfStatus());
        }
        if (request.getEtfStatus() != null) {
            config.setEtfStatus(request.getEtfStatus());
        }
        if (request.getEpfContributionRate() != null) {
            config.setEpfContributionRate(request.getEpfContributionRate());
        }
        if (request.getEmployerEpfRate() != null) {
            config.setEmployerEpfRate(request.getEmployerEpfRate());
        }
        if (request.getEtfContributionRate() != null) {
            config.setEtfContributionRate(request.getEtfContributionRate());
        }

        EtfEpfConfigResponse response = mapToConfigResponse(configRepository.save(config));
        auditService.record(Constants.AUDIT_UPDATE, "employee_etf_epf", id, before, response);

        log.info("ETF/EPF configuration {} updated", id);
        return response;
    }

    @Transactional
    public void deleteConfig(Long id) {
        EtfEpfConfig config = findConfig(id);
        EtfEpfConfigResponse before = mapToConfigResponse(config);
        configRepository.delete(config);
        auditService.record(Constants.AUDIT_DELETE, "employee_etf_epf", id, before, null);
        log.info("ETF/EPF configuration {} deleted", id);
    }

    @Transactional(readOnly = true)
    public List<EmployeeResponse> getEmployeesWithoutConfig() {
        return employeeRepository.findWithoutEtfEpfConfig(EmployeeStatus.ACTIVE)
                .stream()
                .map(employeeService::toResponse)
                .collect(Collectors.toList());
    }

    // ---------- Calculation ----------

    @Transactional(readOnly = true)
    public ContributionBreakdown calculateContributions(Long employeeId, BigDecimal basicSalary) {
        if (basicSalary == null || basicSalary.signum() < 0) {
            throw new ValidationException("Basic salary must be zero or positive");
        }
        employeeService.findEmployee(employeeId);
        EtfEpfConfig config = configRepository.findByEmployeeId(employeeId).orElse(null);
        return contributionCalculator.calculate(basicSalary, config);
    }

    /**
     * Employees eligible for the period with a preview computed on their current basic salary.
     */
    @Transactional(readOnly = true)
    public List<EtfEpfProcessItem> getProcessList(Integer year, Integer month) {
        PayPeriod period = PayPeriod.require(year, month);

        return employeeRepository.findEligibleForPeriod(EmployeeStatus.ACTIVE, period.getEnd())
                .stream()
                .map(employee -> {
                    EtfEpfConfig config = configRepository.findByEmployeeId(employee.getId()).orElse(null);
                    BigDecimal basic = earningsService.currentBasicSalary(employee.getId());
                    return EtfEpfProcessItem.builder()
                            .employeeId(employee.getId())
                            .employeeCode(employee.getEmployeeCode())
                            .fullName(employee.getFullName())
                            .epfNumber(config != null ? config.getEpfNumber() : employee.getEpfNo())
                            .configured(config != null)
                            .processed(transactionRepository.existsByEmployeeIdAndPeriodYearAndPeriodMonth(
                                    employee.getId(), period.getYear(), period.getMonth()))
                            .basicSalary(basic)
                            .contributions(contributionCalculator.calculate(basic, config))
                            .build();
                })
                .collect(Collectors.toList());
    }

    // ---------- Processing ----------

    /**
     * Processes each listed employee for the period in one transaction. Employees that are
     * unknown, already processed, unconfigured or without positive gross are skipped.
     */
    @Transactional
    public BatchResult<EtfEpfTransactionResponse> processPayments(PeriodBatchRequest request, Long userId) {
        PayPeriod period = PayPeriod.require(request.getYear(), request.getMonth());
        BatchResult<EtfEpfTransactionResponse> result = BatchResult.<EtfEpfTransactionResponse>builder().build();

        for (Long employeeId : request.getEmployeeIds()) {
            Optional<EtfEpfTransaction> transaction = processPeriod(employeeId, period, userId);
            if (transaction.isPresent()) {
                result.getProcessed().add(mapToTransactionResponse(transaction.get()));
            } else {
                result.setSkippedCount(result.getSkippedCount() + 1);
            }
        }

        auditService.record(Constants.AUDIT_PROCESS, "payroll_etf_epf_transactions", period.toString(),
                null, result);
        log.info("ETF/EPF processed for {}: {} processed, {} skipped",
                period, result.getProcessedCount(), result.getSkippedCount());
        return result;
    }

    Optional<EtfEpfTransaction> processPeriod(Long employeeId, PayPeriod period, Long userId) {
        Optional<Employee> employee = employeeRepository.findById(employeeId);
        if (employee.isEmpty()) {
            log.warn("Skipping unknown employee {} for ETF/EPF period {}", employeeId, period);
            return Optional.empty();
        }

        if (transactionRepository.existsByEmployeeIdAndPeriodYearAndPeriodMonth(
                employeeId, period.getYear(), period.getMonth())) {
            log.warn("{} employee={} period={}", Constants.EVENT_ALREADY_PROCESSED, employeeId, period);
            return Optional.empty();
        }

        Optional<EtfEpfConfig> config = configRepository.findByEmployeeId(employeeId);
        if (config.isEmpty()) {
            log.warn("{} employee={} period={}", Constants.EVENT_RATES_MISSING, employeeId, period);
            return Optional.empty();
        }

        GrossEarnings earnings = earningsService.computeGross(employeeId, period);
        if (!earnings.hasPositiveGross()) {
            log.warn("{} employee={} period={} gross={}",
                    Constants.EVENT_GROSS_ZERO, employeeId, period, earnings.getGross());
            return Optional.empty();
        }

        ContributionBreakdown amounts = contributionCalculator.calculate(earnings.getGross(), config.get());

        EtfEpfTransaction transaction = transactionRepository.save(EtfEpfTransaction.builder()
                .employee(employee.get())
                .periodYear(period.getYear())
                .periodMonth(period.getMonth())
                .grossSalary(amounts.getBaseAmount())
                .employeeEpfAmount(amounts.getEmployeeEpf())
                .epfEmployerShare(amounts.getEmployerEpf())
                .employerEtfAmount(amounts.getEmployerEtf())
                .processedBy(userId)
                .build());

        log.info("ETF/EPF transaction {} recorded for employee {} in {}", transaction.getId(), employeeId, period);
        return Optional.of(transaction);
    }

    // ---------- Reporting ----------

    @Transactional(readOnly = true)
    public List<EtfEpfPeriodSummary> getPaymentSummary() {
        return transactionRepository.summarizeByPeriod()
                .stream()
                .map(this::mapToPeriodSummary)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EtfEpfHistoryResponse getPaymentHistory(Integer year, Integer month) {
        PayPeriod period = PayPeriod.require(year, month);
        List<EtfEpfTransactionResponse> transactions = transactionRepository
                .findByPeriodYearAndPeriodMonthOrderByIdAsc(period.getYear(), period.getMonth())
                .stream()
                .map(this::mapToTransactionResponse)
                .collect(Collectors.toList());

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal employeeEpf = BigDecimal.ZERO;
        BigDecimal employerEpf = BigDecimal.ZERO;
        BigDecimal etf = BigDecimal.ZERO;
        LocalDateTime lastProcessedAt = null;
        for (EtfEpfTransactionResponse t : transactions) {
            gross = gross.add(t.getGrossSalary());
            employeeEpf = employeeEpf.add(t.getEmployeeEpfAmount());
            employerEpf = employerEpf.add(t.getEpfEmployerShare());
            etf = etf.add(t.getEmployerEtfAmount());
            if (t.getProcessedAt() != null && (lastProcessedAt == null || t.getProcessedAt().isAfter(lastProcessedAt))) {
                lastProcessedAt = t.getProcessedAt();
            }
        }

        EtfEpfPeriodSummary totals = EtfEpfPeriodSummary.builder()
                .year(period.getYear())
                .month(period.getMonth())
                .monthName(period.getMonthName())
                .employeeCount(transactions.size())
                .totalGross(gross)
                .totalEmployeeEpf(employeeEpf)
                .totalEmployerEpf(employerEpf)
                .totalEtf(etf)
                .lastProcessedAt(lastProcessedAt)
                .build();

        return EtfEpfHistoryResponse.builder()
                .transactions(transactions)
                .totals(totals)
                .build();
    }

    private EtfEpfConfig findConfig(Long id) {
        return configRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("EtfEpfConfig", "id", id));
    }

    private EtfEpfPeriodSummary mapToPeriodSummary(Object[] row) {
        int year = ((Number) row[0]).intValue();
        int month = ((Number) row[1]).intValue();
        return EtfEpfPeriodSummary.builder()
                .year(year)
                .month(month)
                .monthName(Constants.MONTH_NAMES[month - 1])
                .employeeCount(((Number) row[2]).longValue())
                .totalGross(EarningsService.nullToZero((BigDecimal) row[3]))
                .totalEmployeeEpf(EarningsService.nullToZero((BigDecimal) row[4]))
                .totalEmployerEpf(EarningsService.nullToZero((BigDecimal) row[5]))
                .totalEtf(EarningsService.nullToZero((BigDecimal) row[6]))
                .lastProcessedAt((LocalDateTime) row[7])
                .build();
    }

    private EtfEpfConfigResponse mapToConfigResponse(EtfEpfConfig config) {
        Employee employee = config.getEmployee();
        LocalDate created = employee.getCreatedAt() != null ? employee.getCreatedAt().toLocalDate() : null;
        return EtfEpfConfigResponse.builder()
                .id(config.getId())
                .employeeId(employee.getId())
                .employeeCode(employee.getEmployeeCode())
                .employeeName(employee.getFullName())
                .configured(true)
                .epfNumber(config.getEpfNumber())
                .etfNumber(config.getEtfNumber())
                .epfEffectiveDate(config.getEpfEffectiveDate() != null ? config.getEpfEffectiveDate() : created)
                .etfEffectiveDate(config.getEtfEffectiveDate() != null ? config.getEtfEffectiveDate() : created)
                .epfStatus(config.getEpfStatus())
                .etfStatus(config.getEtfStatus())
                .epfContributionRate(contributionCalculator.epfRate(config))
                .employerEpfRate(contributionCalculator.employerEpfRate(config))
                .etfContributionRate(contributionCalculator.etfRate(config))
                .build();
    }

    private EtfEpfTransactionResponse mapToTransactionResponse(EtfEpfTransaction transaction) {
        Employee employee = transaction.getEmployee();
        return EtfEpfTransactionResponse.builder()
                .id(transaction.getId())
                .employeeId(employee.getId())
                .employeeCode(employee.getEmployeeCode())
                .employeeName(employee.getFullName())
                .periodYear(transaction.getPeriodYear())
                .periodMonth(transaction.getPeriodMonth())
                .grossSalary(transaction.getGrossSalary())
                .employeeEpfAmount(transaction.getEmployeeEpfAmount())
                .epfEmployerShare(transaction.getEpfEmployerShare())
                .employerEtfAmount(transaction.getEmployerEtfAmount())
                .processedAt(transaction.getProcessedAt())
                .build();
    }
}
