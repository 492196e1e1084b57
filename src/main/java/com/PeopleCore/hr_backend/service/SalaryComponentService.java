package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.AllowanceRequest;
import com.PeopleCore.hr_backend.dto.request.BasicSalaryRequest;
import com.PeopleCore.hr_backend.dto.request.BonusRequest;
import com.PeopleCore.hr_backend.dto.request.DeductionRequest;
import com.PeopleCore.hr_backend.dto.request.OvertimeRequest;
import com.PeopleCore.hr_backend.dto.response.AllowanceResponse;
import com.PeopleCore.hr_backend.dto.response.BonusResponse;
import com.PeopleCore.hr_backend.dto.response.DeductionResponse;
import com.PeopleCore.hr_backend.dto.response.OvertimeResponse;
import com.PeopleCore.hr_backend.dto.response.SalaryResponse;
import com.PeopleCore.hr_backend.enums.ComponentStatus;
import com.PeopleCore.hr_backend.enums.DeductionBasis;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.model.Allowance;
import com.PeopleCore.hr_backend.model.Bonus;
import com.PeopleCore.hr_backend.model.Deduction;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.OvertimeAdjustment;
import com.PeopleCore.hr_backend.model.Salary;
import com.PeopleCore.hr_backend.repository.AllowanceRepository;
import com.PeopleCore.hr_backend.repository.BonusRepository;
import com.PeopleCore.hr_backend.repository.DeductionRepository;
import com.PeopleCore.hr_backend.repository.OvertimeAdjustmentRepository;
import com.PeopleCore.hr_backend.repository.SalaryRepository;
import com.PeopleCore.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * HR-maintained pay inputs: basic salary versions, allowances, deductions, bonuses and overtime.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalaryComponentService {

    private final SalaryRepository salaryRepository;
    private final AllowanceRepository allowanceRepository;
    private final DeductionRepository deductionRepository;
    private final BonusRepository bonusRepository;
    private final OvertimeAdjustmentRepository overtimeAdjustmentRepository;
    private final EmployeeService employeeService;
    private final AuditService auditService;
    private final ModelMapper modelMapper;

    // Basic salary is versioned: every change is a new row
    @Transactional
    public SalaryResponse setBasicSalary(BasicSalaryRequest request) {
        Employee employee = employeeService.findEmployee(request.getEmployeeId());

        Salary salary = salaryRepository.save(Salary.builder()
                .employee(employee)
                .basicSalary(request.getBasicSalary())
                .effectiveDate(request.getEffectiveDate() != null ? request.getEffectiveDate() : LocalDate.now())
                .build());

        SalaryResponse response = mapToSalaryResponse(salary);
        auditService.record(Constants.AUDIT_CREATE, "salaries", salary.getId(), null, response);
        log.info("Basic salary set for employee {}: {}", employee.getId(), salary.getBasicSalary());
        return response;
    }

    @Transactional(readOnly = true)
    public SalaryResponse getCurrentBasicSalary(Long employeeId) {
        employeeService.findEmployee(employeeId);
        return salaryRepository.findFirstByEmployeeIdOrderByIdDesc(employeeId)
                .map(this::mapToSalaryResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Salary", "employeeId", employeeId));
    }

    @Transactional(readOnly = true)
    public List<SalaryResponse> getSalaryHistory(Long employeeId) {
        return salaryRepository.findByEmployeeIdOrderByIdDesc(employeeId)
                .stream()
                .map(this::mapToSalaryResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public AllowanceResponse addAllowance(AllowanceRequest request) {
        validateWindow(request.getEffectiveFrom(), request.getEffectiveTo());
        Employee employee = employeeService.findEmployee(request.getEmployeeId());

        Allowance allowance = allowanceRepository.save(Allowance.builder()
                .employee(employee)
                .name(request.getName())
                .amount(request.getAmount())
                .status(request.getStatus() != null ? request.getStatus() : ComponentStatus.ACTIVE)
                .effectiveFrom(request.getEffectiveFrom())
                .effectiveTo(request.getEffectiveTo())
                .build());

        AllowanceResponse response = mapToAllowanceResponse(allowance);
        auditService.record(Constants.AUDIT_CREATE, "allowances", allowance.getId(), null, response);
        log.info("Allowance '{}' added for employee {}", allowance.getName(), employee.getId());
        return response;
    }

    @Transactional(readOnly = true)
    public List<AllowanceResponse> getAllowances(Long employeeId) {
        return allowanceRepository.findByEmployeeIdOrderByIdDesc(employeeId)
                .stream()
                .map(this::mapToAllowanceResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public AllowanceResponse updateAllowance(Long id, AllowanceRequest request) {
        Allowance allowance = allowanceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Allowance", "id", id));
        validateWindow(request.getEffectiveFrom(), request.getEffectiveTo());

        AllowanceResponse before = mapToAllowanceResponse(allowance);
        allowance.setName(request.getName());
        allowance.setAmount(request.getAmount());
        if (request.getStatus() != null) {
            allowance.setStatus(request.getStatus());
        }
        allowance.setEffectiveFrom(request.getEffectiveFrom());
        allowance.setEffectiveTo(request.getEffectiveTo());

        AllowanceResponse response = mapToAllowanceResponse(allowanceRepository.save(allowance));
        auditService.record(Constants.AUDIT_UPDATE, "allowances", id, before, response);
        log.info("Allowance {} updated", id);
        return response;
    }

    @Transactional
    public void deleteAllowance(Long id) {
        Allowance allowance = allowanceRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Allowance", "id", id));
        AllowanceResponse before = mapToAllowanceResponse(allowance);
        allowanceRepository.delete(allowance);
        auditService.record(Constants.AUDIT_DELETE, "allowances", id, before, null);
        log.info("Allowance {} deleted", id);
    }

    @Transactional
    public DeductionResponse addDeduction(DeductionRequest request) {
        DeductionBasis basis = request.getBasis() != null ? request.getBasis() : DeductionBasis.FIXED;
        if (basis == DeductionBasis.PERCENT && request.getPercent() == null) {
            throw new ValidationException("Percent is required for a percent-based deduction");
        }
        if (basis == DeductionBasis.FIXED && request.getAmount() == null) {
            throw new ValidationException("Amount is required for a fixed deduction");
        }
        Employee employee = employeeService.findEmployee(request.getEmployeeId());

        Deduction deduction = deductionRepository.save(Deduction.builder()
                .employee(employee)
                .name(request.getName())
                .basis(basis)
                .amount(request.getAmount())
                .percent(request.getPercent())
                .status(ComponentStatus.ACTIVE)
                .effectiveDate(request.getEffectiveDate())
                .build());

        DeductionResponse response = mapToDeductionResponse(deduction);
        auditService.record(Constants.AUDIT_CREATE, "deductions", deduction.getId(), null, response);
        log.info("Deduction '{}' added for employee {}", deduction.getName(), employee.getId());
        return response;
    }

    @Transactional(readOnly = true)
    public List<DeductionResponse> getDeductions(Long employeeId) {
        return deductionRepository.findByEmployeeIdOrderByEffectiveDateDesc(employeeId)
                .stream()
                .map(this::mapToDeductionResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public BonusResponse addBonus(BonusRequest request) {
        Employee employee = employeeService.findEmployee(request.getEmployeeId());

        Bonus bonus = bonusRepository.save(Bonus.builder()
                .employee(employee)
                .description(request.getDescription())
                .amount(request.getAmount())
                .effectiveDate(request.getEffectiveDate())
                .build());

        BonusResponse response = modelMapper.map(bonus, BonusResponse.class);
        response.setEmployeeId(employee.getId());
        auditService.record(Constants.AUDIT_CREATE, "bonuses", bonus.getId(), null, response);
        log.info("Bonus of {} added for employee {}", bonus.getAmount(), employee.getId());
        return response;
    }

    @Transactional
    public OvertimeResponse addOvertime(OvertimeRequest request) {
        Employee employee = employeeService.findEmployee(request.getEmployeeId());

        OvertimeAdjustment overtime = overtimeAdjustmentRepository.save(OvertimeAdjustment.builder()
                .employee(employee)
                .otHours(request.getOtHours())
                .otRate(request.getOtRate())
                .note(request.getNote())
                .build());

        OvertimeResponse response = modelMapper.map(overtime, OvertimeResponse.class);
        response.setEmployeeId(employee.getId());
        response.setAmount(overtime.getOtHours().multiply(overtime.getOtRate()).setScale(2, RoundingMode.HALF_UP));
        auditService.record(Constants.AUDIT_CREATE, "overtime_adjustments", overtime.getId(), null, response);
        log.info("Overtime of {} hours added for employee {}", overtime.getOtHours(), employee.getId());
        return response;
    }

    private void validateWindow(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("Effective from date must be on or before effective to date");
        }
    }

    private SalaryResponse mapToSalaryResponse(Salary salary) {
        SalaryResponse response = modelMapper.map(salary, SalaryResponse.class);
        response.setEmployeeId(salary.getEmployee().getId());
        return response;
    }

    private AllowanceResponse mapToAllowanceResponse(Allowance allowance) {
        AllowanceResponse response = modelMapper.map(allowance, AllowanceResponse.class);
        response.setEmployeeId(allowance.getEmployee().getId());
        return response;
    }

    private DeductionResponse mapToDeductionResponse(Deduction deduction) {
        DeductionResponse response = modelMapper.map(deduction, DeductionResponse.class);
        response.setEmployeeId(deduction.getEmployee().getId());
        return response;
    }
}
