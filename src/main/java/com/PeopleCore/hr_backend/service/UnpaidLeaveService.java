package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.config.PayrollProperties;
import com.PeopleCore.hr_backend.dto.response.UnpaidLeaveResponse;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.exception.InvalidStateException;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.model.UnpaidLeave;
import com.PeopleCore.hr_backend.repository.UnpaidLeaveRepository;
import com.PeopleCore.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class UnpaidLeaveService {

    private final UnpaidLeaveRepository unpaidLeaveRepository;
    private final EarningsService earningsService;
    private final PayrollProperties payrollProperties;
    private final AuditService auditService;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<UnpaidLeaveResponse> getUnpaidLeaves(Long employeeId, UnpaidLeaveStatus status) {
        return unpaidLeaveRepository.search(employeeId, status)
                .stream()
                .map(this::mapToUnpaidLeaveResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public UnpaidLeaveResponse getUnpaidLeave(Long id) {
        return mapToUnpaidLeaveResponse(findUnpaidLeave(id));
    }

    /**
     * Prices a pending unpaid leave at the daily rate of the current basic salary and marks it
     * processed. The processing time decides which payroll period deducts it.
     */
    @Transactional
    public UnpaidLeaveResponse processUnpaidLeave(Long id) {
        UnpaidLeave unpaidLeave = findUnpaidLeave(id);
        if (unpaidLeave.getStatus() == UnpaidLeaveStatus.PROCESSED) {
            throw new InvalidStateException("Unpaid leave " + id + " is already processed");
        }

        UnpaidLeaveResponse before = mapToUnpaidLeaveResponse(unpaidLeave);

        BigDecimal basic = earningsService.currentBasicSalary(unpaidLeave.getEmployee().getId());
        BigDecimal dailyRate = basic.divide(BigDecimal.valueOf(payrollProperties.getWorkingDaysPerMonth()),
                10, RoundingMode.HALF_UP);
        BigDecimal deduction = dailyRate.multiply(unpaidLeave.getTotalDays()).setScale(2, RoundingMode.HALF_UP);

        unpaidLeave.setDeductionAmount(deduction);
        unpaidLeave.setStatus(UnpaidLeaveStatus.PROCESSED);
        unpaidLeave.setProcessedAt(LocalDateTime.now());

        UnpaidLeave saved = unpaidLeaveRepository.save(unpaidLeave);
        UnpaidLeaveResponse response = mapToUnpaidLeaveResponse(saved);
        auditService.record(Constants.AUDIT_PROCESS, "unpaid_leaves", id, before, response);

        log.info("Unpaid leave {} processed: {} days, deduction {}", id, saved.getTotalDays(), deduction);
        return response;
    }

    private UnpaidLeave findUnpaidLeave(Long id) {
        return unpaidLeaveRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("UnpaidLeave", "id", id));
    }

    public UnpaidLeaveResponse mapToUnpaidLeaveResponse(UnpaidLeave unpaidLeave) {
        UnpaidLeaveResponse response = modelMapper.map(unpaidLeave, UnpaidLeaveResponse.class);

        if (unpaidLeave.getEmployee() != null) {
            response.setEmployeeId(unpaidLeave.getEmployee().getId());
            response.setEmployeeName(unpaidLeave.getEmployee().getFullName());
        }

        return response;
    }
}
