package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.model.LeaveBalance;
import com.PeopleCore.hr_backend.model.LeaveBalanceEntry;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceEntryRepository;
import com.PeopleCore.hr_backend.repository.LeaveBalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Maintains used-day balances per (employee, leave type, year).
 * <p>
 * Each approval appends one {@link LeaveBalanceEntry}; {@link LeaveBalance#getUsedDays()} is
 * rewritten as the ledger total, so it can only grow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveBalanceService {

    private final LeaveBalanceRepository leaveBalanceRepository;
    private final LeaveBalanceEntryRepository leaveBalanceEntryRepository;
    private final EmployeeRepository employeeRepository;

    /**
     * Books the days of an approved request against its balance year (the year of the start
     * date) and returns the balance with the updated total. Must run inside the approval
     * transaction; the balance row stays locked until it commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LeaveBalance applyApprovedLeave(LeaveRequest request, BigDecimal daysUsed, BigDecimal entitledDays) {
        Long employeeId = request.getEmployee().getId();
        Long leaveTypeId = request.getLeaveType().getId();
        int year = request.getStartDate().getYear();

        Optional<LeaveBalance> existing = leaveBalanceRepository.findForUpdate(employeeId, leaveTypeId, year);
        LeaveBalance balance;
        if (existing.isPresent()) {
            balance = existing.get();
        } else {
            // No row to lock yet: first bookings for an employee queue on the employee row
            employeeRepository.findForUpdate(employeeId)
                    .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", employeeId));
            balance = leaveBalanceRepository.findForUpdate(employeeId, leaveTypeId, year)
                    .orElseGet(() -> leaveBalanceRepository.save(LeaveBalance.builder()
                            .employee(request.getEmployee())
                            .leaveType(request.getLeaveType())
                            .year(year)
                            .usedDays(BigDecimal.ZERO)
                            .build()));
        }

        leaveBalanceEntryRepository.save(LeaveBalanceEntry.builder()
                .employee(request.getEmployee())
                .leaveType(request.getLeaveType())
                .year(year)
                .deltaDays(daysUsed)
                .sourceRequest(request)
                .build());

        BigDecimal ledgerTotal = EarningsService.nullToZero(
                leaveBalanceEntryRepository.sumDeltaDays(employeeId, leaveTypeId, year));

        balance.setUsedDays(ledgerTotal.setScale(2, RoundingMode.HALF_UP));
        if (entitledDays != null) {
            balance.setEntitledDays(entitledDays);
        }
        LeaveBalance saved = leaveBalanceRepository.save(balance);

        log.info("Leave balance for employee {} type {} year {} is now {} days (+{})",
                employeeId, leaveTypeId, year, saved.getUsedDays(), daysUsed);
        return saved;
    }

    @Transactional(readOnly = true)
    public BigDecimal usedDays(Long employeeId, Long leaveTypeId, int year) {
        return leaveBalanceRepository.findBalance(employeeId, leaveTypeId, year)
                .map(LeaveBalance::getUsedDays)
                .orElse(BigDecimal.ZERO);
    }
}
