package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.config.LeavePolicyProperties;
import com.PeopleCore.hr_backend.enums.LeaveCategory;
import com.PeopleCore.hr_backend.enums.UnpaidLeaveStatus;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import com.PeopleCore.hr_backend.model.LeaveRule;
import com.PeopleCore.hr_backend.model.UnpaidLeave;
import com.PeopleCore.hr_backend.repository.LeaveRuleRepository;
import com.PeopleCore.hr_backend.repository.UnpaidLeaveRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Turns used days beyond a grade's entitlement into unpaid leave.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntitlementBreachService {

    private final LeaveRuleRepository leaveRuleRepository;
    private final UnpaidLeaveRepository unpaidLeaveRepository;
    private final LeavePolicyProperties leavePolicy;

    /**
     * Entitlement in days for the employee's grade and the given category. Zero means no limit
     * is configured.
     */
    @Transactional(readOnly = true)
    public BigDecimal resolveLimit(Employee employee, LeaveCategory category) {
        if (employee.getGrade() == null) {
            return BigDecimal.ZERO;
        }
        Optional<LeaveRule> rule = leaveRuleRepository.findByGradeId(employee.getGrade().getId());
        if (rule.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return switch (category) {
            case ANNUAL -> rule.get().getAnnualLimit();
            case MEDICAL -> rule.get().getMedicalLimit();
            case OTHER -> BigDecimal.ZERO;
        };
    }

    /**
     * Files one pending unpaid leave for the excess of {@code usedDays} over {@code limit}.
     * Existing unpaid leave rows are left alone.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<UnpaidLeave> generateForBreach(LeaveRequest request, LeaveCategory category,
                                                   BigDecimal usedDays, BigDecimal limit) {
        if (category == LeaveCategory.OTHER || limit == null || limit.signum() <= 0) {
            return Optional.empty();
        }
        if (usedDays.compareTo(limit) <= 0) {
            return Optional.empty();
        }

        BigDecimal excess = usedDays.subtract(limit);
        if (excess.compareTo(leavePolicy.getBreachTolerance()) <= 0) {
            return Optional.empty();
        }

        BigDecimal totalDays = excess.setScale(2, RoundingMode.HALF_UP);
        UnpaidLeave unpaidLeave = UnpaidLeave.builder()
                .employee(request.getEmployee())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .totalDays(totalDays)
                .reason(breachReason(category, limit, totalDays))
                .status(UnpaidLeaveStatus.PENDING)
                .build();

        UnpaidLeave saved = unpaidLeaveRepository.save(unpaidLeave);
        log.info("Unpaid leave {} filed for employee {}: {} days over the {} limit",
                saved.getId(), request.getEmployee().getId(), totalDays, category);
        return Optional.of(saved);
    }

    private String breachReason(LeaveCategory category, BigDecimal limit, BigDecimal excess) {
        String label = category == LeaveCategory.ANNUAL ? "Annual Leave" : "Medical Leave";
        return String.format("%s limit (%s days) exceeded by %s days by this request.",
                label, limit.stripTrailingZeros().toPlainString(), excess.toPlainString());
    }
}
