package com.PeopleCore.hr_backend.util;

import com.PeopleCore.hr_backend.config.LeavePolicyProperties;
import com.PeopleCore.hr_backend.enums.LeaveCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LeaveTypeResolver {

    private final LeavePolicyProperties leavePolicy;

    public LeaveCategory resolve(Long leaveTypeId) {
        if (leaveTypeId == null) {
            return LeaveCategory.OTHER;
        }
        if (leaveTypeId.equals(leavePolicy.getAnnualTypeId())) {
            return LeaveCategory.ANNUAL;
        }
        if (leaveTypeId.equals(leavePolicy.getMedicalTypeId())) {
            return LeaveCategory.MEDICAL;
        }
        return LeaveCategory.OTHER;
    }
}
