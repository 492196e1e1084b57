package com.PeopleCore.hr_backend.dto.request;

import com.PeopleCore.hr_backend.enums.LeaveAction;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class LeaveDecisionRequest {

    @NotNull(message = "Action must be one of APPROVE, REJECT or RESPOND")
    private LeaveAction action;

    private String note;
}
