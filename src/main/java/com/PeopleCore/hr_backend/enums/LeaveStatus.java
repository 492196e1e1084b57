package com.PeopleCore.hr_backend.enums;

public enum LeaveStatus {
    PENDING,
    APPROVED,
    REJECTED
}
