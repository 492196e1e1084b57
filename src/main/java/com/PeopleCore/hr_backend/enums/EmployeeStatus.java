package com.PeopleCore.hr_backend.enums;

public enum EmployeeStatus {
    ACTIVE,
    INACTIVE
}
