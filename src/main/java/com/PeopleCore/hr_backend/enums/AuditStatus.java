package com.PeopleCore.hr_backend.enums;

public enum AuditStatus {
    SUCCESS,
    FAILURE
}
