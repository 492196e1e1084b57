package com.PeopleCore.hr_backend.enums;

/**
 * Entitlement category of a leave type. Only ANNUAL and MEDICAL are capped by grade rules.
 */
public enum LeaveCategory {
    ANNUAL,
    MEDICAL,
    OTHER
}
