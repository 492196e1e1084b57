package com.PeopleCore.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN,
    HR,
    FINANCE,
    EMPLOYEE;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
