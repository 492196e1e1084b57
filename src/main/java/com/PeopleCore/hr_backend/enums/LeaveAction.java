package com.PeopleCore.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LeaveAction {
    APPROVE,
    REJECT,
    RESPOND;

    @JsonCreator
    public static LeaveAction fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LeaveAction.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }

    public boolean changesStatus() {
        return this != RESPOND;
    }
}
