package com.PeopleCore.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum UnpaidLeaveStatus {
    PENDING("Pending"),
    PROCESSED("Processed");

    private final String value;

    UnpaidLeaveStatus(String value) {
        this.value = value;
    }

    @JsonCreator
    public static UnpaidLeaveStatus fromString(String text) {
        if (text == null) {
            return null;
        }
        for (UnpaidLeaveStatus status : values()) {
            if (status.value.equalsIgnoreCase(text.trim()) || status.name().equalsIgnoreCase(text.trim())) {
                return status;
            }
        }
        return null;
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
