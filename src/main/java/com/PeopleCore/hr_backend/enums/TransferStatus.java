package com.PeopleCore.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransferStatus {
    PENDING,
    PROCESSING,
    COMPLETED;

    @JsonCreator
    public static TransferStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return TransferStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        String name = this.name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
