package com.PeopleCore.hr_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeductionBasis {
    FIXED,
    PERCENT;

    @JsonCreator
    public static DeductionBasis fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return DeductionBasis.valueOf(value.trim().toUpperCase());
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
