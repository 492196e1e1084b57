package com.PeopleCore.hr_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;

import java.util.Collections;
import java.util.List;

@Getter
public class ValidationException extends ApiException {
    private final List<FieldError> fieldErrors;

    public ValidationException(String message) {
        this(message, Collections.emptyList());
    }

    public ValidationException(String message, List<FieldError> fieldErrors) {
        super(message, HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
        this.fieldErrors = fieldErrors;
    }

    public static ValidationException invalidPeriod(int year, int month) {
        return new ValidationException(String.format("Invalid period %d-%d: month must be 1-12 and year positive",
                year, month));
    }
}
