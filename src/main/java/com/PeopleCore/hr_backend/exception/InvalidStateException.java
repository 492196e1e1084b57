package com.PeopleCore.hr_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The target record is not in a state that allows the requested transition.
 */
public class InvalidStateException extends ApiException {
    public InvalidStateException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_STATE");
    }

    public static InvalidStateException alreadyDecided(Long leaveRequestId) {
        return new InvalidStateException("Leave request " + leaveRequestId + " is already decided");
    }
}
