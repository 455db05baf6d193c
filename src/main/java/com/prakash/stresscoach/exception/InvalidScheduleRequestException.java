package com.prakash.stresscoach.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST) // Rejected before any allocation, no partial schedule
public class InvalidScheduleRequestException extends RuntimeException {

    public InvalidScheduleRequestException(String message) {
        super(message);
    }
}
