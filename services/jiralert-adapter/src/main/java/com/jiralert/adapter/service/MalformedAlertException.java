package com.jiralert.adapter.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The notification parsed but cannot be turned into an issue, e.g. the project
 * or issue type labels are missing. Mapped to a 400 response.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class MalformedAlertException extends RuntimeException {

    public MalformedAlertException(String message) {
        super(message);
    }
}
