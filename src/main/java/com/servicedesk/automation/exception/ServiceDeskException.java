package com.servicedesk.automation.exception;

import lombok.Getter;

/**
 * Base class for service desk errors. The error code is what API clients see.
 */
@Getter
public class ServiceDeskException extends RuntimeException {

    private final String errorCode;

    public ServiceDeskException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ServiceDeskException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
