package com.servicedesk.automation.exception;

/**
 * Ingestion source could not be read.
 */
public class MessageSourceException extends ServiceDeskException {

    private static final String ERROR_CODE = "SOURCE_FAILURE";

    public MessageSourceException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
