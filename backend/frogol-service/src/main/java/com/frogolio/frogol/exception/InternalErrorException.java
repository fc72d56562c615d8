package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

/**
 * Unexpected failure; the message is what the caller sees, details go to the log
 */
public class InternalErrorException extends FrogolioException {

    public InternalErrorException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public InternalErrorException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
