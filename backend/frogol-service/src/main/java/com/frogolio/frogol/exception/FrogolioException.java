package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for errors surfaced to API callers with a fixed HTTP status
 */
public abstract class FrogolioException extends RuntimeException {

    private final HttpStatus status;

    protected FrogolioException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected FrogolioException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
