package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends FrogolioException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
