package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing, invalid or expired credentials
 */
public class AuthException extends FrogolioException {

    public AuthException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
