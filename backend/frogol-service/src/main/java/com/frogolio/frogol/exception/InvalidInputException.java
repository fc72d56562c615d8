package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

/**
 * User-correctable input problem: bad slug, bad email, bad request shape
 */
public class InvalidInputException extends FrogolioException {

    public InvalidInputException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
