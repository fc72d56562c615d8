package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends FrogolioException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
