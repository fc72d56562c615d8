package com.frogolio.frogol.exception;

import org.springframework.http.HttpStatus;

/**
 * Rejected upload (content type, size, empty file)
 */
public class UploadValidationException extends FrogolioException {

    public UploadValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
