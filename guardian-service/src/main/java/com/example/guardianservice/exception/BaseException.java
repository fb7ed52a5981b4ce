package com.example.guardianservice.exception;

import lombok.Getter;

/**
 * Base exception class for all guardian business exceptions.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final String code;

    protected BaseException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected BaseException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
