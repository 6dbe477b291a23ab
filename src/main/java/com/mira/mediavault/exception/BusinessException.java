package com.mira.mediavault.exception;

/**
 * Invalid input or a request that breaks a business rule
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
