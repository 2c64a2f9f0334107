package com.camwatch.dao;

public final class ReferentialIntegrityException extends RuntimeException {
    public ReferentialIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
