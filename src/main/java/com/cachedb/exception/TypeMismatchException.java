package com.cachedb.exception;

/**
 * Raised when an arithmetic operation meets a non-numeric operand.
 */
public class TypeMismatchException extends CacheDBException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
