package com.cashflow.exception;

/**
 * The caller is not bound to the player it claims to act for.
 */
public class UnauthorizedActionException extends RuntimeException {

    public static final String MESSAGE = "Unauthorized";

    public UnauthorizedActionException() {
        super(MESSAGE);
    }

    public UnauthorizedActionException(String detail) {
        super(MESSAGE + ": " + detail);
    }
}
