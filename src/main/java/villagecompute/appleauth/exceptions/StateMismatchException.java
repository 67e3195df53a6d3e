/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when the callback {@code state} does not match the value stored in the session at authorization
 * time.
 */
public class StateMismatchException extends AppleAuthException {

    public StateMismatchException(String message) {
        super(FailureKind.CSRF_DETECTED, message);
    }
}
