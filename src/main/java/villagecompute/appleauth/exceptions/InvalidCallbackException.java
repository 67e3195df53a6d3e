/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when the callback carries a provider error (e.g. {@code user_cancelled_authorize}) or lacks the
 * authorization code.
 */
public class InvalidCallbackException extends AppleAuthException {

    public InvalidCallbackException(String message) {
        super(FailureKind.INVALID_CALLBACK, message);
    }
}
