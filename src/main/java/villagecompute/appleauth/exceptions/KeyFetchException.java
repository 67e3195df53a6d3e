/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when Apple's signing-key set cannot be retrieved, cannot be parsed, or does not contain the
 * requested key id.
 */
public class KeyFetchException extends AppleAuthException {

    public KeyFetchException(String message) {
        super(FailureKind.JWKS_FETCHING_FAILED, message);
    }

    public KeyFetchException(String message, Throwable cause) {
        super(FailureKind.JWKS_FETCHING_FAILED, message, cause);
    }
}
