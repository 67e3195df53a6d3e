/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when an identity token cannot be decoded at all, or is missing a required field.
 *
 * <p>
 * Raised before any key lookup, so a malformed token never triggers a key-set fetch.
 */
public class IdTokenFormatException extends AppleAuthException {

    public IdTokenFormatException(String message) {
        super(FailureKind.ID_TOKEN_FORMAT_INVALID, message);
    }

    public IdTokenFormatException(String message, Throwable cause) {
        super(FailureKind.ID_TOKEN_FORMAT_INVALID, message, cause);
    }
}
