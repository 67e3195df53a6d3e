/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when an identity token's signature does not verify against the resolved Apple signing key.
 */
public class IdTokenSignatureException extends AppleAuthException {

    public IdTokenSignatureException(String message, Throwable cause) {
        super(FailureKind.ID_TOKEN_SIGNATURE_INVALID, message, cause);
    }
}
