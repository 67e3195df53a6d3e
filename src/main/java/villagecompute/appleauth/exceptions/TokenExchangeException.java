/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when the authorization-code exchange against Apple's token endpoint fails.
 */
public class TokenExchangeException extends AppleAuthException {

    public TokenExchangeException(String message, Throwable cause) {
        super(FailureKind.TOKEN_EXCHANGE_FAILED, message, cause);
    }
}
