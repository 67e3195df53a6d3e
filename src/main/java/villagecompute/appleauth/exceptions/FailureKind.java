/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Stable failure codes reported for a failed Sign in with Apple callback.
 *
 * <p>
 * The {@link #code()} value is what callers log, count and return to clients. It never changes once released.
 */
public enum FailureKind {

    CONFIGURATION_ERROR("configuration_error"),
    JWKS_FETCHING_FAILED("jwks_fetching_failed"),
    ID_TOKEN_SIGNATURE_INVALID("id_token_signature_invalid"),
    ID_TOKEN_CLAIMS_INVALID("id_token_claims_invalid"),
    ID_TOKEN_FORMAT_INVALID("id_token_format_invalid"),
    TOKEN_EXCHANGE_FAILED("token_exchange_failed"),
    INVALID_CALLBACK("invalid_callback"),
    CSRF_DETECTED("csrf_detected");

    private final String code;

    FailureKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
