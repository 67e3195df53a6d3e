/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Exception thrown when a signature-verified identity token fails a claim check.
 *
 * <p>
 * Exactly one claim is reported per failure: the first check of the pipeline that rejected the token.
 */
public class IdTokenClaimException extends AppleAuthException {

    private final String claim;

    public IdTokenClaimException(String claim, String reason) {
        super(FailureKind.ID_TOKEN_CLAIMS_INVALID, claim + " invalid: " + reason);
        this.claim = claim;
    }

    /**
     * @return the name of the rejected claim ({@code iss}, {@code aud}, {@code iat}, {@code exp} or {@code nonce})
     */
    public String claim() {
        return claim;
    }
}
