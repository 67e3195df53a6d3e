/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

/**
 * Result of one identity-token claim check: either valid, or the rejected claim with a reason.
 *
 * @param valid
 *            {@code true} when the claim passed
 * @param claim
 *            rejected claim name, {@code null} when valid
 * @param reason
 *            why the claim was rejected, {@code null} when valid
 */
public record ClaimCheck(boolean valid, String claim, String reason) {

    private static final ClaimCheck OK = new ClaimCheck(true, null, null);

    public static ClaimCheck ok() {
        return OK;
    }

    public static ClaimCheck invalid(String claim, String reason) {
        return new ClaimCheck(false, claim, reason);
    }
}
