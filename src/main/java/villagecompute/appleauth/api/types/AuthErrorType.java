/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body for a failed authentication request.
 *
 * @param error
 *            failure code (e.g. {@code id_token_claims_invalid})
 * @param message
 *            human readable summary, never contains token material
 * @param claim
 *            rejected claim name for claim failures, otherwise omitted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthErrorType(String error, String message, String claim) {
}
