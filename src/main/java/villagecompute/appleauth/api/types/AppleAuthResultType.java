/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.api.types;

import java.util.Map;

/**
 * JSON body returned by the callback endpoint after a successful sign-in.
 *
 * @param provider
 *            always {@code "apple"}
 * @param uid
 *            Apple user id
 * @param info
 *            pruned profile ({@code sub, email, first_name, last_name, name, email_verified, is_private_email})
 * @param extra
 *            pruned raw payload
 */
public record AppleAuthResultType(String provider, String uid, Map<String, Object> info, Map<String, Object> extra) {

    public static AppleAuthResultType from(AppleAuthResult result) {
        return new AppleAuthResultType("apple", result.uid(), result.profile().toInfo(), result.extra());
    }
}
