/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.services;

import java.util.Objects;
import java.util.Optional;

import villagecompute.appleauth.api.types.AppleAuthResult;

/**
 * Result of {@link AppleAuthAdapter#handleCallback(RequestContext)}: either a redirect (POST leg) or an authenticated
 * result (GET leg). Exactly one side is present.
 */
public final class CallbackOutcome {

    private final CallbackRedirect redirect;
    private final AppleAuthResult result;

    private CallbackOutcome(CallbackRedirect redirect, AppleAuthResult result) {
        this.redirect = redirect;
        this.result = result;
    }

    public static CallbackOutcome redirect(CallbackRedirect redirect) {
        return new CallbackOutcome(Objects.requireNonNull(redirect), null);
    }

    public static CallbackOutcome authenticated(AppleAuthResult result) {
        return new CallbackOutcome(null, Objects.requireNonNull(result));
    }

    public boolean isRedirect() {
        return redirect != null;
    }

    public Optional<CallbackRedirect> redirect() {
        return Optional.ofNullable(redirect);
    }

    public Optional<AppleAuthResult> result() {
        return Optional.ofNullable(result);
    }
}
