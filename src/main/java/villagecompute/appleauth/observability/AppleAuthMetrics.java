/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.observability;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import villagecompute.appleauth.exceptions.FailureKind;

/**
 * Counters for the Sign in with Apple flow.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code appleauth_callbacks_total{result}} - callback outcomes; {@code result} is
 * {@code success}, {@code redirect} or a {@link FailureKind#code()}</li>
 * <li><b>Counters:</b> {@code appleauth_jwks_fetches_total{result}} - signing-key set downloads
 * ({@code success}/{@code failure})</li>
 * <li><b>Counters:</b> {@code appleauth_client_secrets_issued_total} - client-secret JWTs minted</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class AppleAuthMetrics {

    public static final String CALLBACKS = "appleauth_callbacks_total";
    public static final String JWKS_FETCHES = "appleauth_jwks_fetches_total";
    public static final String CLIENT_SECRETS = "appleauth_client_secrets_issued_total";

    private final MeterRegistry registry;

    @Inject
    public AppleAuthMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCallbackSuccess() {
        callbackCounter("success").increment();
    }

    public void recordCallbackRedirect() {
        callbackCounter("redirect").increment();
    }

    public void recordCallbackFailure(FailureKind kind) {
        callbackCounter(kind.code()).increment();
    }

    public void recordJwksFetch(boolean success) {
        Counter.builder(JWKS_FETCHES).description("Apple signing-key set downloads")
                .tag("result", success ? "success" : "failure").register(registry).increment();
    }

    public void recordClientSecretIssued() {
        Counter.builder(CLIENT_SECRETS).description("Client secret assertions minted").register(registry)
                .increment();
    }

    private Counter callbackCounter(String result) {
        return Counter.builder(CALLBACKS).description("Sign in with Apple callback outcomes").tag("result", result)
                .register(registry);
    }
}
