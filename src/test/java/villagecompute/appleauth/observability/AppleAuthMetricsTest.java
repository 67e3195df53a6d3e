/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.appleauth.exceptions.FailureKind;

class AppleAuthMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private AppleAuthMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AppleAuthMetrics(meterRegistry);
    }

    @Test
    void testCallbackOutcomesTaggedByResult() {
        metrics.recordCallbackSuccess();
        metrics.recordCallbackRedirect();
        metrics.recordCallbackFailure(FailureKind.ID_TOKEN_CLAIMS_INVALID);
        metrics.recordCallbackFailure(FailureKind.ID_TOKEN_CLAIMS_INVALID);

        assertEquals(1.0, count("success"));
        assertEquals(1.0, count("redirect"));
        assertEquals(2.0, count("id_token_claims_invalid"));
    }

    private double count(String result) {
        return meterRegistry.get(AppleAuthMetrics.CALLBACKS).tag("result", result).counter().count();
    }
}
