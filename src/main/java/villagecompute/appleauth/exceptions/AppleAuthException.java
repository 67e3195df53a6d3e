/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.appleauth.exceptions;

/**
 * Base class for every failure raised while completing a Sign in with Apple callback.
 *
 * <p>
 * Carries a {@link FailureKind} so callers can distinguish configuration problems from rejected tokens without
 * inspecting messages. The original cause (transport error, parser error) is kept for logging only and must not be
 * echoed to end users.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class AppleAuthException extends RuntimeException {

    private final FailureKind kind;

    public AppleAuthException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AppleAuthException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
