package com.wmskiosk.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Resultado tipado de {@code authenticate}. Los casos esperados nunca son excepciones.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthResult {

    private final AuthOutcome outcome;

    private final String identifier;

    private final Employee employee;

    /** Minutos restantes de bloqueo (solo para LOCKED) */
    private final long remainingLockoutMinutes;

    public static AuthResult success(String identifier, Employee employee) {
        return new AuthResult(AuthOutcome.SUCCESS, identifier, employee, 0);
    }

    public static AuthResult unauthorized(String identifier) {
        return new AuthResult(AuthOutcome.UNAUTHORIZED, identifier, null, 0);
    }

    public static AuthResult locked(String identifier, long remainingMinutes) {
        return new AuthResult(AuthOutcome.LOCKED, identifier, null, remainingMinutes);
    }

    public boolean isSuccess() {
        return outcome == AuthOutcome.SUCCESS;
    }
}
