package com.wmskiosk.application.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Política de bloqueo y de sesión del kiosco.
 */
@Getter
@Builder
@ToString
public class AuthPolicy {

    /** Fallos permitidos dentro de la ventana antes de bloquear */
    @Builder.Default
    private final int maxAttempts = 5;

    @Builder.Default
    private final Duration lockoutWindow = Duration.ofMinutes(15);

    /** Inactividad máxima antes de considerar la sesión expirada */
    @Builder.Default
    private final Duration sessionTimeout = Duration.ofMinutes(60);

    public static AuthPolicy defaults() {
        return AuthPolicy.builder().build();
    }
}
