package com.wmskiosk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estadísticas de login del kiosco.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginStatistics {

    private String currentUser;

    private boolean authenticated;

    private long sessionDurationMinutes;

    /** Fallos dentro de la ventana de bloqueo, sumando todos los identificadores */
    private int failedAttempts;

    private int lockedIdentifiers;
}
