package com.wmskiosk.domain.model;

/**
 * Estados de la sesión de login del kiosco.
 */
public enum SessionState {

    /** Nadie ha iniciado sesión */
    NONE,

    /** Sesión en curso */
    ACTIVE,

    /** Inactividad superior al timeout, detectada al acceder */
    EXPIRED,

    /** Cerrada explícitamente con logout */
    CLOSED;

    public boolean isTerminal() {
        return this == EXPIRED || this == CLOSED;
    }
}
