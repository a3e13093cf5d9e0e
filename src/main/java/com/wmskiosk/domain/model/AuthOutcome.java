package com.wmskiosk.domain.model;

/**
 * Resultado de un intento de autenticación.
 */
public enum AuthOutcome {

    /** Empleado activo encontrado - sesión iniciada */
    SUCCESS,

    /** Identificador desconocido o empleado inactivo */
    UNAUTHORIZED,

    /** Demasiados fallos dentro de la ventana de bloqueo */
    LOCKED
}
