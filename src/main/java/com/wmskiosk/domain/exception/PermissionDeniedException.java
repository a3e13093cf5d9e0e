package com.wmskiosk.domain.exception;

/**
 * Excepción para quien necesite un fallo duro cuando falta un permiso.
 */
public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public static PermissionDeniedException notAuthenticated() {
        return new PermissionDeniedException("Nadie ha iniciado sesión");
    }

    public static PermissionDeniedException missing(String permission) {
        return new PermissionDeniedException("Se requiere el permiso '" + permission + "'");
    }
}
