package com.wmskiosk.domain.exception;

/**
 * Excepción lanzada cuando falla la E/S con el lector de tarjetas.
 */
public class CardReaderException extends RuntimeException {

    public CardReaderException(String message) {
        super(message);
    }

    public CardReaderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando el dispositivo no se puede abrir.
     */
    public static CardReaderException cannotOpen(String deviceName, String reason) {
        return new CardReaderException("No se puede abrir el lector " + deviceName + ": " + reason);
    }

    /**
     * Excepción cuando una lectura falla (transitoria).
     */
    public static CardReaderException readFailed(String deviceName, String reason) {
        return new CardReaderException("Error leyendo del lector " + deviceName + ": " + reason);
    }

    /**
     * Excepción cuando se lee de un dispositivo ya cerrado.
     */
    public static CardReaderException notOpen(String deviceName) {
        return new CardReaderException("El lector no está abierto: " + deviceName);
    }
}
