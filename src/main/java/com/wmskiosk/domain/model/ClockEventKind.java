package com.wmskiosk.domain.model;

/**
 * Tipo de fichaje notificado al directorio.
 */
public enum ClockEventKind {
    IN,
    OUT
}
