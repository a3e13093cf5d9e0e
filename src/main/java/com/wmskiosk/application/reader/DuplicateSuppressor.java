package com.wmskiosk.application.reader;

import java.time.Duration;
import java.util.Objects;

/**
 * Descarta una tarjeta idéntica a la anterior si llega dentro de la ventana de supresión.
 * Una tarjeta apoyada en el lector genera muchos reportes repetidos; solo el primero cuenta.
 *
 * <p>No es thread-safe; pertenece al hilo de lectura.</p>
 */
public class DuplicateSuppressor {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(2);

    private final long windowNanos;

    private String lastToken;
    private long lastTimeNanos;

    public DuplicateSuppressor() {
        this(DEFAULT_WINDOW);
    }

    public DuplicateSuppressor(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Ventana de supresión inválida: " + window);
        }
        this.windowNanos = window.toNanos();
    }

    /**
     * @param token    Identificador decodificado
     * @param nowNanos Tick monotónico actual
     * @return true si el identificador debe pasar a la cola
     */
    public boolean accept(String token, long nowNanos) {
        if (Objects.equals(token, lastToken) && nowNanos - lastTimeNanos < windowNanos) {
            return false;
        }
        lastToken = token;
        lastTimeNanos = nowNanos;
        return true;
    }

    public void reset() {
        lastToken = null;
        lastTimeNanos = 0L;
    }
}
