package com.wmskiosk.domain.time;

/**
 * Fuente de tiempo monotónica para todas las ventanas de tiempo
 * (supresión de duplicados, bloqueo de intentos, inactividad de sesión).
 *
 * <p>La hora de pared ({@link java.time.Clock}) solo se usa para mostrar marcas de tiempo.</p>
 */
public interface MonotonicClock {

    /**
     * Tick monotónico en nanosegundos. Solo sirve para calcular diferencias.
     */
    long nowNanos();
}
