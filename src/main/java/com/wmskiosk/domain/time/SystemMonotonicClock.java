package com.wmskiosk.domain.time;

/**
 * {@link MonotonicClock} de producción respaldado por {@link System#nanoTime()}.
 * No le afectan los cambios de hora (NTP, horario de verano, ajustes manuales).
 */
public enum SystemMonotonicClock implements MonotonicClock {

    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
