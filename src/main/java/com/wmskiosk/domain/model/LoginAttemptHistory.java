package com.wmskiosk.domain.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalLong;

/**
 * Historial de intentos fallidos de un identificador.
 * Guarda los ticks monotónicos en orden de llegada y se poda a la ventana de bloqueo.
 * No es thread-safe: su dueño lo protege.
 */
public class LoginAttemptHistory {

    private final Deque<Long> failureTicks = new ArrayDeque<>();

    /**
     * Elimina los fallos que ya quedaron fuera de la ventana.
     *
     * @return número de fallos que siguen dentro de la ventana
     */
    public int prune(long nowNanos, long windowNanos) {
        while (!failureTicks.isEmpty() && nowNanos - failureTicks.peekFirst() >= windowNanos) {
            failureTicks.pollFirst();
        }
        return failureTicks.size();
    }

    public void recordFailure(long nowNanos) {
        failureTicks.addLast(nowNanos);
    }

    /**
     * Tick del fallo más antiguo aún registrado. Los ticks pueden ser negativos.
     */
    public OptionalLong oldestFailure() {
        Long oldest = failureTicks.peekFirst();
        return oldest != null ? OptionalLong.of(oldest) : OptionalLong.empty();
    }
}
