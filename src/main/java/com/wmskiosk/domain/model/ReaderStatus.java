package com.wmskiosk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Foto del estado del lector en un instante.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReaderStatus {

    private ReaderState state;

    private boolean connected;

    /** Indica si el hilo de lectura está en marcha */
    private boolean monitoring;

    /** Indica si hay un dispatcher entregando tarjetas a un callback */
    private boolean dispatching;

    private String lastError;

    private String deviceName;

    private int pendingScans;
}
