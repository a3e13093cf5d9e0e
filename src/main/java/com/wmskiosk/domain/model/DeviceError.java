package com.wmskiosk.domain.model;

/**
 * Motivos por los que {@code connect()} puede fallar.
 */
public enum DeviceError {

    /** Ningún dispositivo coincide con VID/PID ni con los nombres conocidos */
    DEVICE_UNAVAILABLE,

    /** El dispositivo existe pero no se pudo abrir */
    CONNECTION_FAILED
}
