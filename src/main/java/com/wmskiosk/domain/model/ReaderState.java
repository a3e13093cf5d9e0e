package com.wmskiosk.domain.model;

/**
 * Estados de la conexión con el lector de tarjetas.
 */
public enum ReaderState {

    DISCONNECTED,

    CONNECTING,

    /** Conectado y con el hilo de lectura activo */
    CONNECTED,

    /** El hilo de lectura se detuvo tras agotar los reintentos */
    ERROR
}
