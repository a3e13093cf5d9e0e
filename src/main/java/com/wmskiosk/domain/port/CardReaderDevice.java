package com.wmskiosk.domain.port;

import com.wmskiosk.domain.exception.CardReaderException;

/**
 * Puerto (interfaz) mínimo de un lector abierto.
 * Hay un adaptador por biblioteca real (HID, serial) y uno falso para tests.
 */
public interface CardReaderDevice {

    /**
     * Lee un reporte del dispositivo, bloqueando como máximo {@code timeoutMs}.
     *
     * @param timeoutMs Tiempo máximo de espera en milisegundos
     * @return Bytes leídos; arreglo vacío si no llegó nada
     * @throws CardReaderException si la lectura falla
     */
    byte[] read(int timeoutMs);

    /**
     * Cierra el dispositivo. Solo se llama una vez.
     */
    void close();

    /**
     * Nombre legible para logs y estado.
     */
    String name();
}
