package com.wmskiosk.domain.port;

import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.model.ReaderDeviceInfo;

import java.util.List;

/**
 * Puerto (interfaz) para enumerar y abrir lectores de tarjetas.
 */
public interface CardReaderProvider {

    /**
     * Lista los dispositivos conectados al sistema.
     *
     * @return Lista de dispositivos; vacía si no hay ninguno
     */
    List<ReaderDeviceInfo> enumerate();

    /**
     * Abre el dispositivo indicado en modo no bloqueante.
     *
     * @param device Dispositivo elegido de {@link #enumerate()}
     * @return Dispositivo abierto
     * @throws CardReaderException si el sistema operativo rechaza la apertura
     */
    CardReaderDevice open(ReaderDeviceInfo device);
}
