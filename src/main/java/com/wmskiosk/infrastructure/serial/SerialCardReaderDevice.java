package com.wmskiosk.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.port.CardReaderDevice;

import java.util.Arrays;

/**
 * Adaptador de un SerialPort abierto a {@link CardReaderDevice}.
 * Cada lectura devuelve lo que haya llegado dentro del timeout, como un reporte HID.
 */
public class SerialCardReaderDevice implements CardReaderDevice {

    private static final byte[] EMPTY = new byte[0];
    private static final int BUFFER_SIZE = 64;

    private final SerialPort port;

    SerialCardReaderDevice(SerialPort port) {
        this.port = port;
    }

    @Override
    public byte[] read(int timeoutMs) {
        if (!port.isOpen()) {
            throw CardReaderException.notOpen(port.getSystemPortName());
        }

        port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING, timeoutMs, 0);

        byte[] buffer = new byte[BUFFER_SIZE];
        int read = port.readBytes(buffer, buffer.length);

        if (read < 0) {
            throw CardReaderException.readFailed(port.getSystemPortName(),
                    "código de error " + port.getLastErrorCode());
        }
        if (read == 0) {
            return EMPTY;
        }
        return Arrays.copyOf(buffer, read);
    }

    @Override
    public void close() {
        port.closePort();
    }

    @Override
    public String name() {
        return port.getSystemPortName();
    }
}
