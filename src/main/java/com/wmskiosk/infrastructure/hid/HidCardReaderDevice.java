package com.wmskiosk.infrastructure.hid;

import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.port.CardReaderDevice;
import org.hid4java.HidDevice;

import java.util.Arrays;

/**
 * Adaptador de un HidDevice abierto a {@link CardReaderDevice}.
 */
public class HidCardReaderDevice implements CardReaderDevice {

    private static final byte[] EMPTY = new byte[0];

    private final HidDevice device;
    private final int reportSize;
    private final String name;

    HidCardReaderDevice(HidDevice device, int reportSize) {
        this.device = device;
        this.reportSize = reportSize;
        this.name = String.format("%s (0x%04X:0x%04X)",
                device.getProduct(), device.getVendorId() & 0xFFFF, device.getProductId() & 0xFFFF);
    }

    @Override
    public byte[] read(int timeoutMs) {
        byte[] buffer = new byte[reportSize];
        int read = device.read(buffer, timeoutMs);

        if (read < 0) {
            throw CardReaderException.readFailed(name, device.getLastErrorMessage());
        }
        if (read == 0) {
            return EMPTY;
        }
        return Arrays.copyOf(buffer, read);
    }

    @Override
    public void close() {
        device.close();
    }

    @Override
    public String name() {
        return name;
    }
}
