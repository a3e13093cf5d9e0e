package com.wmskiosk.infrastructure.hid;

import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.model.ReaderDeviceInfo;
import com.wmskiosk.domain.port.CardReaderDevice;
import com.wmskiosk.domain.port.CardReaderProvider;
import lombok.extern.slf4j.Slf4j;
import org.hid4java.HidDevice;
import org.hid4java.HidManager;
import org.hid4java.HidServices;
import org.hid4java.HidServicesSpecification;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Enumeración y apertura de lectores HID usando hid4java.
 */
@Component
@ConditionalOnProperty(name = "kiosk.reader.transport", havingValue = "HID", matchIfMissing = true)
@Slf4j
public class HidCardReaderProvider implements CardReaderProvider {

    @Value("${kiosk.reader.report-size:64}")
    private int reportSize = 64;

    private HidServices hidServices;

    @Override
    public List<ReaderDeviceInfo> enumerate() {
        List<HidDevice> devices = services().getAttachedHidDevices();

        log.info("Escaneando dispositivos HID. Encontrados: {}", devices.size());

        return devices.stream()
                .map(this::toReaderDeviceInfo)
                .collect(Collectors.toList());
    }

    @Override
    public CardReaderDevice open(ReaderDeviceInfo info) {
        HidDevice device = services().getAttachedHidDevices().stream()
                .filter(d -> Objects.equals(d.getPath(), info.getPath()))
                .findFirst()
                .orElseThrow(() -> CardReaderException.cannotOpen(info.describe(), "el dispositivo ya no está conectado"));

        return openAttached(device, info, reportSize);
    }

    /**
     * Abre un dispositivo ya localizado y lo deja en modo no bloqueante.
     */
    static CardReaderDevice openAttached(HidDevice device, ReaderDeviceInfo info, int reportSize) {
        if (!device.open()) {
            throw CardReaderException.cannotOpen(info.describe(), device.getLastErrorMessage());
        }

        device.setNonBlocking(true);

        log.info("Lector HID abierto: {} {}", device.getManufacturer(), device.getProduct());
        return new HidCardReaderDevice(device, reportSize);
    }

    @PreDestroy
    public synchronized void cleanup() {
        if (hidServices != null) {
            log.info("Liberando servicios HID...");
            hidServices.shutdown();
            hidServices = null;
        }
    }

    private synchronized HidServices services() {
        if (hidServices == null) {
            HidServicesSpecification specification = new HidServicesSpecification();
            specification.setAutoStart(false);
            hidServices = HidManager.getHidServices(specification);
            hidServices.start();
        }
        return hidServices;
    }

    /**
     * Convierte un HidDevice de hid4java a nuestro modelo de dominio.
     */
    private ReaderDeviceInfo toReaderDeviceInfo(HidDevice device) {
        return ReaderDeviceInfo.builder()
                .vendorId(device.getVendorId() & 0xFFFF)
                .productId(device.getProductId() & 0xFFFF)
                .productName(device.getProduct())
                .manufacturer(device.getManufacturer())
                .path(device.getPath())
                .build();
    }
}
