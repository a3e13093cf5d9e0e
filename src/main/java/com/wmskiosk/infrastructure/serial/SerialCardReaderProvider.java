package com.wmskiosk.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.model.ReaderDeviceInfo;
import com.wmskiosk.domain.port.CardReaderDevice;
import com.wmskiosk.domain.port.CardReaderProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lectores conectados por puerto serial (modo COM del TS-HRW380) usando jSerialComm.
 *
 * <p>Con {@code kiosk.reader.serial.port=AUTO} se enumeran todos los puertos y la selección
 * por VID/PID o nombre la hace la sesión del lector; con un nombre concreto (ej: COM3) solo
 * se ofrece ese puerto.</p>
 */
@Component
@ConditionalOnProperty(name = "kiosk.reader.transport", havingValue = "SERIAL")
@Slf4j
public class SerialCardReaderProvider implements CardReaderProvider {

    static final String AUTO = "AUTO";

    @Value("${kiosk.reader.serial.port:AUTO}")
    private String portName = AUTO;

    @Value("${kiosk.reader.serial.baud-rate:9600}")
    private int baudRate = 9600;

    @Override
    public List<ReaderDeviceInfo> enumerate() {
        SerialPort[] ports = SerialPort.getCommPorts();

        log.info("Escaneando puertos seriales. Encontrados: {}", ports.length);

        return Arrays.stream(ports)
                .filter(port -> AUTO.equalsIgnoreCase(portName)
                        || port.getSystemPortName().equalsIgnoreCase(portName))
                .map(this::toReaderDeviceInfo)
                .collect(Collectors.toList());
    }

    @Override
    public CardReaderDevice open(ReaderDeviceInfo info) {
        SerialPort port = Arrays.stream(SerialPort.getCommPorts())
                .filter(p -> p.getSystemPortName().equalsIgnoreCase(info.getPath()))
                .findFirst()
                .orElseThrow(() -> CardReaderException.cannotOpen(info.getPath(), "puerto no encontrado"));

        if (port.isOpen()) {
            throw CardReaderException.cannotOpen(info.getPath(), "el puerto ya está en uso");
        }

        port.setBaudRate(baudRate);
        port.setNumDataBits(8);
        port.setNumStopBits(SerialPort.ONE_STOP_BIT);
        port.setParity(SerialPort.NO_PARITY);

        if (!port.openPort()) {
            throw CardReaderException.cannotOpen(info.getPath(), "openPort() falló");
        }

        log.info("Puerto {} abierto exitosamente a {} baudios", port.getSystemPortName(), baudRate);
        return new SerialCardReaderDevice(port);
    }

    /**
     * Convierte un SerialPort de jSerialComm a nuestro modelo de dominio.
     */
    private ReaderDeviceInfo toReaderDeviceInfo(SerialPort port) {
        return ReaderDeviceInfo.builder()
                .vendorId(port.getVendorID())
                .productId(port.getProductID())
                .productName(port.getPortDescription())
                .manufacturer(port.getDescriptivePortName())
                .path(port.getSystemPortName())
                .build();
    }
}
