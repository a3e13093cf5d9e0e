package com.wmskiosk.support;

import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.model.ReaderDeviceInfo;
import com.wmskiosk.domain.port.CardReaderDevice;
import com.wmskiosk.domain.port.CardReaderProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Proveedor en memoria: los dispositivos visibles y el que se entrega al abrir se
 * controlan desde el test.
 */
public final class FakeCardReaderProvider implements CardReaderProvider {

    public static final int READER_VID = 0x25DD;
    public static final int READER_PID = 0x3000;

    private final List<ReaderDeviceInfo> visible = new CopyOnWriteArrayList<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private volatile CardReaderDevice nextDevice;
    private volatile String openFailure;
    private volatile RuntimeException openCrash;

    public static ReaderDeviceInfo readerInfo() {
        return ReaderDeviceInfo.builder()
                .vendorId(READER_VID)
                .productId(READER_PID)
                .productName("TS-HRW380")
                .manufacturer("Toshiba")
                .path("fake://reader")
                .build();
    }

    public static ReaderDeviceInfo otherInfo(String productName) {
        return ReaderDeviceInfo.builder()
                .vendorId(0x046D)
                .productId(0xC52B)
                .productName(productName)
                .manufacturer("Other")
                .path("fake://" + productName)
                .build();
    }

    public FakeCardReaderProvider withVisible(ReaderDeviceInfo info) {
        visible.add(info);
        return this;
    }

    public FakeCardReaderProvider withDevice(CardReaderDevice device) {
        this.nextDevice = device;
        return this;
    }

    public FakeCardReaderProvider failingOpen(String reason) {
        this.openFailure = reason;
        return this;
    }

    /**
     * Hace que open() lance una excepción que no es CardReaderException, como un fallo nativo.
     */
    public FakeCardReaderProvider crashingOpen(RuntimeException crash) {
        this.openCrash = crash;
        return this;
    }

    public void clearVisible() {
        visible.clear();
    }

    @Override
    public List<ReaderDeviceInfo> enumerate() {
        return new ArrayList<>(visible);
    }

    @Override
    public CardReaderDevice open(ReaderDeviceInfo info) {
        openCount.incrementAndGet();
        if (openCrash != null) {
            throw openCrash;
        }
        if (openFailure != null) {
            throw CardReaderException.cannotOpen(info.getProductName(), openFailure);
        }
        if (nextDevice == null) {
            throw CardReaderException.cannotOpen(info.getProductName(), "sin dispositivo");
        }
        return nextDevice;
    }

    public int getOpenCount() {
        return openCount.get();
    }
}
