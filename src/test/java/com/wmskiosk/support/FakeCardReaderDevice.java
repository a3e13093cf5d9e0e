package com.wmskiosk.support;

import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.port.CardReaderDevice;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lector guionizado: cada lectura consume el siguiente paso (reporte o error). Sin pasos
 * pendientes se comporta como un timeout y devuelve un reporte vacío.
 */
public final class FakeCardReaderDevice implements CardReaderDevice {

    public static final int REPORT_SIZE = 64;

    private final String name;
    private final LinkedBlockingQueue<Object> steps = new LinkedBlockingQueue<>();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicInteger readCount = new AtomicInteger();

    public FakeCardReaderDevice(String name) {
        this.name = name;
    }

    /**
     * Reporte HID de 64 bytes con el texto ASCII y relleno de ceros.
     */
    public static byte[] report(String text) {
        byte[] ascii = text.getBytes(StandardCharsets.US_ASCII);
        byte[] report = new byte[Math.max(REPORT_SIZE, ascii.length)];
        System.arraycopy(ascii, 0, report, 0, ascii.length);
        return report;
    }

    public FakeCardReaderDevice thenReport(String text) {
        steps.add(report(text));
        return this;
    }

    public FakeCardReaderDevice thenBytes(byte[] raw) {
        steps.add(raw);
        return this;
    }

    public FakeCardReaderDevice thenFail(String reason) {
        steps.add(CardReaderException.readFailed(name, reason));
        return this;
    }

    @Override
    public byte[] read(int timeoutMs) {
        readCount.incrementAndGet();
        Object step;
        try {
            step = steps.poll(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new byte[0];
        }

        if (step == null) {
            return new byte[0];
        }
        if (step instanceof CardReaderException) {
            throw (CardReaderException) step;
        }
        return (byte[]) step;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    @Override
    public String name() {
        return name;
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    public int getReadCount() {
        return readCount.get();
    }

    public boolean hasPendingSteps() {
        return !steps.isEmpty();
    }
}
