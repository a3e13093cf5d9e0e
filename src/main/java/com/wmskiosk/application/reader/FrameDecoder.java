package com.wmskiosk.application.reader;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Convierte los reportes crudos del lector en identificadores de tarjeta.
 *
 * <p>El lector emula un teclado: cada reporte trae unos pocos caracteres y la tarjeta
 * termina con CR o LF. Un identificador puede llegar partido en varios reportes, así que
 * el segmento incompleto se conserva entre llamadas.</p>
 *
 * <p>No es thread-safe; pertenece al hilo de lectura. Nunca lanza excepciones: los bytes
 * no imprimibles se descartan.</p>
 */
@Slf4j
public class FrameDecoder {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 6;

    // Sin terminador a la vista: se descarta para no crecer sin límite
    static final int MAX_BUFFER_LENGTH = 256;

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final int minTokenLength;
    private final StringBuilder buffer = new StringBuilder();

    public FrameDecoder() {
        this(DEFAULT_MIN_TOKEN_LENGTH);
    }

    public FrameDecoder(int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("La longitud mínima debe ser positiva: " + minTokenLength);
        }
        this.minTokenLength = minTokenLength;
    }

    /**
     * Procesa un reporte y devuelve los identificadores completados.
     *
     * @param report Bytes del reporte (puede ser null o vacío)
     * @return Identificadores emitidos, en orden; vacío si no se completó ninguno
     */
    public List<String> feed(byte[] report) {
        if (report == null || report.length == 0 || isIdle(report)) {
            return Collections.emptyList();
        }

        List<String> tokens = new ArrayList<>();
        int dropped = 0;

        for (byte b : report) {
            int value = b & 0xFF;

            if (b == CR || b == LF) {
                completeSegment(tokens);
            } else if (value >= 32 && value <= 126) {
                buffer.append((char) value);
            } else if (value != 0) {
                dropped++;
            }
        }

        if (dropped > 0) {
            log.debug("Descartados {} bytes no imprimibles del reporte", dropped);
        }

        if (buffer.length() > MAX_BUFFER_LENGTH) {
            log.warn("Buffer del lector sin terminador ({} caracteres), descartando", buffer.length());
            buffer.setLength(0);
        }

        return tokens;
    }

    /**
     * Segmento pendiente de terminador.
     */
    public String pending() {
        return buffer.toString();
    }

    public void reset() {
        buffer.setLength(0);
    }

    private void completeSegment(List<String> tokens) {
        String segment = buffer.toString().trim();
        buffer.setLength(0);

        if (segment.length() >= minTokenLength) {
            tokens.add(segment);
        } else if (!segment.isEmpty()) {
            log.debug("Segmento demasiado corto descartado: [{}]", segment);
        }
    }

    private static boolean isIdle(byte[] report) {
        for (byte b : report) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }
}
