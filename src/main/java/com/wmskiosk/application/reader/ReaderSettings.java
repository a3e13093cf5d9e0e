package com.wmskiosk.application.reader;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * Parámetros del lector. Los valores por defecto corresponden al TS-HRW380.
 */
@Getter
@Builder
@ToString
public class ReaderSettings {

    @Builder.Default
    private final int vendorId = 0x25DD;

    @Builder.Default
    private final int productId = 0x3000;

    /** Nombres de producto aceptados si no coincide VID/PID */
    @Singular
    private final List<String> knownReaderNames;

    /** Espera máxima de cada lectura; acota la reacción a la orden de parar */
    @Builder.Default
    private final int readTimeoutMs = 100;

    @Builder.Default
    private final Duration suppressionWindow = DuplicateSuppressor.DEFAULT_WINDOW;

    @Builder.Default
    private final int queueCapacity = ScanQueue.DEFAULT_CAPACITY;

    @Builder.Default
    private final int maxConsecutiveErrors = 3;

    @Builder.Default
    private final Duration joinTimeout = Duration.ofSeconds(2);

    @Builder.Default
    private final int minTokenLength = FrameDecoder.DEFAULT_MIN_TOKEN_LENGTH;

    public static ReaderSettings defaults() {
        return ReaderSettings.builder()
                .knownReaderName("TS-HRW")
                .build();
    }
}
