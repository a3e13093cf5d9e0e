package com.wmskiosk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Lectura de tarjeta ya decodificada y filtrada de duplicados.
 * Se consume una sola vez y nunca se persiste.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardScanEvent {

    /** Identificador de la tarjeta (al menos 6 caracteres imprimibles) */
    private String cardId;

    /** Momento en que el lector entregó la lectura */
    private Instant observedAt;

    public static CardScanEvent of(String cardId, Instant observedAt) {
        return CardScanEvent.builder()
                .cardId(cardId)
                .observedAt(observedAt)
                .build();
    }
}
