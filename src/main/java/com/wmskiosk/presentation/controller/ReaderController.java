package com.wmskiosk.presentation.controller;

import com.wmskiosk.application.dto.ReaderStatusDto;
import com.wmskiosk.application.reader.CardReaderSession;
import com.wmskiosk.application.scheduler.ReaderReconnectJob;
import com.wmskiosk.domain.model.ConnectResult;
import com.wmskiosk.domain.model.ReaderDeviceInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Controlador REST para el lector de tarjetas: conexión, estado y lectura puntual.
 */
@RestController
@RequestMapping("/api/reader")
@RequiredArgsConstructor
@Slf4j
public class ReaderController {

    private static final long MAX_READ_TIMEOUT_MS = 30_000;

    private final CardReaderSession readerSession;
    private final ReaderReconnectJob reconnectJob;

    /**
     * Conecta con el lector configurado.
     */
    @PostMapping("/connect")
    public ResponseEntity<Map<String, Object>> connect() {
        Map<String, Object> response = new HashMap<>();

        log.info("Solicitud de conexión del lector");
        ConnectResult result = readerSession.connect();

        response.put("success", result.isSuccess());
        response.put("message", result.getMessage());
        result.error().ifPresent(error -> response.put("error", error.name()));
        response.put("status", ReaderStatusDto.fromDomain(readerSession.status()));

        return result.isSuccess()
                ? ResponseEntity.ok(response)
                : ResponseEntity.badRequest().body(response);
    }

    /**
     * Desconecta el lector. Es idempotente.
     */
    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect() {
        Map<String, Object> response = new HashMap<>();

        log.info("Solicitud de desconexión del lector");
        reconnectJob.cancelRetries();
        readerSession.disconnect();

        response.put("success", true);
        response.put("message", "Lector desconectado");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/status")
    public ResponseEntity<ReaderStatusDto> getStatus() {
        return ResponseEntity.ok(ReaderStatusDto.fromDomain(readerSession.status()));
    }

    /**
     * Lista los dispositivos visibles para diagnóstico.
     */
    @GetMapping("/devices")
    public ResponseEntity<?> getDevices() {
        try {
            List<ReaderDeviceInfo> devices = readerSession.availableDevices();
            return ResponseEntity.ok(devices);
        } catch (Exception e) {
            log.error("Error enumerando dispositivos: {}", e.getMessage());
            Map<String, Object> response = new HashMap<>();
            response.put("success", false);
            response.put("message", "Error: " + e.getMessage());
            return ResponseEntity.internalServerError().body(response);
        }
    }

    /**
     * Espera una tarjeta como máximo {@code timeoutMs} milisegundos.
     *
     * @param timeoutMs Espera máxima (0 = no esperar)
     */
    @GetMapping("/read")
    public ResponseEntity<Map<String, Object>> readCard(@RequestParam(defaultValue = "5000") long timeoutMs) {
        Map<String, Object> response = new HashMap<>();

        if (timeoutMs < 0 || timeoutMs > MAX_READ_TIMEOUT_MS) {
            response.put("success", false);
            response.put("message", "timeoutMs debe estar entre 0 y " + MAX_READ_TIMEOUT_MS);
            return ResponseEntity.badRequest().body(response);
        }

        Optional<String> card = timeoutMs == 0
                ? readerSession.tryReadCard()
                : readerSession.readCard(Duration.ofMillis(timeoutMs));

        response.put("success", card.isPresent());
        response.put("cardId", card.orElse(null));
        if (card.isEmpty()) {
            response.put("message", "No se leyó ninguna tarjeta");
        }
        return ResponseEntity.ok(response);
    }
}
