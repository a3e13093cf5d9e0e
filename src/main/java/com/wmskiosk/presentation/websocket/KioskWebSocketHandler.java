package com.wmskiosk.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wmskiosk.application.dto.AuthResultDto;
import com.wmskiosk.application.dto.ReaderStatusDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handler de WebSocket que empuja a la UI del kiosco las lecturas, los resultados de
 * autenticación y los cambios de estado del lector.
 *
 * <p>Los broadcasts llegan desde varios hilos (lector, scheduler, peticiones HTTP); cada
 * sesión se envuelve en un {@link ConcurrentWebSocketSessionDecorator} para serializar los envíos.</p>
 */
@Component
@Slf4j
public class KioskWebSocketHandler extends TextWebSocketHandler {

    public static final String CARD_SCANNED = "CARD_SCANNED";
    public static final String AUTH_RESULT = "AUTH_RESULT";
    public static final String READER_STATUS = "READER_STATUS";
    public static final String SESSION_ENDED = "SESSION_ENDED";

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.info("Nueva conexión WebSocket: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Conexión WebSocket cerrada: {} (Restantes: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Mensaje recibido de {}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Error en WebSocket {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Notifica una tarjeta leída, antes de autenticarla.
     *
     * @param cardId Identificador decodificado
     */
    public void broadcastCardScanned(String cardId) {
        broadcast(CARD_SCANNED, new CardScannedData(cardId, LocalDateTime.now().toString()));
    }

    public void broadcastAuthResult(AuthResultDto result) {
        broadcast(AUTH_RESULT, result);
    }

    public void broadcastReaderStatus(ReaderStatusDto status) {
        broadcast(READER_STATUS, status);
    }

    /**
     * Notifica el fin de la sesión del empleado.
     *
     * @param employeeName Nombre del empleado
     * @param reason       LOGOUT o EXPIRED
     */
    public void broadcastSessionEnded(String employeeName, String reason) {
        broadcast(SESSION_ENDED, new SessionEndedData(employeeName, reason));
    }

    /**
     * Método genérico para broadcast de mensajes.
     */
    private void broadcast(String type, Object data) {
        if (sessions.isEmpty()) {
            log.debug("No hay clientes WebSocket conectados");
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(new WebSocketMessage(type, data));
        } catch (IOException e) {
            log.error("Error creando mensaje JSON: {}", e.getMessage());
            return;
        }

        TextMessage message = new TextMessage(json);
        for (WebSocketSession session : sessions.values()) {
            if (session.isOpen()) {
                try {
                    session.sendMessage(message);
                } catch (IOException e) {
                    log.error("Error enviando a sesión {}: {}", session.getId(), e.getMessage());
                    sessions.remove(session.getId());
                } catch (RuntimeException e) {
                    // Cliente lento que superó los límites de envío, o sesión ya cerrada
                    log.warn("Sesión {} descartada: {}", session.getId(), e.getMessage());
                    sessions.remove(session.getId());
                }
            }
        }

        log.debug("Broadcast {} enviado a {} clientes", type, sessions.size());
    }

    // Records para mensajes
    record WebSocketMessage(String type, Object data) {
    }

    record CardScannedData(String cardId, String scannedAt) {
    }

    record SessionEndedData(String employeeName, String reason) {
    }
}
