package com.wmskiosk.presentation.config;

import com.wmskiosk.presentation.websocket.KioskWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Configuración de WebSocket para la UI del kiosco.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final KioskWebSocketHandler kioskWebSocketHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // La UI corre en la propia estación
        registry.addHandler(kioskWebSocketHandler, "/ws/kiosk")
                .setAllowedOrigins("*");
    }
}
