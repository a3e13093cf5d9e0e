package com.wmskiosk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * WMS Kiosk - Aplicación Principal
 *
 * Estación de identificación de empleados del almacén:
 * - Lectura de tarjetas RFID via lector USB HID (TS-HRW380) o serie
 * - Autenticación con bloqueo por intentos fallidos y sesión única
 * - Fichajes de entrada/salida en CSV
 * - Notificaciones en tiempo real via WebSocket
 */
@SpringBootApplication
@EnableScheduling
public class WmsKioskApplication {

    public static void main(String[] args) {
        SpringApplication.run(WmsKioskApplication.class, args);
        System.out.println("\n" +
            "╔═══════════════════════════════════════════════════════════╗\n" +
            "║            WMS Kiosk - Started Successfully               ║\n" +
            "║                                                           ║\n" +
            "║  🌐 API: http://localhost:8080/api/reader/status          ║\n" +
            "║  📡 Eventos en tiempo real: ws://localhost:8080/ws/kiosk  ║\n" +
            "╚═══════════════════════════════════════════════════════════╝\n"
        );
    }
}
