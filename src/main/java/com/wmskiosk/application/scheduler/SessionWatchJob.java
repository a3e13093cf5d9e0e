package com.wmskiosk.application.scheduler;

import com.wmskiosk.application.service.KioskLoginService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Consulta periódicamente el usuario actual para que una sesión expirada se anuncie a la
 * UI aunque nadie esté usando el kiosco.
 */
@Component
@RequiredArgsConstructor
public class SessionWatchJob {

    private final KioskLoginService kioskLoginService;

    @Scheduled(fixedDelayString = "${kiosk.auth.session-check-interval-ms:60000}")
    public void checkSession() {
        kioskLoginService.getCurrentUser();
    }
}
