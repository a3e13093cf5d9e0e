package com.wmskiosk.application.service;

import com.wmskiosk.application.dto.AuthResultDto;
import com.wmskiosk.application.dto.EmployeeDto;
import com.wmskiosk.application.dto.ReaderStatusDto;
import com.wmskiosk.application.reader.CardReaderSession;
import com.wmskiosk.domain.model.AuthResult;
import com.wmskiosk.domain.model.ConnectResult;
import com.wmskiosk.domain.model.Employee;
import com.wmskiosk.domain.model.ReaderStatus;
import com.wmskiosk.domain.port.EmployeeDirectory;
import com.wmskiosk.presentation.websocket.KioskWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Flujo de login del kiosco: une el lector de tarjetas con la autenticación y avisa a la
 * UI por WebSocket.
 *
 * FLUJO:
 * 1. El lector entrega una tarjeta -> se notifica CARD_SCANNED
 * 2. Se autentica -> se notifica AUTH_RESULT
 * 3. Logout o timeout -> se notifica SESSION_ENDED
 */
@Service
@Slf4j
public class KioskLoginService {

    public static final String REASON_LOGOUT = "LOGOUT";
    public static final String REASON_EXPIRED = "EXPIRED";

    private final CardReaderSession readerSession;
    private final AuthenticationService authService;
    private final EmployeeDirectory employeeDirectory;
    private final KioskWebSocketHandler webSocketHandler;
    private final boolean allowManualLogin;
    private final boolean autoConnect;

    // Empleado anunciado a la UI; sirve para avisar una sola vez cuando la sesión expira
    private final AtomicReference<Employee> announcedEmployee = new AtomicReference<>();

    public KioskLoginService(CardReaderSession readerSession,
            AuthenticationService authService,
            EmployeeDirectory employeeDirectory,
            @Lazy KioskWebSocketHandler webSocketHandler,
            @Value("${kiosk.auth.allow-manual-login:true}") boolean allowManualLogin,
            @Value("${kiosk.reader.auto-connect:true}") boolean autoConnect) {
        this.readerSession = readerSession;
        this.authService = authService;
        this.employeeDirectory = employeeDirectory;
        this.webSocketHandler = webSocketHandler;
        this.allowManualLogin = allowManualLogin;
        this.autoConnect = autoConnect;
    }

    /**
     * Conecta el lector al arrancar y empieza a entregar tarjetas a este servicio.
     * La monitorización arranca aunque la conexión falle: el job de reconexión la recupera.
     */
    @PostConstruct
    public void init() {
        if (!autoConnect) {
            log.info("Auto-conexión del lector deshabilitada");
            return;
        }

        ConnectResult result = readerSession.connect();
        if (result.isSuccess()) {
            log.info("✅ {}", result.getMessage());
        } else {
            log.warn("⚠️ No se pudo conectar el lector al arrancar: {}", result.getMessage());
        }

        readerSession.startMonitoring(this::onCardScanned, this::onReaderStatus);
    }

    /**
     * Procesa una tarjeta leída: la autentica y publica el resultado.
     *
     * @param cardId Identificador decodificado de la tarjeta
     * @return Resultado de la autenticación
     */
    public AuthResult onCardScanned(String cardId) {
        log.info("📇 Tarjeta leída: {}", cardId);
        webSocketHandler.broadcastCardScanned(cardId);
        return authenticateAndPublish(cardId);
    }

    /**
     * Login manual por nombre completo, para empleados sin tarjeta.
     *
     * @throws IllegalStateException    si el login manual está deshabilitado
     * @throws IllegalArgumentException si el nombre está vacío
     */
    public AuthResult loginManually(String name) {
        if (!allowManualLogin) {
            throw new IllegalStateException("El login manual está deshabilitado");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("El nombre es obligatorio");
        }

        log.info("Login manual solicitado: {}", name.trim());
        return authenticateAndPublish(name.trim());
    }

    /**
     * Empleados activos seleccionables en el login manual, ordenados por nombre.
     * Vacío si el login manual está deshabilitado.
     */
    public List<EmployeeDto> getManualIdentities() {
        if (!allowManualLogin) {
            return List.of();
        }

        return employeeDirectory.findAll().stream()
                .filter(Employee::isActive)
                .sorted(Comparator.comparing(Employee::getFullName, String.CASE_INSENSITIVE_ORDER))
                .map(EmployeeDto::fromDomain)
                .collect(Collectors.toList());
    }

    /**
     * Usuario actual. Si la sesión expiró desde la última consulta avisa a la UI.
     */
    public Optional<Employee> getCurrentUser() {
        Optional<Employee> current = authService.getCurrentUser();
        if (current.isEmpty()) {
            Employee previous = announcedEmployee.getAndSet(null);
            if (previous != null) {
                log.info("Sesión expirada para: {}", previous.getFullName());
                webSocketHandler.broadcastSessionEnded(previous.getFullName(), REASON_EXPIRED);
            }
        }
        return current;
    }

    /**
     * Cierra la sesión actual y avisa a la UI.
     *
     * @return true si había una sesión activa
     */
    public boolean logout() {
        Optional<Employee> current = authService.getCurrentUser();
        authService.logout();
        announcedEmployee.set(null);

        current.ifPresent(e -> webSocketHandler.broadcastSessionEnded(e.getFullName(), REASON_LOGOUT));
        return current.isPresent();
    }

    public boolean isManualLoginAllowed() {
        return allowManualLogin;
    }

    void onReaderStatus(ReaderStatus status) {
        webSocketHandler.broadcastReaderStatus(ReaderStatusDto.fromDomain(status));
    }

    private AuthResult authenticateAndPublish(String identifier) {
        AuthResult result = authService.authenticate(identifier);

        if (result.isSuccess()) {
            announcedEmployee.set(result.getEmployee());
        }

        webSocketHandler.broadcastAuthResult(AuthResultDto.fromDomain(result));
        return result;
    }
}
