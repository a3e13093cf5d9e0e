package com.wmskiosk.presentation.controller;

import com.wmskiosk.application.dto.AuthResultDto;
import com.wmskiosk.application.dto.EmployeeDto;
import com.wmskiosk.application.service.AuthenticationService;
import com.wmskiosk.application.service.KioskLoginService;
import com.wmskiosk.domain.exception.PermissionDeniedException;
import com.wmskiosk.domain.model.AuthResult;
import com.wmskiosk.domain.model.Employee;
import com.wmskiosk.domain.model.LoginStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Controlador REST de autenticación: login por tarjeta o manual, sesión y permisos.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    static final String MANAGE_EMPLOYEES = "manage_employees";

    private final KioskLoginService kioskLoginService;
    private final AuthenticationService authService;

    /**
     * Autentica una tarjeta introducida por la UI (p.ej. lector en modo teclado).
     */
    @PostMapping("/card")
    public ResponseEntity<Map<String, Object>> loginWithCard(@RequestBody CardLoginRequest request) {
        Map<String, Object> response = new HashMap<>();

        if (request.card() == null || request.card().isBlank()) {
            response.put("success", false);
            response.put("message", "La tarjeta es obligatoria");
            return ResponseEntity.badRequest().body(response);
        }

        AuthResult result = kioskLoginService.onCardScanned(request.card().trim());
        return toResponse(result);
    }

    /**
     * Login manual por nombre completo.
     */
    @PostMapping("/manual")
    public ResponseEntity<Map<String, Object>> loginManually(@RequestBody ManualLoginRequest request) {
        Map<String, Object> response = new HashMap<>();

        try {
            AuthResult result = kioskLoginService.loginManually(request.name());
            return toResponse(result);

        } catch (IllegalStateException e) {
            log.warn("Login manual rechazado: {}", e.getMessage());
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);

        } catch (IllegalArgumentException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
    }

    @GetMapping("/manual-identities")
    public ResponseEntity<Map<String, Object>> getManualIdentities() {
        Map<String, Object> response = new HashMap<>();
        response.put("enabled", kioskLoginService.isManualLoginAllowed());
        response.put("identities", kioskLoginService.getManualIdentities());
        return ResponseEntity.ok(response);
    }

    /**
     * Empleado con sesión activa, si lo hay.
     */
    @GetMapping("/current")
    public ResponseEntity<Map<String, Object>> getCurrentUser() {
        Map<String, Object> response = new HashMap<>();

        Optional<Employee> current = kioskLoginService.getCurrentUser();
        response.put("authenticated", current.isPresent());
        response.put("employee", current.map(EmployeeDto::fromDomain).orElse(null));
        response.put("sessionState", authService.getSessionState().name());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/permissions/{permission}")
    public ResponseEntity<Map<String, Object>> checkPermission(@PathVariable String permission) {
        Map<String, Object> response = new HashMap<>();
        response.put("permission", permission);
        response.put("granted", authService.hasPermission(permission));
        return ResponseEntity.ok(response);
    }

    /**
     * Registra actividad del usuario para renovar el timeout de la sesión.
     */
    @PostMapping("/activity")
    public ResponseEntity<Map<String, Object>> updateActivity() {
        Map<String, Object> response = new HashMap<>();
        authService.updateActivity();
        response.put("authenticated", authService.isAuthenticated());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout() {
        Map<String, Object> response = new HashMap<>();

        boolean hadSession = kioskLoginService.logout();
        response.put("success", true);
        response.put("message", hadSession ? "Sesión cerrada" : "No había sesión activa");
        return ResponseEntity.ok(response);
    }

    /**
     * Desbloquea un identificador. Requiere el permiso manage_employees.
     */
    @PostMapping("/unlock/{identifier}")
    public ResponseEntity<Map<String, Object>> unlockAccount(@PathVariable String identifier) {
        Map<String, Object> response = new HashMap<>();

        try {
            authService.requirePermission(MANAGE_EMPLOYEES);

            boolean unlocked = authService.unlockAccount(identifier);
            response.put("success", unlocked);
            response.put("message", unlocked
                    ? "Identificador desbloqueado"
                    : "El identificador no tenía intentos fallidos");
            return ResponseEntity.ok(response);

        } catch (PermissionDeniedException e) {
            log.warn("Desbloqueo de {} denegado: {}", identifier, e.getMessage());
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
        }
    }

    @GetMapping("/statistics")
    public ResponseEntity<LoginStatistics> getStatistics() {
        return ResponseEntity.ok(authService.getLoginStatistics());
    }

    private ResponseEntity<Map<String, Object>> toResponse(AuthResult result) {
        Map<String, Object> response = new HashMap<>();
        AuthResultDto dto = AuthResultDto.fromDomain(result);

        response.put("success", dto.isSuccess());
        response.put("message", dto.getMessage());
        response.put("result", dto);

        switch (result.getOutcome()) {
            case SUCCESS:
                return ResponseEntity.ok(response);
            case LOCKED:
                return ResponseEntity.status(HttpStatus.LOCKED).body(response);
            default:
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
        }
    }

    // Records para requests
    record CardLoginRequest(String card) {
    }

    record ManualLoginRequest(String name) {
    }
}
