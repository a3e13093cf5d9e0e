package com.wmskiosk.application.service;

import com.wmskiosk.domain.exception.PermissionDeniedException;
import com.wmskiosk.domain.model.AuthResult;
import com.wmskiosk.domain.model.Employee;
import com.wmskiosk.domain.model.LoginStatistics;
import com.wmskiosk.domain.model.SessionState;

import java.util.Optional;
import java.util.Set;

/**
 * Servicio de autenticación y sesión del kiosco.
 * Solo existe una sesión activa por kiosco.
 */
public interface AuthenticationService {

    /**
     * Autentica una tarjeta RFID o una identidad manual.
     *
     * @param identifier Tarjeta o nombre del empleado
     * @return SUCCESS, UNAUTHORIZED o LOCKED; nunca lanza por credenciales malas
     */
    AuthResult authenticate(String identifier);

    /**
     * Empleado de la sesión activa. Si la sesión superó el timeout de inactividad
     * se expira en este momento y se devuelve vacío.
     */
    Optional<Employee> getCurrentUser();

    /**
     * Refresca la actividad de la sesión activa. Sin sesión no hace nada.
     */
    void updateActivity();

    /**
     * @return true si hay usuario y tiene el permiso o el comodín "*"
     */
    boolean hasPermission(String permission);

    /**
     * Cierra la sesión actual, si la hay.
     */
    void logout();

    boolean isAuthenticated();

    /**
     * Permisos efectivos del usuario actual; vacío sin sesión.
     */
    Set<String> getUserPermissions();

    /**
     * Guardia para quien necesite un fallo duro.
     *
     * @throws PermissionDeniedException si no hay sesión o falta el permiso
     */
    void requirePermission(String permission);

    /**
     * Borra el historial de fallos de un identificador.
     *
     * @return true si había historial
     */
    boolean unlockAccount(String identifier);

    /**
     * Minutos que faltan para que el identificador deje de estar bloqueado; 0 si no lo está.
     */
    long getRemainingLockoutMinutes(String identifier);

    SessionState getSessionState();

    LoginStatistics getLoginStatistics();
}
