package com.wmskiosk.application.service;

import com.wmskiosk.domain.exception.PermissionDeniedException;
import com.wmskiosk.domain.model.AuthResult;
import com.wmskiosk.domain.model.ClockEventKind;
import com.wmskiosk.domain.model.Employee;
import com.wmskiosk.domain.model.LoginAttemptHistory;
import com.wmskiosk.domain.model.LoginSession;
import com.wmskiosk.domain.model.LoginStatistics;
import com.wmskiosk.domain.model.SessionState;
import com.wmskiosk.domain.port.EmployeeDirectory;
import com.wmskiosk.domain.time.MonotonicClock;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Implementación del servicio de autenticación.
 *
 * <p>Un único mutex protege el historial de intentos y la sesión: la comprobación del
 * bloqueo y el incremento del contador, igual que el reemplazo de la sesión, deben ser
 * atómicos aunque la UI y un temporizador llamen a la vez.</p>
 *
 * <p>Las notificaciones al directorio (último login, fichajes) se envían fuera del mutex y
 * sus fallos solo se registran en el log.</p>
 */
@Slf4j
public class AuthenticationServiceImpl implements AuthenticationService {

    private final EmployeeDirectory directory;
    private final AuthPolicy policy;
    private final MonotonicClock monotonicClock;
    private final Clock wallClock;

    private final Object lock = new Object();
    private final Map<String, LoginAttemptHistory> loginAttempts = new HashMap<>();
    private LoginSession session;

    public AuthenticationServiceImpl(EmployeeDirectory directory,
            AuthPolicy policy,
            MonotonicClock monotonicClock,
            Clock wallClock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        if (policy.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts debe ser positivo: " + policy.getMaxAttempts());
        }
        log.info("AuthenticationService inicializado: {}", policy);
    }

    @Override
    public AuthResult authenticate(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("El identificador es obligatorio");
        }

        String key = identifier.trim();
        log.info("Autenticación para: {}", key);

        Employee loggedIn;
        LoginSession expired;
        LoginSession replaced;

        synchronized (lock) {
            long now = monotonicClock.nowNanos();

            LoginAttemptHistory history = loginAttempts.get(key);
            if (history != null) {
                int recentFailures = history.prune(now, lockoutWindowNanos());
                if (recentFailures >= policy.getMaxAttempts()) {
                    long remaining = remainingMinutes(history, now);
                    log.warn("Identificador bloqueado: {}, tiempo restante: {} minutos", key, remaining);
                    return AuthResult.locked(key, remaining);
                }
                if (recentFailures == 0) {
                    loginAttempts.remove(key);
                }
            }

            Optional<Employee> found = key.isEmpty() ? Optional.empty() : lookup(key);
            if (found.isEmpty() || !found.get().isActive()) {
                loginAttempts.computeIfAbsent(key, k -> new LoginAttemptHistory()).recordFailure(now);

                if (found.isPresent()) {
                    log.warn("Identificador de un empleado inactivo: {}", key);
                } else {
                    log.warn("Identificador no encontrado: {}", key);
                }
                return AuthResult.unauthorized(key);
            }

            loggedIn = found.get();
            loginAttempts.remove(key);

            expired = expireIfIdle(now);
            replaced = session;
            session = LoginSession.start(loggedIn, wallClock.instant(), now);
        }

        if (expired != null) {
            notifyClockEvent(expired.getEmployeeId(), ClockEventKind.OUT);
        }

        // Misma persona con sesión viva: se reinicia la sesión, la entrada ya está fichada
        boolean restarted = replaced != null && replaced.isActive()
                && replaced.getEmployeeId() == loggedIn.getId();
        if (replaced != null && replaced.isActive() && !restarted) {
            log.info("Sesión de {} reemplazada por {}",
                    replaced.getEmployee().getFullName(), loggedIn.getFullName());
            notifyClockEvent(replaced.getEmployeeId(), ClockEventKind.OUT);
        }

        notifyLastLogin(loggedIn.getId());
        if (!restarted) {
            notifyClockEvent(loggedIn.getId(), ClockEventKind.IN);
        }

        log.info("Autenticación exitosa: {}", loggedIn.getFullName());
        return AuthResult.success(key, loggedIn);
    }

    @Override
    public Optional<Employee> getCurrentUser() {
        LoginSession expired;
        Employee current;

        synchronized (lock) {
            expired = expireIfIdle(monotonicClock.nowNanos());
            current = session != null && session.isActive() ? session.getEmployee() : null;
        }

        if (expired != null) {
            notifyClockEvent(expired.getEmployeeId(), ClockEventKind.OUT);
        }
        return Optional.ofNullable(current);
    }

    @Override
    public void updateActivity() {
        LoginSession expired;

        synchronized (lock) {
            long now = monotonicClock.nowNanos();
            expired = expireIfIdle(now);
            if (session != null && session.isActive()) {
                session.touch(wallClock.instant(), now);
            }
        }

        if (expired != null) {
            notifyClockEvent(expired.getEmployeeId(), ClockEventKind.OUT);
        }
    }

    @Override
    public boolean hasPermission(String permission) {
        Optional<Employee> current = getCurrentUser();
        if (current.isEmpty()) {
            return false;
        }

        updateActivity();
        return current.get().hasPermission(permission);
    }

    @Override
    public void logout() {
        LoginSession closed;

        synchronized (lock) {
            closed = session;
            if (closed == null) {
                return;
            }
            closed.setState(SessionState.CLOSED);
            session = null;
        }

        log.info("Usuario desconectado: {} (duración: {} minutos)",
                closed.getEmployee().getFullName(),
                closed.getDuration(monotonicClock.nowNanos()).toMinutes());
        notifyClockEvent(closed.getEmployeeId(), ClockEventKind.OUT);
    }

    @Override
    public boolean isAuthenticated() {
        return getCurrentUser().isPresent();
    }

    @Override
    public Set<String> getUserPermissions() {
        return getCurrentUser()
                .map(Employee::getEffectivePermissions)
                .orElse(Set.of());
    }

    @Override
    public void requirePermission(String permission) {
        if (!isAuthenticated()) {
            throw PermissionDeniedException.notAuthenticated();
        }
        if (!hasPermission(permission)) {
            throw PermissionDeniedException.missing(permission);
        }
    }

    @Override
    public boolean unlockAccount(String identifier) {
        if (identifier == null) {
            return false;
        }

        synchronized (lock) {
            boolean removed = loginAttempts.remove(identifier.trim()) != null;
            if (removed) {
                log.info("Identificador desbloqueado: {}", identifier.trim());
            }
            return removed;
        }
    }

    @Override
    public long getRemainingLockoutMinutes(String identifier) {
        if (identifier == null) {
            return 0L;
        }

        synchronized (lock) {
            LoginAttemptHistory history = loginAttempts.get(identifier.trim());
            if (history == null) {
                return 0L;
            }
            long now = monotonicClock.nowNanos();
            if (history.prune(now, lockoutWindowNanos()) < policy.getMaxAttempts()) {
                return 0L;
            }
            return remainingMinutes(history, now);
        }
    }

    @Override
    public SessionState getSessionState() {
        synchronized (lock) {
            return session != null ? session.getState() : SessionState.NONE;
        }
    }

    @Override
    public LoginStatistics getLoginStatistics() {
        Optional<Employee> current = getCurrentUser();

        synchronized (lock) {
            long now = monotonicClock.nowNanos();
            int failed = 0;
            int locked = 0;

            Iterator<LoginAttemptHistory> it = loginAttempts.values().iterator();
            while (it.hasNext()) {
                int recent = it.next().prune(now, lockoutWindowNanos());
                if (recent == 0) {
                    it.remove();
                    continue;
                }
                failed += recent;
                if (recent >= policy.getMaxAttempts()) {
                    locked++;
                }
            }

            long sessionMinutes = session != null && session.isActive()
                    ? session.getDuration(now).toMinutes()
                    : 0L;

            return LoginStatistics.builder()
                    .currentUser(current.map(Employee::getFullName).orElse(null))
                    .authenticated(current.isPresent())
                    .sessionDurationMinutes(sessionMinutes)
                    .failedAttempts(failed)
                    .lockedIdentifiers(locked)
                    .build();
        }
    }

    /**
     * Expira la sesión si superó el timeout. Debe llamarse con el mutex tomado.
     *
     * @return La sesión expirada, para notificar fuera del mutex
     */
    private LoginSession expireIfIdle(long now) {
        if (session == null || !session.isActive()) {
            return null;
        }
        if (!session.isIdleLongerThan(policy.getSessionTimeout(), now)) {
            return null;
        }

        LoginSession expired = session;
        expired.setState(SessionState.EXPIRED);
        session = null;
        log.info("Timeout de sesión para: {}", expired.getEmployee().getFullName());
        return expired;
    }

    private Optional<Employee> lookup(String identifier) {
        try {
            return directory.lookupEmployee(identifier);
        } catch (RuntimeException e) {
            log.error("Error consultando el directorio para {}: {}", identifier, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private long lockoutWindowNanos() {
        return policy.getLockoutWindow().toNanos();
    }

    private long remainingMinutes(LoginAttemptHistory history, long now) {
        OptionalLong oldest = history.oldestFailure();
        if (oldest.isEmpty()) {
            return 0L;
        }
        long remainingNanos = oldest.getAsLong() + lockoutWindowNanos() - now;
        if (remainingNanos <= 0) {
            return 0L;
        }
        long minuteNanos = TimeUnit.MINUTES.toNanos(1);
        return (remainingNanos + minuteNanos - 1) / minuteNanos;
    }

    private void notifyLastLogin(long employeeId) {
        try {
            directory.recordLastLogin(employeeId);
        } catch (RuntimeException e) {
            log.error("Error actualizando el último login de {}: {}", employeeId, e.getMessage());
        }
    }

    private void notifyClockEvent(long employeeId, ClockEventKind kind) {
        try {
            directory.recordClockEvent(employeeId, kind);
        } catch (RuntimeException e) {
            log.error("Error registrando fichaje {} de {}: {}", kind, employeeId, e.getMessage());
        }
    }
}
