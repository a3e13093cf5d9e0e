package com.wmskiosk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Sesión de login del empleado en el kiosco.
 * Los ticks monotónicos se usan para los cálculos de timeout; los Instant solo para mostrar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginSession {

    private Employee employee;

    private Instant startedAt;

    private Instant lastActivityAt;

    private long startedAtNanos;

    private long lastActivityNanos;

    private SessionState state;

    public static LoginSession start(Employee employee, Instant now, long nowNanos) {
        return LoginSession.builder()
                .employee(employee)
                .startedAt(now)
                .lastActivityAt(now)
                .startedAtNanos(nowNanos)
                .lastActivityNanos(nowNanos)
                .state(SessionState.ACTIVE)
                .build();
    }

    public long getEmployeeId() {
        return employee.getId();
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    /**
     * Refresca la actividad de la sesión.
     */
    public void touch(Instant now, long nowNanos) {
        this.lastActivityAt = now;
        this.lastActivityNanos = nowNanos;
    }

    public boolean isIdleLongerThan(Duration timeout, long nowNanos) {
        return nowNanos - lastActivityNanos > timeout.toNanos();
    }

    public Duration getDuration(long nowNanos) {
        return Duration.ofNanos(nowNanos - startedAtNanos);
    }
}
