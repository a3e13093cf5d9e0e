package com.wmskiosk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Modelo de dominio de un empleado tal como lo entrega el directorio.
 * El núcleo solo lo lee; la única escritura (último login) se delega al directorio.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Employee {

    private long id;

    /** Identificador de la tarjeta RFID asignada */
    private String rfidCard;

    private String firstName;

    private String lastName;

    private EmployeeRole role;

    /** Permisos explícitos; si está vacío se usan los del rol */
    private Set<String> permissions;

    private boolean active;

    /** Idioma de la interfaz (de, en, tr, pl) */
    @Builder.Default
    private String language = "de";

    private LocalDateTime lastLogin;

    public String getFullName() {
        return firstName + " " + lastName;
    }

    /**
     * Permisos efectivos del empleado.
     */
    public Set<String> getEffectivePermissions() {
        if (permissions == null || permissions.isEmpty()) {
            return role != null ? role.defaultPermissions() : Set.of();
        }
        return Set.copyOf(permissions);
    }

    /**
     * Verifica si el empleado tiene el permiso indicado o el comodín "*".
     */
    public boolean hasPermission(String permission) {
        Set<String> effective = getEffectivePermissions();
        return effective.contains(EmployeeRole.ALL_PERMISSIONS) || effective.contains(permission);
    }
}
