package com.wmskiosk.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Roles de los empleados de la estación y sus permisos por defecto.
 * Se usan solo cuando el registro del empleado no trae permisos propios.
 */
public enum EmployeeRole {

    /** Operario de almacén */
    WORKER(1),

    /** Jefe de turno */
    SUPERVISOR(2),

    /** Responsable de área */
    MANAGER(3),

    /** Administrador - todos los permisos */
    ADMIN(4);

    public static final String ALL_PERMISSIONS = "*";

    private static final List<String> BASE = List.of(
            "view_own_profile", "change_own_language", "view_deliveries");

    private static final List<String> SCANNING = List.of(
            "scan_packages", "register_packages", "manual_entry", "view_package_list");

    private static final List<String> DELIVERY = List.of(
            "create_delivery", "finish_delivery", "cancel_delivery",
            "view_statistics", "edit_packages", "delete_packages");

    private static final List<String> MANAGEMENT = List.of(
            "manage_employees", "view_reports", "export_data", "system_settings");

    private final int level;

    EmployeeRole(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Permisos que recibe un empleado de este rol si no tiene permisos explícitos.
     */
    public Set<String> defaultPermissions() {
        if (this == ADMIN) {
            return Set.of(ALL_PERMISSIONS);
        }

        Set<String> permissions = new LinkedHashSet<>(BASE);
        permissions.addAll(SCANNING);
        if (level >= SUPERVISOR.level) {
            permissions.addAll(DELIVERY);
        }
        if (level >= MANAGER.level) {
            permissions.addAll(MANAGEMENT);
        }
        return Collections.unmodifiableSet(permissions);
    }

    /**
     * Convierte el texto del registro ("worker", "Supervisor"...) en un rol.
     *
     * @throws IllegalArgumentException si el rol no existe
     */
    public static EmployeeRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rol vacío");
        }
        return EmployeeRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
