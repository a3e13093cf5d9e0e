package com.wmskiosk.application.dto;

import com.wmskiosk.domain.model.Employee;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.TreeSet;

/**
 * DTO de empleado para la UI. No expone la tarjeta RFID.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeDto {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    private long id;
    private String fullName;
    private String role;
    private String language;
    private Set<String> permissions;
    private String lastLogin;

    /**
     * Convierte un modelo de dominio a DTO.
     */
    public static EmployeeDto fromDomain(Employee employee) {
        return EmployeeDto.builder()
                .id(employee.getId())
                .fullName(employee.getFullName())
                .role(employee.getRole().name())
                .language(employee.getLanguage())
                .permissions(new TreeSet<>(employee.getEffectivePermissions()))
                .lastLogin(employee.getLastLogin() != null
                        ? employee.getLastLogin().format(DATE_FORMAT)
                        : "N/A")
                .build();
    }
}
