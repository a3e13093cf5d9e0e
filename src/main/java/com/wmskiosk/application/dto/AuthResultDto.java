package com.wmskiosk.application.dto;

import com.wmskiosk.domain.model.AuthResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO del resultado de una autenticación, tal como lo recibe la UI.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResultDto {

    private String outcome;
    private boolean success;
    private String identifier;
    private EmployeeDto employee;
    private long remainingLockoutMinutes;
    private String message;

    public static AuthResultDto fromDomain(AuthResult result) {
        return AuthResultDto.builder()
                .outcome(result.getOutcome().name())
                .success(result.isSuccess())
                .identifier(result.getIdentifier())
                .employee(result.getEmployee() != null ? EmployeeDto.fromDomain(result.getEmployee()) : null)
                .remainingLockoutMinutes(result.getRemainingLockoutMinutes())
                .message(messageFor(result))
                .build();
    }

    private static String messageFor(AuthResult result) {
        switch (result.getOutcome()) {
            case SUCCESS:
                return "Bienvenido, " + result.getEmployee().getFullName();
            case LOCKED:
                return "Cuenta bloqueada. Inténtelo de nuevo en " + result.getRemainingLockoutMinutes() + " minutos";
            default:
                return "Tarjeta no autorizada";
        }
    }
}
