package com.wmskiosk.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Resultado de conectar con el lector.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConnectResult {

    private final boolean success;

    private final DeviceError error;

    private final String message;

    public static ConnectResult connected(String deviceName) {
        return new ConnectResult(true, null, "Lector conectado: " + deviceName);
    }

    public static ConnectResult failed(DeviceError error, String message) {
        return new ConnectResult(false, error, message);
    }

    public Optional<DeviceError> error() {
        return Optional.ofNullable(error);
    }
}
