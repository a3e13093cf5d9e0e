package com.wmskiosk.application.dto;

import com.wmskiosk.domain.model.ReaderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO del estado del lector para la API y el WebSocket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReaderStatusDto {

    private String state;
    private boolean connected;
    private boolean monitoring;
    private boolean dispatching;
    private String deviceName;
    private String lastError;
    private int pendingScans;

    public static ReaderStatusDto fromDomain(ReaderStatus status) {
        return ReaderStatusDto.builder()
                .state(status.getState() != null ? status.getState().name() : null)
                .connected(status.isConnected())
                .monitoring(status.isMonitoring())
                .dispatching(status.isDispatching())
                .deviceName(status.getDeviceName())
                .lastError(status.getLastError())
                .pendingScans(status.getPendingScans())
                .build();
    }
}
