package com.wmskiosk.application.scheduler;

import com.wmskiosk.application.reader.CardReaderSession;
import com.wmskiosk.domain.model.ConnectResult;
import com.wmskiosk.domain.model.ReaderState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Job programado que reintenta la conexión cuando el lector quedó en ERROR
 * (p.ej. desenchufado). Un intento por ejecución como máximo; los reintentos siguen
 * hasta conectar o hasta una desconexión explícita.
 */
@Component
@Slf4j
public class ReaderReconnectJob {

    private final CardReaderSession readerSession;
    private final boolean autoReconnect;

    // Se activa al ver ERROR y se apaga al reconectar o con cancelRetries()
    private final AtomicBoolean retrying = new AtomicBoolean(false);

    public ReaderReconnectJob(CardReaderSession readerSession,
            @Value("${kiosk.reader.auto-reconnect:true}") boolean autoReconnect) {
        this.readerSession = readerSession;
        this.autoReconnect = autoReconnect;
    }

    @Scheduled(fixedDelayString = "${kiosk.reader.reconnect-interval-ms:30000}",
            initialDelayString = "${kiosk.reader.reconnect-interval-ms:30000}")
    public void checkReader() {
        reconnectIfFailed();
    }

    /**
     * Comprueba el estado del lector y reconecta si hace falta.
     *
     * @return true si se intentó reconectar
     */
    boolean reconnectIfFailed() {
        if (!autoReconnect) {
            return false;
        }

        ReaderState state = readerSession.status().getState();
        if (state == ReaderState.ERROR) {
            retrying.set(true);
        }
        if (state == ReaderState.CONNECTED) {
            retrying.set(false);
            return false;
        }
        if (!retrying.get() || state == ReaderState.CONNECTING) {
            return false;
        }

        log.info("🔄 Lector caído. Intentando reconectar...");
        ConnectResult result = readerSession.connect();
        if (result.isSuccess()) {
            retrying.set(false);
            log.info("✅ Lector reconectado: {}", result.getMessage());
        } else {
            log.warn("Reconexión fallida, se reintentará: {}", result.getMessage());
        }
        return true;
    }

    /**
     * Abandona los reintentos pendientes, p.ej. tras una desconexión pedida por el usuario.
     */
    public void cancelRetries() {
        if (retrying.getAndSet(false)) {
            log.info("Reintentos de reconexión cancelados");
        }
    }

    public boolean isRetrying() {
        return retrying.get();
    }
}
