package com.wmskiosk.infrastructure.file;

import com.opencsv.CSVWriter;
import com.wmskiosk.domain.exception.CsvProcessingException;
import com.wmskiosk.domain.model.ClockEventKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Escribe los fichajes de entrada/salida en clock_events.csv.
 * No mantiene el archivo abierto: open-append-close en cada fichaje.
 */
@Component
@Slf4j
public class CsvClockEventWriter {

    private static final String[] CSV_HEADER = { "timestamp", "employee_id", "kind", "station_id" };
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path clockEventsPath;
    private final int stationId;
    private final Clock clock;
    private final Object writeLock = new Object();

    public CsvClockEventWriter(@Value("${kiosk.directory.clock-events-path:./data/clock_events.csv}") String clockEventsPath,
            @Value("${station.id:1}") int stationId,
            Clock clock) {
        this.clockEventsPath = Paths.get(clockEventsPath);
        this.stationId = stationId;
        this.clock = clock;
    }

    /**
     * Añade un fichaje al final del archivo, creando el header si es nuevo.
     *
     * @throws CsvProcessingException si no se puede escribir
     */
    public void append(long employeeId, ClockEventKind kind) {
        synchronized (writeLock) {
            try {
                boolean isNew = !Files.exists(clockEventsPath);
                if (isNew && clockEventsPath.getParent() != null) {
                    Files.createDirectories(clockEventsPath.getParent());
                }

                try (CSVWriter writer = new CSVWriter(
                        new FileWriter(clockEventsPath.toFile(), StandardCharsets.UTF_8, true))) {
                    if (isNew) {
                        writer.writeNext(CSV_HEADER);
                    }
                    writer.writeNext(new String[] {
                            LocalDateTime.now(clock).format(TIMESTAMP_FORMAT),
                            String.valueOf(employeeId),
                            kind.name(),
                            String.valueOf(stationId)
                    });
                }

                log.info("Fichaje {} registrado para empleado {}", kind, employeeId);

            } catch (IOException e) {
                throw CsvProcessingException.cannotWrite(clockEventsPath.toString(), e);
            }
        }
    }
}
