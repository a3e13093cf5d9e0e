package com.wmskiosk.infrastructure.file;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.wmskiosk.domain.exception.CsvProcessingException;
import com.wmskiosk.domain.model.ClockEventKind;
import com.wmskiosk.domain.model.Employee;
import com.wmskiosk.domain.model.EmployeeRole;
import com.wmskiosk.domain.port.EmployeeDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Directorio de empleados respaldado por employees.csv.
 * Mantiene una cache en memoria thread-safe; solo last_login se reescribe.
 *
 * <p>Formato: {@code id,rfid_card,first_name,last_name,role,language,active,permissions,last_login},
 * con los permisos separados por ';'. Sin permisos se aplican los del rol.</p>
 */
@Component
@Slf4j
public class CsvEmployeeDirectoryAdapter implements EmployeeDirectory {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String[] CSV_HEADER = {
            "id", "rfid_card", "first_name", "last_name", "role", "language", "active", "permissions", "last_login"
    };
    private static final String PERMISSION_SEPARATOR = ";";

    private final Path employeesPath;
    private final CsvClockEventWriter clockEventWriter;
    private final Clock clock;

    // Cache en memoria para acceso rápido (thread-safe)
    private final CopyOnWriteArrayList<Employee> employeesCache = new CopyOnWriteArrayList<>();

    public CsvEmployeeDirectoryAdapter(@Value("${kiosk.directory.employees-path:./data/employees.csv}") String employeesPath,
            CsvClockEventWriter clockEventWriter,
            Clock clock) {
        this.employeesPath = Paths.get(employeesPath);
        this.clockEventWriter = clockEventWriter;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        ensureFileExists();
        loadFromFile();
    }

    @Override
    public Optional<Employee> lookupEmployee(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }

        String normalizedCard = normalizeCard(identifier);
        String trimmed = identifier.trim();

        return employeesCache.stream()
                .filter(e -> normalizedCard.equals(normalizeCard(e.getRfidCard()))
                        || trimmed.equalsIgnoreCase(e.getFullName()))
                .findFirst();
    }

    @Override
    public void recordLastLogin(long employeeId) {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean updated = false;

        synchronized (this) {
            for (int i = 0; i < employeesCache.size(); i++) {
                Employee employee = employeesCache.get(i);
                if (employee.getId() == employeeId) {
                    employeesCache.set(i, employee.toBuilder().lastLogin(now).build());
                    updated = true;
                    break;
                }
            }

            if (updated) {
                saveToFile();
            }
        }

        if (updated) {
            log.debug("Último login actualizado para empleado {}", employeeId);
        } else {
            log.warn("Empleado {} no encontrado al actualizar el último login", employeeId);
        }
    }

    @Override
    public void recordClockEvent(long employeeId, ClockEventKind kind) {
        clockEventWriter.append(employeeId, kind);
    }

    @Override
    public List<Employee> findAll() {
        return new ArrayList<>(employeesCache);
    }

    /**
     * Asegura que el archivo CSV existe con el header correcto.
     */
    private void ensureFileExists() {
        try {
            if (employeesPath.getParent() != null && !Files.exists(employeesPath.getParent())) {
                Files.createDirectories(employeesPath.getParent());
                log.info("Directorio creado: {}", employeesPath.getParent());
            }

            if (!Files.exists(employeesPath)) {
                try (CSVWriter writer = new CSVWriter(new FileWriter(employeesPath.toFile(), StandardCharsets.UTF_8))) {
                    writer.writeNext(CSV_HEADER);
                }
                log.info("Archivo employees.csv creado: {}", employeesPath);
            }
        } catch (IOException e) {
            throw CsvProcessingException.cannotWrite(employeesPath.toString(), e);
        }
    }

    private synchronized void loadFromFile() {
        employeesCache.clear();

        try (CSVReader reader = new CSVReader(new FileReader(employeesPath.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();

            // Saltar header
            for (int i = 1; i < lines.size(); i++) {
                try {
                    parseLine(lines.get(i)).ifPresent(employeesCache::add);
                } catch (RuntimeException e) {
                    log.warn("Error parseando línea {} de employees.csv: {}", i + 1, e.getMessage());
                }
            }

            log.info("Cargados {} empleados desde employees.csv", employeesCache.size());

        } catch (IOException | CsvException e) {
            throw CsvProcessingException.cannotRead(employeesPath.toString(), e);
        }
    }

    private synchronized void saveToFile() {
        try (CSVWriter writer = new CSVWriter(new FileWriter(employeesPath.toFile(), StandardCharsets.UTF_8))) {
            writer.writeNext(CSV_HEADER);

            for (Employee employee : employeesCache) {
                writer.writeNext(toLine(employee));
            }

        } catch (IOException e) {
            throw CsvProcessingException.cannotWrite(employeesPath.toString(), e);
        }
    }

    private Optional<Employee> parseLine(String[] fields) {
        if (fields.length < 5 || fields[0].isBlank()) {
            return Optional.empty();
        }

        Set<String> permissions = fields.length > 7 && !fields[7].isBlank()
                ? Arrays.stream(fields[7].split(PERMISSION_SEPARATOR))
                        .map(String::trim)
                        .filter(p -> !p.isEmpty())
                        .collect(Collectors.toCollection(LinkedHashSet::new))
                : Set.of();

        LocalDateTime lastLogin = null;
        if (fields.length > 8 && !fields[8].isBlank()) {
            try {
                lastLogin = LocalDateTime.parse(fields[8].trim(), TIMESTAMP_FORMAT);
            } catch (DateTimeParseException e) {
                log.debug("Error parseando fecha: {}", fields[8]);
            }
        }

        return Optional.of(Employee.builder()
                .id(Long.parseLong(fields[0].trim()))
                .rfidCard(fields[1].trim())
                .firstName(fields[2].trim())
                .lastName(fields[3].trim())
                .role(EmployeeRole.fromString(fields[4]))
                .language(fields.length > 5 && !fields[5].isBlank() ? fields[5].trim() : "de")
                .active(fields.length <= 6 || fields[6].isBlank() || Boolean.parseBoolean(fields[6].trim()))
                .permissions(permissions)
                .lastLogin(lastLogin)
                .build());
    }

    private String[] toLine(Employee employee) {
        return new String[] {
                String.valueOf(employee.getId()),
                employee.getRfidCard(),
                employee.getFirstName(),
                employee.getLastName(),
                employee.getRole().name().toLowerCase(Locale.ROOT),
                employee.getLanguage(),
                String.valueOf(employee.isActive()),
                employee.getPermissions() != null
                        ? String.join(PERMISSION_SEPARATOR, employee.getPermissions())
                        : "",
                employee.getLastLogin() != null ? employee.getLastLogin().format(TIMESTAMP_FORMAT) : ""
        };
    }

    private static String normalizeCard(String card) {
        if (card == null) {
            return "";
        }
        return card.trim().toUpperCase(Locale.ROOT);
    }
}
