package com.wmskiosk.domain.port;

import com.wmskiosk.domain.model.ClockEventKind;
import com.wmskiosk.domain.model.Employee;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) del directorio de empleados.
 * Lo implementa la capa de persistencia; el núcleo solo lee y notifica.
 */
public interface EmployeeDirectory {

    /**
     * Busca un empleado por tarjeta RFID o por identidad manual.
     *
     * @param identifier Tarjeta o nombre completo
     * @return Optional con el empleado si existe
     */
    Optional<Employee> lookupEmployee(String identifier);

    /**
     * Notifica un login exitoso para actualizar la fecha de último acceso.
     */
    void recordLastLogin(long employeeId);

    /**
     * Notifica un fichaje de entrada o salida.
     */
    void recordClockEvent(long employeeId, ClockEventKind kind);

    /**
     * Todos los empleados, para la selección manual de identidad.
     */
    List<Employee> findAll();
}
