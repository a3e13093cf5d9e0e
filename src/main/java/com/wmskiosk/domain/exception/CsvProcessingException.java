package com.wmskiosk.domain.exception;

/**
 * Excepción lanzada cuando falla la lectura o escritura de los archivos CSV del directorio.
 */
public class CsvProcessingException extends RuntimeException {

    public CsvProcessingException(String message) {
        super(message);
    }

    public CsvProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CsvProcessingException cannotWrite(String filePath, Throwable cause) {
        return new CsvProcessingException("No se puede escribir al archivo: " + filePath, cause);
    }

    public static CsvProcessingException cannotRead(String filePath, Throwable cause) {
        return new CsvProcessingException("No se puede leer el archivo: " + filePath, cause);
    }
}
