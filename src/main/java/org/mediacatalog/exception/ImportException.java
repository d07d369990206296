package org.mediacatalog.exception;

/**
 * Ошибка загрузки файла каталога: файл недоступен, не совпадает схема или упала запись в БД.
 * Сообщение всегда содержит исходную причину.
 */
public class ImportException extends RuntimeException {
    public ImportException(String message) {
        super(message);
    }

    public ImportException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
