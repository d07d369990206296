package org.mediacatalog.exception;

/**
 * Отсутствующий, неверный или просроченный токен, либо неверные учетные данные.
 */
public class AuthException extends RuntimeException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
