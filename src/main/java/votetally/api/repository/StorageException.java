package votetally.api.repository;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Failure raised by a {@link StorageBackend}. Never retried inside the backend.
 */
public class StorageException extends RuntimeException {

    public enum Kind {
        UNAVAILABLE,
        CONFLICT
    }

    private final Kind kind;

    public StorageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StorageException unavailable(String message, Throwable cause) {
        return new StorageException(Kind.UNAVAILABLE, message, cause);
    }

    public static StorageException conflict(String message, Throwable cause) {
        return new StorageException(Kind.CONFLICT, message, cause);
    }

    public static StorageException from(String operation, DataAccessException e) {
        if (e instanceof DataIntegrityViolationException) {
            return conflict(operation + " violated a storage constraint", e);
        }
        return unavailable(operation + " failed: storage unavailable", e);
    }

    public Kind getKind() {
        return kind;
    }
}
