package de.bsommerfeld.notes.db;

/**
 * Unchecked wrapper for failures talking to the database. Query paths throw
 * it directly; save paths report through {@link SaveResult} instead and only
 * raise it from {@link SaveResult#orElseThrow()}.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
