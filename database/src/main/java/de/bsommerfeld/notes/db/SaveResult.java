package de.bsommerfeld.notes.db;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

/**
 * Outcome of a save. Either carries the persisted record (with its generated
 * key) or the reason the transaction was rolled back.
 *
 * @param status what happened
 * @param value  the saved record, {@code null} unless {@link Status#SAVED}
 * @param error  the failure, {@code null} on success
 * @param <T>    record type
 */
public record SaveResult<T>(Status status, T value, SQLException error) {

    public enum Status {
        SAVED,
        /** Unique, foreign-key or not-null constraint rejected the row. */
        CONSTRAINT_VIOLATION,
        /** The server could not be reached or dropped the connection. */
        CONNECTION_FAILURE,
        DATABASE_ERROR
    }

    public static <T> SaveResult<T> saved(T value) {
        return new SaveResult<>(Status.SAVED, value, null);
    }

    public static <T> SaveResult<T> failed(SQLException error) {
        return new SaveResult<>(classify(error), null, error);
    }

    /**
     * Maps a driver exception to a {@link Status}. Drivers disagree on which
     * subclass they throw, so the SQLState class ({@code 23} integrity,
     * {@code 08} connection) is checked as well.
     */
    static Status classify(SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLIntegrityConstraintViolationException
                || (state != null && state.startsWith("23"))) {
            return Status.CONSTRAINT_VIOLATION;
        }
        if (e instanceof SQLTransientConnectionException
                || e instanceof SQLNonTransientConnectionException
                || (state != null && state.startsWith("08"))) {
            return Status.CONNECTION_FAILURE;
        }
        return Status.DATABASE_ERROR;
    }

    public boolean isSaved() {
        return status == Status.SAVED;
    }

    /**
     * Returns the saved record.
     *
     * @throws DatabaseException if the save failed
     */
    public T orElseThrow() {
        if (!isSaved()) {
            throw new DatabaseException("Save failed (" + status + "): " + message(), error);
        }
        return value;
    }

    /** Driver message of the failure, empty on success. */
    public String message() {
        return error == null ? "" : error.getMessage();
    }
}
