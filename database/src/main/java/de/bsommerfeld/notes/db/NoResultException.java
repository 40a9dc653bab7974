package de.bsommerfeld.notes.db;

/**
 * A single-row lookup matched nothing.
 */
public class NoResultException extends DatabaseException {

    public NoResultException(String message) {
        super(message);
    }
}
