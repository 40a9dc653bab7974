package de.bsommerfeld.notes.db;

/**
 * A single-row lookup matched more than one row.
 */
public class NonUniqueResultException extends DatabaseException {

    public NonUniqueResultException(String message) {
        super(message);
    }
}
