package de.bsommerfeld.notes.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One unit of database work, run against a connection that
 * {@link DatabaseManager} opens, selects the notes database on, and closes
 * afterwards. Implementations must not close the connection themselves.
 *
 * @param <T> result of the work
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection conn) throws SQLException;
}
