package de.bsommerfeld.notes.db;

import de.bsommerfeld.notes.core.config.DatabaseVendor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resources under
 * {@code sql/}.
 *
 * <p>
 * Naming convention is {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-note.sql}. Statements that differ per database product sit
 * in a vendor directory, e.g. {@code sql/mysql/create-database.sql}, and are
 * requested through {@link #load(DatabaseVendor, String)}.
 *
 * <p>
 * Each file is read once and cached for the lifetime of the JVM.
 *
 * @see DatabaseManager
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @param name path below {@code sql/} without the extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Returns the statement {@code name} as written for {@code vendor}, from
     * {@code sql/<vendor>/<name>.sql}.
     */
    public static String load(DatabaseVendor vendor, String name) {
        return load(vendor.resourcePrefix() + "/" + name);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
