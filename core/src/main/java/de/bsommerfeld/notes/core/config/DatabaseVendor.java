package de.bsommerfeld.notes.core.config;

import java.util.Locale;

/**
 * Database products the store can talk to. Each vendor knows how to build a
 * server-level JDBC URL (one that does not select a database yet) and where
 * its vendor-specific SQL lives on the classpath.
 */
public enum DatabaseVendor {

    /** Production target. */
    MYSQL("jdbc:mysql://%s:%d/"),

    /**
     * In-memory H2 in MySQL compatibility mode. The host names the in-memory
     * instance, the port is ignored. Schemas stand in for MySQL databases.
     */
    H2("jdbc:h2:mem:%s;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");

    private final String urlTemplate;

    DatabaseVendor(String urlTemplate) {
        this.urlTemplate = urlTemplate;
    }

    public String serverUrl(String host, int port) {
        return String.format(urlTemplate, host, port);
    }

    /** Directory under {@code sql/} holding this vendor's lifecycle statements. */
    public String resourcePrefix() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by name.
     *
     * @throws ConfigurationException for an unknown vendor
     */
    public static DatabaseVendor parse(String value) {
        try {
            return DatabaseVendor.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported database vendor: " + value, e);
        }
    }
}
