package de.bsommerfeld.notes.core.config;

import com.google.common.base.Strings;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Connection settings for the notes database.
 *
 * <p>
 * In production every value comes from the process environment and all of
 * them are mandatory; a missing variable aborts startup with a
 * {@link ConfigurationException} naming every variable that is absent.
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@code DB_NAME}</td><td>database name</td></tr>
 * <tr><td>{@code DB_USER_NAME}</td><td>database user</td></tr>
 * <tr><td>{@code DB_PASS}</td><td>password, may be empty but must be set</td></tr>
 * <tr><td>{@code DB_URL}</td><td>database host</td></tr>
 * <tr><td>{@code DB_PORT}</td><td>database port</td></tr>
 * <tr><td>{@code DB_VENDOR}</td><td>optional, {@code mysql} (default) or {@code h2}</td></tr>
 * </table>
 *
 * <p>
 * The database name is spliced into DDL, which cannot be parameterized, so it
 * is restricted to letters, digits and underscores.
 *
 * @param vendor       database product
 * @param host         server host
 * @param port         server port
 * @param user         login user
 * @param password     login password
 * @param databaseName name of the database holding the notes tables
 */
public record DatabaseConfig(
        DatabaseVendor vendor,
        String host,
        int port,
        String user,
        String password,
        String databaseName) {

    public static final String ENV_NAME = "DB_NAME";
    public static final String ENV_USER = "DB_USER_NAME";
    public static final String ENV_PASS = "DB_PASS";
    public static final String ENV_HOST = "DB_URL";
    public static final String ENV_PORT = "DB_PORT";
    public static final String ENV_VENDOR = "DB_VENDOR";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    public DatabaseConfig {
        if (vendor == null) {
            throw new ConfigurationException("Database vendor must be set");
        }
        if (Strings.isNullOrEmpty(host)) {
            throw new ConfigurationException("Database host must be set");
        }
        if (port < 0 || port > 65535) {
            throw new ConfigurationException("Database port out of range: " + port);
        }
        if (user == null) {
            throw new ConfigurationException("Database user must be set");
        }
        if (password == null) {
            throw new ConfigurationException("Database password must be set");
        }
        if (databaseName == null || !IDENTIFIER.matcher(databaseName).matches()) {
            throw new ConfigurationException(
                    "Database name must consist of letters, digits and '_': " + databaseName);
        }
    }

    /** Reads the settings from the process environment. */
    public static DatabaseConfig fromEnvironment() {
        return from(System::getenv);
    }

    /**
     * Reads the settings through the given variable lookup.
     *
     * @param env returns the value of a variable, or {@code null} if unset
     * @throws ConfigurationException if a required variable is missing or a
     *                                value is malformed
     */
    public static DatabaseConfig from(Function<String, String> env) {
        List<String> missing = new ArrayList<>();
        String name = required(env, ENV_NAME, missing);
        String user = required(env, ENV_USER, missing);
        String host = required(env, ENV_HOST, missing);
        String port = required(env, ENV_PORT, missing);
        // An empty password is legitimate, only an unset one is not.
        String pass = env.apply(ENV_PASS);
        if (pass == null) {
            missing.add(ENV_PASS);
        }

        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required environment variables: " + missing);
        }

        String vendor = env.apply(ENV_VENDOR);
        return new DatabaseConfig(
                Strings.isNullOrEmpty(vendor) ? DatabaseVendor.MYSQL : DatabaseVendor.parse(vendor),
                host, parsePort(port), user, pass, name);
    }

    /**
     * Settings for a private H2 in-memory instance. Used in
     * {@link ApplicationMode#TEST} and by tests.
     *
     * @param instance name of the in-memory instance; distinct names give
     *                 isolated databases
     */
    public static DatabaseConfig inMemory(String instance) {
        return new DatabaseConfig(DatabaseVendor.H2, instance, 0, "sa", "", "notes");
    }

    /** JDBC URL of the server, without a database selected. */
    public String serverUrl() {
        return vendor.serverUrl(host, port);
    }

    private static String required(Function<String, String> env, String key, List<String> missing) {
        String value = env.apply(key);
        if (Strings.isNullOrEmpty(value)) {
            missing.add(key);
            return null;
        }
        return value.trim();
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 1 || port > 65535) {
                throw new ConfigurationException(ENV_PORT + " out of range: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(ENV_PORT + " is not a number: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "DatabaseConfig[vendor=" + vendor + ", host=" + host + ", port=" + port
                + ", user=" + user + ", password=****, databaseName=" + databaseName + "]";
    }
}
