package de.bsommerfeld.notes.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the notes store. Decides where the database connection
 * settings come from: the process environment in {@link #PROD}, a private
 * in-memory database in {@link #TEST}.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current mode from the system property {@code app.mode},
     * falling back to the environment variable {@code APP_MODE}. Unset or
     * unknown values resolve to {@link #PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }

    /**
     * Builds the database settings that belong to this mode.
     *
     * @throws ConfigurationException in {@link #PROD} when the environment is
     *                                incomplete
     */
    public DatabaseConfig databaseConfig() {
        return isTest() ? DatabaseConfig.inMemory("notes") : DatabaseConfig.fromEnvironment();
    }
}
