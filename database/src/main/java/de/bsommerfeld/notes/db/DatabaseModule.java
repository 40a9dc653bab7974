package de.bsommerfeld.notes.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.notes.core.config.ApplicationMode;
import de.bsommerfeld.notes.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module for the notes store. Binds the {@link DatabaseConfig} that
 * matches the {@link ApplicationMode}; the manager and repositories are
 * {@code @Singleton} and bind just-in-time.
 *
 * <ul>
 * <li>PROD: settings from the {@code DB_*} environment variables. An
 * incomplete environment fails injector creation.</li>
 * <li>TEST: a private H2 in-memory database, no environment needed.</li>
 * </ul>
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final ApplicationMode mode;

    public DatabaseModule() {
        this(ApplicationMode.get());
    }

    public DatabaseModule(ApplicationMode mode) {
        this.mode = mode;
    }

    @Override
    protected void configure() {
        LOG.info("Application mode initialized: {}", mode);
        DatabaseConfig config = mode.databaseConfig();
        LOG.info("Using {}", config);
        bind(DatabaseConfig.class).toInstance(config);
    }
}
