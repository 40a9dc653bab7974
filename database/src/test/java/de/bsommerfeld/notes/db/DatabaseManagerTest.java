package de.bsommerfeld.notes.db;

import de.bsommerfeld.notes.core.config.DatabaseConfig;
import de.bsommerfeld.notes.core.domain.Category;
import de.bsommerfeld.notes.core.domain.Note;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle tests against a private in-memory H2 instance in MySQL mode.
 * Every test gets its own instance, so nothing leaks between tests.
 */
class DatabaseManagerTest {

    private DatabaseManager manager;
    private CategoryRepository categories;
    private NoteRepository notes;

    @BeforeEach
    void setUp() {
        manager = new DatabaseManager(DatabaseConfig.inMemory("lifecycle" + UUID.randomUUID().toString().replace("-", "")));
        categories = new CategoryRepository(manager);
        notes = new NoteRepository(manager, categories);
    }

    @AfterEach
    void tearDown() throws Exception {
        manager.dropDatabase();
        try (Connection conn = manager.openServerConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        }
    }

    @Test
    void initializeSchema_shouldCreateEmptyTables() {
        manager.initializeSchema();

        assertTrue(categories.getAllCategories().isEmpty());
        assertTrue(notes.getAllNotes().isEmpty());
    }

    @Test
    void initializeSchema_shouldBeIdempotent() {
        manager.initializeSchema();
        Category work = categories.save(Category.of("Work")).orElseThrow();
        notes.save(Note.of("Buy milk", work)).orElseThrow();

        assertDoesNotThrow(() -> manager.initializeSchema());

        assertEquals(1, categories.getAllCategories().size());
        assertEquals(1, notes.getAllNotes().size());
        assertEquals(work, categories.findByName("Work"));
    }

    @Test
    void dropDatabase_thenInitialize_shouldRecreateEmptySchema() {
        manager.initializeSchema();
        Category work = categories.save(Category.of("Work")).orElseThrow();
        notes.save(Note.of("Buy milk", work)).orElseThrow();

        manager.dropDatabase();
        manager.initializeSchema();

        assertTrue(categories.getAllCategories().isEmpty());
        assertTrue(notes.getAllNotes().isEmpty());
    }

    @Test
    void dropDatabase_shouldMakeQueriesFail() {
        manager.initializeSchema();
        manager.dropDatabase();

        assertThrows(DatabaseException.class, () -> categories.getAllCategories());
    }

    @Test
    void dropDatabase_shouldTolerateMissingDatabase() {
        assertDoesNotThrow(() -> manager.dropDatabase());
    }

    @Test
    void createDatabase_shouldNotCreateTables() {
        manager.createDatabase();

        assertThrows(DatabaseException.class, () -> categories.getAllCategories());
    }

    @Test
    void query_shouldFailBeforeDatabaseExists() {
        assertThrows(DatabaseException.class, () -> categories.searchByName("Work"));
    }

    @Test
    void persist_shouldReportFailureBeforeDatabaseExists() {
        SaveResult<Category> result = categories.save(Category.of("Work"));

        assertFalse(result.isSaved());
        assertNotNull(result.error());
    }
}
