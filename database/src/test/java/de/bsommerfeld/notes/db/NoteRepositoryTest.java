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
 * Integration tests for NoteRepository against a fresh in-memory H2
 * database in MySQL mode.
 */
class NoteRepositoryTest {

    private DatabaseManager manager;
    private CategoryRepository categories;
    private NoteRepository notes;

    @BeforeEach
    void setUp() {
        manager = new DatabaseManager(
                DatabaseConfig.inMemory("notes" + UUID.randomUUID().toString().replace("-", "")));
        manager.initializeSchema();
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
    void save_shouldPersistAndRetrieve() {
        Category work = categories.save(Category.of("Work")).orElseThrow();

        Note saved = notes.save(Note.of("Buy milk", work)).orElseThrow();

        assertNotNull(saved.id());
        Note loaded = notes.findById(saved.id());
        assertEquals(saved, loaded);
        assertEquals("Buy milk", loaded.text());
    }

    @Test
    void save_shouldRejectUnknownCategory() {
        SaveResult<Note> result = notes.save(Note.of("Orphan", 999));

        assertEquals(SaveResult.Status.CONSTRAINT_VIOLATION, result.status());
        assertTrue(notes.getAllNotes().isEmpty());
    }

    @Test
    void save_shouldStoreLongText() {
        Category work = categories.save(Category.of("Work")).orElseThrow();
        String text = "lorem ipsum ".repeat(5_000);

        Note saved = notes.save(Note.of(text, work)).orElseThrow();

        assertEquals(text, notes.findById(saved.id()).text());
    }

    @Test
    void save_shouldAllowSameTextTwice() {
        Category work = categories.save(Category.of("Work")).orElseThrow();
        notes.save(Note.of("Buy milk", work)).orElseThrow();
        notes.save(Note.of("Buy milk", work)).orElseThrow();

        assertEquals(2, notes.getAllNotes().size());
    }

    @Test
    void findById_shouldReturnNullForNonexistent() {
        assertNull(notes.findById(12345));
    }

    @Test
    void categoryOf_shouldResolveOwningCategory() {
        Category work = categories.save(Category.of("Work")).orElseThrow();
        Note saved = notes.save(Note.of("Buy milk", work)).orElseThrow();

        assertEquals(work, notes.categoryOf(saved));
    }

    @Test
    void categoryOf_shouldThrowForDanglingReference() {
        assertThrows(NoResultException.class, () -> notes.categoryOf(Note.of("Orphan", 999)));
    }
}
