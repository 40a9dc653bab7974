package de.bsommerfeld.notes.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoteTest {

    @Test
    void of_shouldTakeIdFromSavedCategory() {
        Note note = Note.of("Buy milk", new Category(3, "Work"));

        assertNull(note.id());
        assertEquals("Buy milk", note.text());
        assertEquals(3, note.categoryId());
    }

    @Test
    void of_shouldRejectUnsavedCategory() {
        assertThrows(IllegalArgumentException.class, () -> Note.of("Buy milk", Category.of("Work")));
    }

    @Test
    void constructor_shouldRejectNullText() {
        assertThrows(NullPointerException.class, () -> Note.of(null, 1));
    }

    @Test
    void text_shouldAllowLongContent() {
        String text = "x".repeat(100_000);
        assertEquals(text, Note.of(text, 1).text());
    }

    @Test
    void withId_shouldMarkPersisted() {
        Note saved = Note.of("Buy milk", 1).withId(42);

        assertTrue(saved.isPersisted());
        assertEquals(42, saved.id());
        assertEquals(1, saved.categoryId());
    }
}
