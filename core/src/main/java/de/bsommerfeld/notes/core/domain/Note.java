package de.bsommerfeld.notes.core.domain;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A text note filed under exactly one {@link Category}.
 *
 * @param id         database-generated key, {@code null} until the note is saved
 * @param text       note body, unbounded
 * @param categoryId key of the owning category
 */
public record Note(Integer id, String text, int categoryId) {

    public Note {
        checkNotNull(text, "text");
    }

    /**
     * Creates an unsaved note pointing at a category key. Whether that key
     * exists is only checked by the database on save.
     */
    public static Note of(String text, int categoryId) {
        return new Note(null, text, categoryId);
    }

    /** Creates an unsaved note filed under an already saved category. */
    public static Note of(String text, Category category) {
        checkNotNull(category, "category");
        checkArgument(category.isPersisted(), "Category '%s' has not been saved", category.name());
        return new Note(null, text, category.id());
    }

    public boolean isPersisted() {
        return id != null;
    }

    public Note withId(int generatedId) {
        return new Note(generatedId, text, categoryId);
    }
}
