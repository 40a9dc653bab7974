package de.bsommerfeld.notes.core.domain;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named grouping of notes. Names are unique across all categories; the
 * database enforces that, the record only checks shape.
 *
 * @param id   database-generated key, {@code null} until the category is saved
 * @param name display name, at most {@value #MAX_NAME_LENGTH} characters
 *             (code points, as the column counts them)
 */
public record Category(Integer id, String name) {

    public static final int MAX_NAME_LENGTH = 10;

    public Category {
        checkNotNull(name, "name");
        checkArgument(name.codePointCount(0, name.length()) <= MAX_NAME_LENGTH,
                "Category name exceeds %s characters: %s", MAX_NAME_LENGTH, name);
    }

    /** Creates a category that has not been saved yet. */
    public static Category of(String name) {
        return new Category(null, name);
    }

    public boolean isPersisted() {
        return id != null;
    }

    /** Copy carrying the key the database generated for this row. */
    public Category withId(int generatedId) {
        return new Category(generatedId, name);
    }
}
