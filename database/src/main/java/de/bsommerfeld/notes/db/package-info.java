/**
 * Persistence layer for notes and their categories. MySQL in production,
 * in-memory H2 (MySQL mode) in TEST mode and in tests.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   CategoryRepository   NoteRepository
 *            │                 │
 *            └───────┬─────────┘
 *                    ▼
 *             DatabaseManager    ← lifecycle, persist(), query()
 *                    │
 *                    ▼
 *            JDBC, one connection per call
 * </pre>
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * categories
 *   id    INT PK, auto increment
 *   name  VARCHAR(10), NOT NULL, UNIQUE
 *
 * notes
 *   id           INT PK, auto increment
 *   text         TEXT, NOT NULL
 *   category_id  INT, NOT NULL, FK → categories.id
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql} and are loaded via
 * {@link de.bsommerfeld.notes.db.SqlLoader}:
 * <ul>
 * <li>{@code schema.sql}: CREATE TABLE IF NOT EXISTS for both tables</li>
 * <li>{@code <vendor>/create-database.sql}, {@code use-database.sql},
 * {@code drop-database.sql}: database lifecycle, per vendor</li>
 * <li>{@code insert-category.sql}, {@code insert-note.sql}</li>
 * <li>{@code select-categories-by-name.sql}, {@code select-category.sql},
 * {@code select-all-categories.sql}</li>
 * <li>{@code select-note.sql}, {@code select-notes-for-category.sql},
 * {@code select-all-notes.sql}</li>
 * </ul>
 */
package de.bsommerfeld.notes.db;
