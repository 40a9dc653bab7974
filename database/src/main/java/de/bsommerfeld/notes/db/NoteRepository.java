package de.bsommerfeld.notes.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.notes.core.domain.Category;
import de.bsommerfeld.notes.core.domain.Note;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes {@link Note} rows.
 */
@Singleton
public class NoteRepository {

    private static final Logger LOG = LoggerFactory.getLogger(NoteRepository.class);

    private final DatabaseManager databaseManager;
    private final CategoryRepository categoryRepository;

    @Inject
    public NoteRepository(DatabaseManager databaseManager, CategoryRepository categoryRepository) {
        this.databaseManager = databaseManager;
        this.categoryRepository = categoryRepository;
    }

    /**
     * Inserts the note. The owning category must already exist; otherwise the
     * foreign key rejects the row, the insert is rolled back, and the result is
     * {@link SaveResult.Status#CONSTRAINT_VIOLATION}.
     */
    public SaveResult<Note> save(Note note) {
        SaveResult<Note> result = databaseManager.persist(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-note"),
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, note.text());
                ps.setInt(2, note.categoryId());
                ps.executeUpdate();
                return note.withId(CategoryRepository.generatedKey(ps));
            }
        });
        if (result.isSaved()) {
            LOG.debug("[DB] Saved note {} in category {}", result.value().id(), note.categoryId());
        }
        return result;
    }

    /** Returns the note with the given key, or {@code null}. */
    public Note findById(int id) {
        return databaseManager.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-note"))) {
                ps.setInt(1, id);
                List<Note> rows = mapNotes(ps);
                return rows.isEmpty() ? null : rows.get(0);
            }
        });
    }

    public List<Note> getAllNotes() {
        return databaseManager.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-notes"))) {
                return mapNotes(ps);
            }
        });
    }

    /**
     * Resolves the category the note is filed under.
     *
     * @throws NoResultException if the referenced category row does not exist
     */
    public Category categoryOf(Note note) {
        Category category = categoryRepository.findById(note.categoryId());
        if (category == null) {
            throw new NoResultException("No category with id " + note.categoryId());
        }
        return category;
    }

    static List<Note> mapNotes(PreparedStatement ps) throws SQLException {
        List<Note> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new Note(rs.getInt("id"), rs.getString("text"), rs.getInt("category_id")));
            }
        }
        return result;
    }
}
