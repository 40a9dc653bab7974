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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Reads and writes {@link Category} rows, and resolves the notes filed under
 * a category.
 */
@Singleton
public class CategoryRepository {

    private static final Logger LOG = LoggerFactory.getLogger(CategoryRepository.class);

    private final DatabaseManager databaseManager;

    @Inject
    public CategoryRepository(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    /**
     * Inserts the category. On success the result carries a copy with the
     * generated id; a duplicate name comes back as
     * {@link SaveResult.Status#CONSTRAINT_VIOLATION}.
     */
    public SaveResult<Category> save(Category category) {
        SaveResult<Category> result = databaseManager.persist(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-category"),
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, category.name());
                ps.executeUpdate();
                return category.withId(generatedKey(ps));
            }
        });
        if (result.isSaved()) {
            LOG.debug("[DB] Saved category {} as id {}", category.name(), result.value().id());
        }
        return result;
    }

    /**
     * All categories named exactly {@code name}. A filter, not a fetch: the
     * list is empty when nothing matches.
     */
    public List<Category> searchByName(String name) {
        return databaseManager.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-categories-by-name"))) {
                ps.setString(1, name);
                return mapCategories(ps);
            }
        });
    }

    /**
     * The one category named {@code name}.
     *
     * @throws NoResultException        if no category has that name
     * @throws NonUniqueResultException if more than one does
     */
    public Category findByName(String name) {
        List<Category> matches = searchByName(name);
        if (matches.isEmpty()) {
            throw new NoResultException("No category named '" + name + "'");
        }
        if (matches.size() > 1) {
            throw new NonUniqueResultException(matches.size() + " categories named '" + name + "'");
        }
        return matches.get(0);
    }

    /** Returns the category with the given key, or {@code null}. */
    public Category findById(int id) {
        return databaseManager.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-category"))) {
                ps.setInt(1, id);
                List<Category> rows = mapCategories(ps);
                return rows.isEmpty() ? null : rows.get(0);
            }
        });
    }

    public List<Category> getAllCategories() {
        return databaseManager.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-categories"))) {
                return mapCategories(ps);
            }
        });
    }

    /**
     * Notes filed under {@code category}, oldest first.
     *
     * @throws IllegalArgumentException if the category was never saved
     */
    public List<Note> notes(Category category) {
        checkArgument(category.isPersisted(), "Category '%s' has not been saved", category.name());
        return databaseManager.query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-notes-for-category"))) {
                ps.setInt(1, category.id());
                return NoteRepository.mapNotes(ps);
            }
        });
    }

    static int generatedKey(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("Insert returned no generated key");
            }
            return keys.getInt(1);
        }
    }

    private static List<Category> mapCategories(PreparedStatement ps) throws SQLException {
        List<Category> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new Category(rs.getInt("id"), rs.getString("name")));
            }
        }
        return result;
    }
}
