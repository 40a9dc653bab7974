package de.bsommerfeld.notes.db;

import de.bsommerfeld.notes.core.domain.Category;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Cardinality checks of {@link CategoryRepository#findByName}. The unique
 * constraint keeps duplicates out of a real database, so the manager is
 * mocked to hand back the rows directly.
 */
@ExtendWith(MockitoExtension.class)
class CategoryRepositoryLookupTest {

    @Mock
    private DatabaseManager databaseManager;

    private CategoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new CategoryRepository(databaseManager);
    }

    @Test
    void findByName_shouldReturnSingleMatch() {
        when(databaseManager.query(any())).thenReturn(List.of(new Category(1, "Work")));

        assertEquals(new Category(1, "Work"), repository.findByName("Work"));
    }

    @Test
    void findByName_shouldRejectMultipleMatches() {
        when(databaseManager.query(any())).thenReturn(
                List.of(new Category(1, "Work"), new Category(2, "Work")));

        assertThrows(NonUniqueResultException.class, () -> repository.findByName("Work"));
    }

    @Test
    void findByName_shouldRejectNoMatch() {
        when(databaseManager.query(any())).thenReturn(List.of());

        assertThrows(NoResultException.class, () -> repository.findByName("Work"));
    }

    @Test
    void findByName_shouldPropagateQueryFailure() {
        when(databaseManager.query(any())).thenThrow(new DatabaseException("connection lost"));

        assertThrows(DatabaseException.class, () -> repository.findByName("Work"));
    }
}
