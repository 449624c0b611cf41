package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.ValidationException;
import com.chalanbook.billing.model.MasterItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ItemMasterRepository
 */
class ItemMasterRepositoryTest {

    @TempDir
    Path tempDir;

    private ItemMasterRepository repository;

    @BeforeEach
    void setUp() {
        Database database = new Database(tempDir.resolve("invoices.db"));
        database.initialize();
        repository = new ItemMasterRepository(database);
    }

    @Nested
    @DisplayName("add")
    class Add {

        @Test
        @DisplayName("should store trimmed names ordered by name")
        void shouldStoreOrdered() {
            assertTrue(repository.add("  Valve ", new BigDecimal("120")));
            assertTrue(repository.add("Bolt", new BigDecimal("2.5")));

            List<MasterItem> items = repository.findAll();

            assertEquals(2, items.size());
            assertEquals("Bolt", items.get(0).getName());
            assertEquals("Valve", items.get(1).getName());
            assertEquals(0, new BigDecimal("2.5").compareTo(items.get(0).getDefaultRate()));
        }

        @Test
        @DisplayName("should refuse a duplicate name")
        void shouldRefuseDuplicate() {
            assertTrue(repository.add("Bolt", BigDecimal.ONE));

            assertFalse(repository.add("Bolt ", BigDecimal.TEN));
            assertEquals(1, repository.findAll().size());
        }

        @Test
        @DisplayName("should reject a blank name")
        void shouldRejectBlank() {
            assertThrows(ValidationException.class, () -> repository.add("  ", BigDecimal.ONE));
        }

        @Test
        @DisplayName("should reject a negative rate")
        void shouldRejectNegativeRate() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> repository.add("Tile", new BigDecimal("-1")));

            assertEquals("rate", e.getField());
            assertTrue(repository.findAll().isEmpty());
        }
    }

    @Nested
    @DisplayName("update and delete")
    class UpdateAndDelete {

        @Test
        @DisplayName("should rename and re-rate")
        void shouldUpdate() {
            repository.add("Bolt", BigDecimal.ONE);
            long id = repository.findAll().get(0).getId();

            assertTrue(repository.update(id, "Hex Bolt", new BigDecimal("3")));

            assertEquals(0, new BigDecimal("3").compareTo(repository.findRateByName("Hex Bolt").orElseThrow()));
            assertTrue(repository.findRateByName("Bolt").isEmpty());
        }

        @Test
        @DisplayName("should refuse a rename onto an existing name")
        void shouldRefuseClash() {
            repository.add("Bolt", BigDecimal.ONE);
            repository.add("Nut", BigDecimal.ONE);
            long nutId = repository.findAll().get(1).getId();

            assertFalse(repository.update(nutId, "Bolt", BigDecimal.TEN));
        }

        @Test
        @DisplayName("should delete by id")
        void shouldDelete() {
            repository.add("Bolt", BigDecimal.ONE);
            long id = repository.findAll().get(0).getId();

            repository.delete(id);

            assertTrue(repository.findAll().isEmpty());
        }
    }

    @Nested
    @DisplayName("remember")
    class Remember {

        @Test
        @DisplayName("should insert a new item and then track its latest rate")
        void shouldInsertThenUpdate() {
            repository.remember("Gasket", new BigDecimal("15"));
            repository.remember("Gasket", new BigDecimal("17.5"));

            assertEquals(1, repository.findAll().size());
            assertEquals(0, new BigDecimal("17.5").compareTo(repository.findRateByName("Gasket").orElseThrow()));
        }
    }

    @Test
    @DisplayName("findRateByName should be empty for unknown or null names")
    void shouldNotFindUnknown() {
        assertTrue(repository.findRateByName("Nothing").isEmpty());
        assertTrue(repository.findRateByName(null).isEmpty());
    }
}
