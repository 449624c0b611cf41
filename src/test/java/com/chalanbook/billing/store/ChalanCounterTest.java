package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;
import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.LineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChalanCounter
 */
class ChalanCounterTest {

    @TempDir
    Path tempDir;

    private Database database;
    private ChalanCounter counter;

    @BeforeEach
    void setUp() {
        database = new Database(tempDir.resolve("invoices.db"));
        database.initialize();
        counter = new ChalanCounter(database);
    }

    private void saveChalan(int chalanNo) {
        Invoice invoice = new Invoice(chalanNo, LocalDate.of(2025, 1, 1));
        invoice.getItems().add(new LineItem("Item", BigDecimal.ONE, BigDecimal.TEN));
        new InvoiceRepository(database).save(invoice);
    }

    private void execute(String sql) throws SQLException {
        try (Connection connection = database.connect(); Statement st = connection.createStatement()) {
            st.execute(sql);
        }
    }

    @Nested
    @DisplayName("next")
    class Next {

        @Test
        @DisplayName("should start at one on a fresh database")
        void shouldStartAtOne() {
            assertEquals(1, counter.next());
            assertEquals(2, counter.next());
        }

        @Test
        @DisplayName("should persist across instances")
        void shouldPersist() {
            counter.next();
            counter.next();

            assertEquals(3, new ChalanCounter(database).next());
        }

        @Test
        @DisplayName("should fail instead of wrapping when the counter is at the largest int")
        void shouldFailWhenExhausted() {
            counter.reset(Integer.MAX_VALUE);

            StorageException e = assertThrows(StorageException.class, () -> counter.next());

            assertEquals("CHALAN_COUNTER_EXHAUSTED", e.getCode());
            assertEquals(Integer.MAX_VALUE, counter.peek());
        }

        @Test
        @DisplayName("should continue after the highest saved chalan when the counter row is missing")
        void shouldRecoverFromMissingRow() throws SQLException {
            saveChalan(15);
            execute("DELETE FROM meta WHERE key = 'chalan_no'");

            assertEquals(16, counter.next());
            assertEquals(17, counter.next());
        }

        @Test
        @DisplayName("should continue after the highest saved chalan when the counter is not a number")
        void shouldRecoverFromGarbage() throws SQLException {
            saveChalan(4);
            execute("UPDATE meta SET value = 'abc' WHERE key = 'chalan_no'");

            assertEquals(5, counter.next());
        }

        @Test
        @DisplayName("should not be reset by initialising an existing database again")
        void shouldSurviveReinitialise() {
            counter.next();
            counter.next();
            database.initialize();

            assertEquals(3, counter.next());
        }
    }

    @Nested
    @DisplayName("reset")
    class Reset {

        @Test
        @DisplayName("should make the next allocation value + 1")
        void shouldReset() {
            counter.next();
            counter.next();

            counter.reset(0);
            assertEquals(1, counter.next());

            counter.reset(41);
            assertEquals(42, counter.next());
        }

        @Test
        @DisplayName("should reject negative values")
        void shouldRejectNegative() {
            assertThrows(IllegalArgumentException.class, () -> counter.reset(-1));
        }
    }

    @Test
    @DisplayName("peek should not consume a number")
    void peekShouldNotConsume() {
        counter.next();

        assertEquals(1, counter.peek());
        assertEquals(1, counter.peek());
        assertEquals(2, counter.next());
    }
}
