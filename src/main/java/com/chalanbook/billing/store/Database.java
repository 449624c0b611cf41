package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * The local SQLite invoice database.
 *
 * <p>Connections are opened per operation; the application is single-user and
 * the file is the only shared state.
 */
public class Database {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    /** Primary SQLite result code for constraint violations. */
    static final int SQLITE_CONSTRAINT = 19;

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS meta ("
            + " key TEXT PRIMARY KEY,"
            + " value TEXT)",
        "CREATE TABLE IF NOT EXISTS invoices ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " chalan_no INTEGER UNIQUE,"
            + " party_name TEXT,"
            + " city TEXT,"
            + " lr_no TEXT,"
            + " dt TEXT,"
            + " tax_percent REAL,"
            + " pandf REAL,"
            + " subtotal REAL,"
            + " tax_amount REAL,"
            + " grand_total REAL)",
        "CREATE TABLE IF NOT EXISTS invoice_items ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " invoice_id INTEGER,"
            + " sr INTEGER,"
            + " item_name TEXT,"
            + " qty REAL,"
            + " rate REAL,"
            + " amount REAL,"
            + " FOREIGN KEY(invoice_id) REFERENCES invoices(id))",
        "CREATE TABLE IF NOT EXISTS item_master ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " name TEXT NOT NULL UNIQUE,"
            + " default_rate REAL NOT NULL)"
    };

    private final Path file;
    private final String url;

    public Database(Path file) {
        this.file = file.toAbsolutePath();
        this.url = "jdbc:sqlite:" + this.file;
    }

    public Path getFile() {
        return file;
    }

    public Connection connect() throws SQLException {
        Connection connection = DriverManager.getConnection(url);
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON");
        }
        return connection;
    }

    /**
     * Creates missing tables and seeds the meta rows (chalan counter, company
     * settings) that are not yet present. Safe to call on every start.
     */
    public void initialize() {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create database directory for " + file, e);
        }

        try (Connection connection = connect()) {
            connection.setAutoCommit(false);
            try (Statement st = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    st.execute(ddl);
                }
            }
            MetaStore.insertIfAbsent(connection, ChalanCounter.META_KEY, "0");
            for (SettingsStore.Key key : SettingsStore.Key.values()) {
                MetaStore.insertIfAbsent(connection, key.metaKey(), key.defaultValue());
            }
            connection.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to initialise database " + file, e);
        }
        logger.info("Database ready at {}", file);
    }

    public static BigDecimal toDecimal(double value) {
        return BigDecimal.valueOf(value);
    }

    public static boolean isConstraintViolation(SQLException e) {
        return e.getErrorCode() == SQLITE_CONSTRAINT;
    }
}
