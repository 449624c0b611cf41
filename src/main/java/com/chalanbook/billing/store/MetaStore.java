package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Key/value rows of the {@code meta} table: the chalan counter and the company settings.
 */
public class MetaStore {

    private final Database database;

    public MetaStore(Database database) {
        this.database = database;
    }

    public Optional<String> get(String key) {
        try (Connection connection = database.connect()) {
            return get(connection, key);
        } catch (SQLException e) {
            throw new StorageException("Failed to read setting " + key, e);
        }
    }

    public String get(String key, String fallback) {
        return get(key).orElse(fallback);
    }

    public void set(String key, String value) {
        try (Connection connection = database.connect()) {
            set(connection, key, value);
        } catch (SQLException e) {
            throw new StorageException("Failed to write setting " + key, e);
        }
    }

    static Optional<String> get(Connection connection, String key) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT value FROM meta WHERE key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    static void set(Connection connection, String key, String value) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR REPLACE INTO meta (key, value) VALUES (?, ?)")) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }

    static void insertIfAbsent(Connection connection, String key, String value) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR IGNORE INTO meta (key, value) VALUES (?, ?)")) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }
}
