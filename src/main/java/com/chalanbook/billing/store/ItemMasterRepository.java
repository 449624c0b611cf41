package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;
import com.chalanbook.billing.exception.ValidationException;
import com.chalanbook.billing.model.MasterItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Catalogue of item names with the rate to prefill when an item is picked.
 */
public class ItemMasterRepository {

    private static final Logger logger = LoggerFactory.getLogger(ItemMasterRepository.class);

    private final Database database;

    public ItemMasterRepository(Database database) {
        this.database = database;
    }

    /** All items ordered by name. */
    public List<MasterItem> findAll() {
        List<MasterItem> items = new ArrayList<>();
        try (Connection connection = database.connect();
             Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT id, name, default_rate FROM item_master ORDER BY name")) {
            while (rs.next()) {
                items.add(new MasterItem(rs.getLong(1), rs.getString(2), Database.toDecimal(rs.getDouble(3))));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list item master", e);
        }
        return items;
    }

    /**
     * Adds a new item.
     *
     * @return false when an item with that name already exists
     * @throws ValidationException if the name is blank or the rate is negative
     */
    public boolean add(String name, BigDecimal rate) {
        String trimmed = requireName(name);
        requireRate(rate);
        try (Connection connection = database.connect();
             PreparedStatement ps = connection.prepareStatement(
                     "INSERT INTO item_master (name, default_rate) VALUES (?, ?)")) {
            ps.setString(1, trimmed);
            ps.setDouble(2, rate.doubleValue());
            ps.executeUpdate();
            logger.info("Added master item '{}' at {}", trimmed, rate);
            return true;
        } catch (SQLException e) {
            if (Database.isConstraintViolation(e)) {
                return false;
            }
            throw new StorageException("Failed to add master item " + trimmed, e);
        }
    }

    /**
     * Renames an item and changes its rate.
     *
     * @return false when the new name clashes with another item
     */
    public boolean update(long id, String name, BigDecimal rate) {
        String trimmed = requireName(name);
        requireRate(rate);
        try (Connection connection = database.connect();
             PreparedStatement ps = connection.prepareStatement(
                     "UPDATE item_master SET name = ?, default_rate = ? WHERE id = ?")) {
            ps.setString(1, trimmed);
            ps.setDouble(2, rate.doubleValue());
            ps.setLong(3, id);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (Database.isConstraintViolation(e)) {
                return false;
            }
            throw new StorageException("Failed to update master item " + id, e);
        }
    }

    public void delete(long id) {
        try (Connection connection = database.connect();
             PreparedStatement ps = connection.prepareStatement("DELETE FROM item_master WHERE id = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete master item " + id, e);
        }
    }

    public Optional<BigDecimal> findRateByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try (Connection connection = database.connect();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT default_rate FROM item_master WHERE name = ?")) {
            ps.setString(1, name.trim());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Database.toDecimal(rs.getDouble(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to look up rate for " + name, e);
        }
    }

    /**
     * Records the rate last used for an item, creating the item if it is new.
     */
    public void remember(String name, BigDecimal rate) {
        String trimmed = requireName(name);
        requireRate(rate);
        try (Connection connection = database.connect()) {
            connection.setAutoCommit(false);
            try (PreparedStatement insert = connection.prepareStatement(
                         "INSERT OR IGNORE INTO item_master (name, default_rate) VALUES (?, ?)");
                 PreparedStatement update = connection.prepareStatement(
                         "UPDATE item_master SET default_rate = ? WHERE name = ?")) {
                insert.setString(1, trimmed);
                insert.setDouble(2, rate.doubleValue());
                insert.executeUpdate();
                update.setDouble(1, rate.doubleValue());
                update.setString(2, trimmed);
                update.executeUpdate();
            }
            connection.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to remember rate for " + trimmed, e);
        }
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new ValidationException("Item name required", "name");
        }
        return name.trim();
    }

    private static void requireRate(BigDecimal rate) {
        if (rate == null || rate.signum() < 0) {
            throw new ValidationException("Rate must be 0 or more", "rate");
        }
    }
}
