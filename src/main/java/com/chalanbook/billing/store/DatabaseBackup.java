package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamped copies of the database file.
 */
public class DatabaseBackup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseBackup.class);

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Database database;
    private final Clock clock;

    public DatabaseBackup(Database database) {
        this(database, Clock.systemDefaultZone());
    }

    public DatabaseBackup(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Copies the database into {@code folder} as {@code invoices_backup_<yyyyMMdd_HHmmss>.db},
     * creating the folder if needed.
     *
     * @return the written copy
     */
    public Path backupTo(Path folder) {
        String name = "invoices_backup_" + LocalDateTime.now(clock).format(STAMP) + ".db";
        Path destination = folder.resolve(name);
        try {
            Files.createDirectories(folder);
            Files.copy(database.getFile(), destination,
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new StorageException("Backup to " + destination + " failed", "BACKUP_FAILED", e);
        }
        logger.info("Database backed up to {}", destination);
        return destination;
    }
}
