package com.chalanbook.billing.store;

import com.chalanbook.billing.model.CompanySettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SettingsStore and MetaStore
 */
class SettingsStoreTest {

    @TempDir
    Path tempDir;

    private Database database;
    private SettingsStore store;

    @BeforeEach
    void setUp() {
        database = new Database(tempDir.resolve("invoices.db"));
        database.initialize();
        store = new SettingsStore(database);
    }

    @Test
    @DisplayName("should seed defaults on a fresh database")
    void shouldSeedDefaults() {
        CompanySettings settings = store.load();

        assertEquals("COMPANY NAME", settings.getCompanyName());
        assertEquals("CITY", settings.getCompanyCity());
        assertEquals("+91-123456789", settings.getCompanyMobile());
        assertEquals("XYZ0123456", settings.getBankIfsc());
        assertEquals("", settings.getLogoPath());
        assertEquals("COMPANY NAME", new MetaStore(database).get("company_name", "fallback"));
    }

    @Test
    @DisplayName("should save trimmed values and keep them across re-initialisation")
    void shouldSaveAndKeep() {
        CompanySettings settings = new CompanySettings();
        settings.setCompanyName("  Patel Hardware ");
        settings.setCompanyCity("Surat");
        settings.setBankIfsc("HDFC0001234");
        settings.setLogoPath(null);

        store.save(settings);
        database.initialize();
        CompanySettings loaded = store.load();

        assertEquals("Patel Hardware", loaded.getCompanyName());
        assertEquals("Surat", loaded.getCompanyCity());
        assertEquals("HDFC0001234", loaded.getBankIfsc());
        assertEquals("", loaded.getLogoPath());
        assertEquals("VIVEK G. RUPAPARA", loaded.getBankAccountName());
    }

    @Test
    @DisplayName("meta store should fall back for unknown keys and overwrite on set")
    void metaShouldFallBackAndOverwrite() {
        MetaStore meta = new MetaStore(database);

        assertEquals("x", meta.get("missing", "x"));

        meta.set("theme", "dark");
        meta.set("theme", "light");

        assertEquals("light", meta.get("theme").orElseThrow());
    }
}
