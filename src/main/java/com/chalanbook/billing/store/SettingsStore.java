package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;
import com.chalanbook.billing.model.CompanySettings;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Company settings persisted as rows of the {@code meta} table.
 */
public class SettingsStore {

    /** Settings rows, their meta keys and seeded defaults. */
    public enum Key {
        COMPANY_NAME("company_name", CompanySettings.DEFAULT_COMPANY_NAME,
                CompanySettings::getCompanyName, CompanySettings::setCompanyName),
        COMPANY_CITY("company_city", CompanySettings.DEFAULT_COMPANY_CITY,
                CompanySettings::getCompanyCity, CompanySettings::setCompanyCity),
        COMPANY_MOBILE("company_mobile", CompanySettings.DEFAULT_COMPANY_MOBILE,
                CompanySettings::getCompanyMobile, CompanySettings::setCompanyMobile),
        BANK_ACCOUNT_NAME("bank_ac_name", CompanySettings.DEFAULT_BANK_ACCOUNT_NAME,
                CompanySettings::getBankAccountName, CompanySettings::setBankAccountName),
        BANK_NAME("bank_name", CompanySettings.DEFAULT_BANK_NAME,
                CompanySettings::getBankName, CompanySettings::setBankName),
        BANK_ACCOUNT_NO("bank_ac_no", CompanySettings.DEFAULT_BANK_ACCOUNT_NO,
                CompanySettings::getBankAccountNo, CompanySettings::setBankAccountNo),
        BANK_IFSC("bank_ifsc", CompanySettings.DEFAULT_BANK_IFSC,
                CompanySettings::getBankIfsc, CompanySettings::setBankIfsc),
        LOGO_PATH("logo_path", "",
                CompanySettings::getLogoPath, CompanySettings::setLogoPath);

        private final String metaKey;
        private final String defaultValue;
        private final Function<CompanySettings, String> getter;
        private final BiConsumer<CompanySettings, String> setter;

        Key(String metaKey, String defaultValue,
            Function<CompanySettings, String> getter, BiConsumer<CompanySettings, String> setter) {
            this.metaKey = metaKey;
            this.defaultValue = defaultValue;
            this.getter = getter;
            this.setter = setter;
        }

        public String metaKey() {
            return metaKey;
        }

        public String defaultValue() {
            return defaultValue;
        }
    }

    private final Database database;

    public SettingsStore(Database database) {
        this.database = database;
    }

    public CompanySettings load() {
        CompanySettings settings = new CompanySettings();
        try (Connection connection = database.connect()) {
            for (Key key : Key.values()) {
                String value = MetaStore.get(connection, key.metaKey).orElse(key.defaultValue);
                key.setter.accept(settings, value);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load company settings", e);
        }
        return settings;
    }

    /**
     * Stores every field, trimmed; null fields are stored as empty strings.
     */
    public void save(CompanySettings settings) {
        try (Connection connection = database.connect()) {
            connection.setAutoCommit(false);
            for (Key key : Key.values()) {
                String value = key.getter.apply(settings);
                MetaStore.set(connection, key.metaKey, value == null ? "" : value.trim());
            }
            connection.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to save company settings", e);
        }
    }
}
