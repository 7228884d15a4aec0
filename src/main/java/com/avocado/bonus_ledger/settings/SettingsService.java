package com.avocado.bonus_ledger.settings;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Key/value settings store backed by the system_settings table.
 *
 * Values are stored as text and coerced by the reader. Writes are upserts:
 * an existing key gets the new value, and its description is replaced only
 * when a new description is supplied.
 */
@Service
@Slf4j
public class SettingsService {

    private final JdbcTemplate jdbcTemplate;

    public SettingsService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the raw value of a setting, or empty if the key is absent.
     */
    public Optional<String> getSetting(String key) {
        List<String> values = jdbcTemplate.queryForList(
            "SELECT value FROM system_settings WHERE key = ?",
            String.class,
            key
        );
        return values.stream().findFirst();
    }

    /**
     * Inserts or updates a setting.
     *
     * @param key setting key, required
     * @param value new value, required
     * @param description optional; null keeps the existing description
     */
    @Transactional
    public void setSetting(String key, String value, String description) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Setting key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("Setting value cannot be null: " + key);
        }

        jdbcTemplate.update(
            "INSERT INTO system_settings (key, value, description, created_at, updated_at) " +
            "VALUES (?, ?, ?, NOW(), NOW()) " +
            "ON CONFLICT (key) DO UPDATE SET " +
            "  value = EXCLUDED.value, " +
            "  description = COALESCE(EXCLUDED.description, system_settings.description), " +
            "  updated_at = NOW()",
            key,
            value,
            description
        );

        log.info("Setting updated: {}={}", key, value);
    }

    public Optional<SystemSetting> findSetting(String key) {
        return jdbcTemplate.query(
            "SELECT key, value, description, created_at, updated_at FROM system_settings WHERE key = ?",
            settingRowMapper(),
            key
        ).stream().findFirst();
    }

    public List<SystemSetting> getAllSettings() {
        return jdbcTemplate.query(
            "SELECT key, value, description, created_at, updated_at FROM system_settings ORDER BY key",
            settingRowMapper()
        );
    }

    /**
     * Loads the bonus program configuration in one round trip.
     */
    public BonusSettings loadBonusSettings() {
        List<SystemSetting> rows = jdbcTemplate.query(
            "SELECT key, value, description, created_at, updated_at FROM system_settings WHERE key IN (?, ?, ?)",
            settingRowMapper(),
            SettingKeys.BONUS_SYSTEM_ENABLED,
            SettingKeys.BONUS_SYSTEM_START_DATE,
            SettingKeys.DEFAULT_BONUS_PERCENT
        );

        String enabled = null;
        String startDate = null;
        String defaultPercent = null;
        for (SystemSetting row : rows) {
            switch (row.getKey()) {
                case SettingKeys.BONUS_SYSTEM_ENABLED -> enabled = row.getValue();
                case SettingKeys.BONUS_SYSTEM_START_DATE -> startDate = row.getValue();
                case SettingKeys.DEFAULT_BONUS_PERCENT -> defaultPercent = row.getValue();
                default -> { }
            }
        }
        return BonusSettings.fromRawValues(enabled, startDate, defaultPercent);
    }

    private RowMapper<SystemSetting> settingRowMapper() {
        return (rs, rowNum) -> new SystemSetting(
            rs.getString("key"),
            rs.getString("value"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toLocalDateTime(),
            rs.getTimestamp("updated_at").toLocalDateTime()
        );
    }
}
