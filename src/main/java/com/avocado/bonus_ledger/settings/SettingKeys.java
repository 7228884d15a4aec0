package com.avocado.bonus_ledger.settings;

/**
 * Well-known keys of the settings store.
 */
public final class SettingKeys {

    public static final String BONUS_SYSTEM_ENABLED = "bonus_system_enabled";
    public static final String BONUS_SYSTEM_START_DATE = "bonus_system_start_date";
    public static final String DEFAULT_BONUS_PERCENT = "default_bonus_percent";

    private SettingKeys() {
    }
}
