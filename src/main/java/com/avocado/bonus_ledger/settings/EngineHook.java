package com.avocado.bonus_ledger.settings;

/**
 * Automatic reactions to sale writes that an operator can switch off,
 * for example while a bulk recalculation rebuilds the same data.
 */
public enum EngineHook {

    /** Bonus posting when a closed sale is first recorded. */
    BONUS_POSTING("hook.bonus_posting.enabled"),

    /** Discount recomputation when line items are added, changed or removed. */
    DISCOUNT_ON_LINE_ITEMS("hook.discount_line_items.enabled"),

    /** Discount recomputation when the paid amounts of a sale change. */
    DISCOUNT_ON_PAYMENTS("hook.discount_payments.enabled");

    private final String settingKey;

    EngineHook(String settingKey) {
        this.settingKey = settingKey;
    }

    public String getSettingKey() {
        return settingKey;
    }
}
