package com.avocado.bonus_ledger.settings;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * A single row of the key/value settings store.
 */
@Value
public class SystemSetting {
    String key;
    String value;
    String description;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
