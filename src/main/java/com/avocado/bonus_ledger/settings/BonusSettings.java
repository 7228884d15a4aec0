package com.avocado.bonus_ledger.settings;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Bonus program configuration, read from the settings store once per engine invocation
 * and passed explicitly into the posting engine.
 *
 * Absent keys fall back to: disabled, start date 2025-09-01, 5.0 percent.
 * The default percentage is informational; postings always use the percentage stored
 * on the transaction itself.
 */
@Value
@Slf4j
public class BonusSettings {

    public static final LocalDate DEFAULT_START_DATE = LocalDate.of(2025, 9, 1);
    public static final BigDecimal DEFAULT_BONUS_PERCENT = new BigDecimal("5.0");

    private static final Set<String> TRUE_LITERALS = Set.of("true", "t", "yes", "y", "on", "1");

    boolean enabled;
    LocalDate startDate;
    BigDecimal defaultBonusPercent;

    /**
     * Builds settings from the raw text values of the store.
     *
     * @throws IllegalStateException if a start date is present but is not an ISO date
     */
    public static BonusSettings fromRawValues(String enabled, String startDate, String defaultPercent) {
        return new BonusSettings(
            parseEnabled(enabled),
            parseStartDate(startDate),
            parsePercent(defaultPercent)
        );
    }

    public static BonusSettings defaults() {
        return new BonusSettings(false, DEFAULT_START_DATE, DEFAULT_BONUS_PERCENT);
    }

    /**
     * True if a transaction closed at the given moment falls inside the bonus window.
     * Only the calendar date of the close time is compared.
     */
    public boolean coversCloseDate(LocalDateTime dateClose) {
        return dateClose != null && !dateClose.toLocalDate().isBefore(startDate);
    }

    private static boolean parseEnabled(String raw) {
        if (raw == null) {
            return false;
        }
        return TRUE_LITERALS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    private static LocalDate parseStartDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_START_DATE;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid value for setting "
                + SettingKeys.BONUS_SYSTEM_START_DATE + ": " + raw, e);
        }
    }

    private static BigDecimal parsePercent(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_BONUS_PERCENT;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {} value '{}', using {}",
                SettingKeys.DEFAULT_BONUS_PERCENT, raw, DEFAULT_BONUS_PERCENT);
            return DEFAULT_BONUS_PERCENT;
        }
    }
}
