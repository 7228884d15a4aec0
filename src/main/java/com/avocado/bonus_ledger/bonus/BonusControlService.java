package com.avocado.bonus_ledger.bonus;

import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import com.avocado.bonus_ledger.settings.SettingKeys;
import com.avocado.bonus_ledger.settings.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator entry points of the bonus engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BonusControlService {

    private final EngineHookRegistry hookRegistry;
    private final SettingsService settingsService;
    private final BonusRecalculationService recalculationService;

    /**
     * Switches automatic posting and the program flag together.
     */
    @Transactional
    public String manageBonusTriggers(boolean enable) {
        if (enable) {
            hookRegistry.enable(EngineHook.BONUS_POSTING);
        } else {
            hookRegistry.disable(EngineHook.BONUS_POSTING);
        }
        settingsService.setSetting(SettingKeys.BONUS_SYSTEM_ENABLED, String.valueOf(enable), null);

        String message = enable
            ? "Bonus triggers ENABLED successfully"
            : "Bonus triggers DISABLED successfully";
        log.info(message);
        return message;
    }

    public BonusRecalculationSummary recalculateAllBonusesWithTrigger() {
        return recalculationService.recalculateAll();
    }

    public BonusRecalculationSummary resumeBonusRecalculation() {
        return recalculationService.resume();
    }
}
