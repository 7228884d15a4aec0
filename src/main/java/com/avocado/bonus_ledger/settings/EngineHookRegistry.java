package com.avocado.bonus_ledger.settings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

/**
 * Persistent on/off switches for the engine hooks.
 *
 * State lives in the settings store, so a switch flipped by one instance is seen by all
 * of them, and a hook left disabled by an interrupted recalculation stays disabled until
 * an operator enables it again. A hook with no stored state is enabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngineHookRegistry {

    private final SettingsService settingsService;

    public boolean isEnabled(EngineHook hook) {
        return settingsService.getSetting(hook.getSettingKey())
            .map(value -> Boolean.parseBoolean(value.trim()))
            .orElse(true);
    }

    @Transactional
    public void enable(EngineHook hook) {
        setState(hook, true);
    }

    @Transactional
    public void disable(EngineHook hook) {
        setState(hook, false);
    }

    public Map<EngineHook, Boolean> statuses() {
        Map<EngineHook, Boolean> statuses = new EnumMap<>(EngineHook.class);
        for (EngineHook hook : EngineHook.values()) {
            statuses.put(hook, isEnabled(hook));
        }
        return statuses;
    }

    private void setState(EngineHook hook, boolean enabled) {
        settingsService.setSetting(hook.getSettingKey(), String.valueOf(enabled),
            "Automatic " + hook.name().toLowerCase() + " hook");
        log.info("Engine hook {} {}", hook, enabled ? "enabled" : "disabled");
    }
}
