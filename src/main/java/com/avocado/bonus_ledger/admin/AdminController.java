package com.avocado.bonus_ledger.admin;

import com.avocado.bonus_ledger.admin.dto.BonusRecalculationResponse;
import com.avocado.bonus_ledger.admin.dto.ControlResponse;
import com.avocado.bonus_ledger.admin.dto.DiscountBatchRequest;
import com.avocado.bonus_ledger.admin.dto.DiscountChangeResponse;
import com.avocado.bonus_ledger.admin.dto.DiscountPreviewResponse;
import com.avocado.bonus_ledger.admin.dto.DiscountRecalculationResponse;
import com.avocado.bonus_ledger.admin.dto.SettingResponse;
import com.avocado.bonus_ledger.admin.dto.UpdateSettingRequest;
import com.avocado.bonus_ledger.bonus.BonusControlService;
import com.avocado.bonus_ledger.discount.DiscountControlService;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import com.avocado.bonus_ledger.settings.SettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator endpoints: engine switches, bulk recalculations and settings.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final BonusControlService bonusControlService;
    private final DiscountControlService discountControlService;
    private final SettingsService settingsService;
    private final EngineHookRegistry hookRegistry;

    @PostMapping("/bonus/triggers")
    public ControlResponse manageBonusTriggers(@RequestParam("enable") boolean enable) {
        return new ControlResponse(bonusControlService.manageBonusTriggers(enable));
    }

    @PostMapping("/bonus/recalculate")
    public BonusRecalculationResponse recalculateBonuses() {
        log.info("Operator requested full bonus recalculation");
        return BonusRecalculationResponse.from(bonusControlService.recalculateAllBonusesWithTrigger());
    }

    @PostMapping("/bonus/recalculate/resume")
    public BonusRecalculationResponse resumeBonusRecalculation() {
        log.info("Operator requested bonus recalculation resume");
        return BonusRecalculationResponse.from(bonusControlService.resumeBonusRecalculation());
    }

    @PostMapping("/discount/triggers")
    public ControlResponse manageDiscountTriggers(@RequestParam("enable") boolean enable) {
        return new ControlResponse(discountControlService.manageDiscountTriggers(enable));
    }

    @PostMapping("/discount/recalculate")
    public DiscountRecalculationResponse recalculateDiscounts() {
        log.info("Operator requested full discount recalculation");
        return DiscountRecalculationResponse.from(discountControlService.recalculateAllDiscountsWithTrigger());
    }

    @PostMapping("/discount/recalculate-batch")
    public List<DiscountChangeResponse> recalculateDiscountBatch(@Valid @RequestBody DiscountBatchRequest request) {
        return discountControlService.recalculateDiscounts(request.getTransactionIds()).stream()
            .map(DiscountChangeResponse::from)
            .toList();
    }

    @GetMapping("/discount/{transactionId}")
    public DiscountPreviewResponse previewDiscount(@PathVariable("transactionId") Long transactionId) {
        return new DiscountPreviewResponse(transactionId, discountControlService.calculateDiscount(transactionId));
    }

    @GetMapping("/settings")
    public List<SettingResponse> getSettings() {
        return settingsService.getAllSettings().stream()
            .map(SettingResponse::from)
            .toList();
    }

    @GetMapping("/settings/{key}")
    public ResponseEntity<SettingResponse> getSetting(@PathVariable("key") String key) {
        return findSetting(key)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/settings/{key}")
    public SettingResponse updateSetting(@PathVariable("key") String key,
                                         @Valid @RequestBody UpdateSettingRequest request) {
        settingsService.setSetting(key, request.getValue(), request.getDescription());
        return findSetting(key)
            .orElseThrow(() -> new IllegalStateException("Setting vanished after update: " + key));
    }

    @GetMapping("/hooks")
    public Map<String, Boolean> getHooks() {
        Map<String, Boolean> hooks = new LinkedHashMap<>();
        for (Map.Entry<EngineHook, Boolean> entry : hookRegistry.statuses().entrySet()) {
            hooks.put(entry.getKey().name(), entry.getValue());
        }
        return hooks;
    }

    private Optional<SettingResponse> findSetting(String key) {
        return settingsService.findSetting(key).map(SettingResponse::from);
    }
}
