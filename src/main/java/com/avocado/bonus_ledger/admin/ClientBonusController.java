package com.avocado.bonus_ledger.admin;

import com.avocado.bonus_ledger.admin.dto.AdjustmentRequest;
import com.avocado.bonus_ledger.admin.dto.ClientBonusResponse;
import com.avocado.bonus_ledger.admin.dto.LedgerEntryResponse;
import com.avocado.bonus_ledger.bonus.BonusAdjustmentService;
import com.avocado.bonus_ledger.bonus.BonusHistoryService;
import com.avocado.bonus_ledger.bonus.BonusLedgerEntry;
import com.avocado.bonus_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bonus history and manual corrections for one client.
 */
@RestController
@RequestMapping("/api/clients/{clientId}/bonus")
@RequiredArgsConstructor
@Slf4j
public class ClientBonusController {

    private final BonusHistoryService historyService;
    private final BonusAdjustmentService adjustmentService;

    @GetMapping
    public ClientBonusResponse getBonusSummary(@PathVariable("clientId") Long clientId,
                                               @RequestParam(value = "recent", defaultValue = "20") int recent) {
        return ClientBonusResponse.from(historyService.summarize(clientId, recent));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<LedgerEntryResponse> adjust(@PathVariable("clientId") Long clientId,
                                                      @Valid @RequestBody AdjustmentRequest request) {
        MDC.put(CorrelationContext.CLIENT_ID_MDC_KEY, clientId.toString());
        try {
            BonusLedgerEntry entry = adjustmentService.adjust(
                clientId, request.getAmountMinor(), request.getReason(), request.getAdminId());
            return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
        } finally {
            MDC.remove(CorrelationContext.CLIENT_ID_MDC_KEY);
        }
    }
}
