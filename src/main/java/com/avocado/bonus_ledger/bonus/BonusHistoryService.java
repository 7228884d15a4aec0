package com.avocado.bonus_ledger.bonus;

import com.avocado.bonus_ledger.client.Client;
import com.avocado.bonus_ledger.client.ClientNotFoundException;
import com.avocado.bonus_ledger.client.ClientService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class BonusHistoryService {

    private static final int MAX_RECENT_ENTRIES = 100;

    private final ClientService clientService;
    private final BonusLedgerService ledgerService;

    @Transactional(readOnly = true)
    public ClientBonusSummary summarize(Long clientId, int recentLimit) {
        if (recentLimit < 1 || recentLimit > MAX_RECENT_ENTRIES) {
            throw new IllegalArgumentException("Recent entry limit must be between 1 and " + MAX_RECENT_ENTRIES);
        }
        Client client = clientService.findById(clientId)
            .orElseThrow(() -> new ClientNotFoundException(clientId));

        ClientBonusSummary summary = ClientBonusSummary.builder()
            .clientId(client.getClientId())
            .firstname(client.getFirstname())
            .lastname(client.getLastname())
            .storedBalance(client.getBonusBalance())
            .ledgerBalance(ledgerService.sumForClient(clientId))
            .statistics(ledgerService.statisticsForClient(clientId))
            .recentEntries(ledgerService.findRecentForClient(clientId, recentLimit))
            .build();

        if (!summary.isConsistent()) {
            log.warn("Bonus balance of client {} does not match its ledger: stored={}, ledger={}",
                clientId, summary.getStoredBalance(), summary.getLedgerBalance());
        }
        return summary;
    }
}
