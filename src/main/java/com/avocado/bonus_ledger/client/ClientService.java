package com.avocado.bonus_ledger.client;

import com.avocado.bonus_ledger.bonus.MinorUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Client records and the stored bonus balance.
 *
 * The balance column is a cache of the ledger: every write to it must happen in the
 * same transaction as the ledger entries that explain it, and after
 * {@link #lockBonusBalance(Long)} has taken the client's row lock. The balance methods
 * declare no transaction boundary so they can run behind the posting savepoint.
 */
@Service
@Slf4j
public class ClientService {

    private final JdbcTemplate jdbcTemplate;

    public ClientService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates a client or refreshes its profile fields. The bonus balance of an
     * existing client is never touched here.
     */
    @Transactional
    public Client registerClient(Long clientId, String firstname, String lastname, String phone) {
        if (clientId == null) {
            throw new IllegalArgumentException("Client ID cannot be null");
        }
        jdbcTemplate.update(
            "INSERT INTO clients (client_id, firstname, lastname, phone, bonus, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, 0, NOW(), NOW()) " +
            "ON CONFLICT (client_id) DO UPDATE SET " +
            "  firstname = EXCLUDED.firstname, lastname = EXCLUDED.lastname, " +
            "  phone = EXCLUDED.phone, updated_at = NOW()",
            clientId, firstname, lastname, phone
        );
        return findById(clientId).orElseThrow(() -> new ClientNotFoundException(clientId));
    }

    public Optional<Client> findById(Long clientId) {
        List<Client> clients = jdbcTemplate.query(
            "SELECT client_id, firstname, lastname, phone, bonus, created_at, updated_at " +
            "FROM clients WHERE client_id = ?",
            clientRowMapper(),
            clientId
        );
        return clients.stream().findFirst();
    }

    public boolean exists(Long clientId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM clients WHERE client_id = ?", Integer.class, clientId);
        return count != null && count > 0;
    }

    /**
     * Reads the stored balance and locks the client row until the surrounding
     * transaction ends. A null balance reads as zero.
     *
     * @throws ClientNotFoundException if the client does not exist
     */
    public long lockBonusBalance(Long clientId) {
        List<Long> balances = jdbcTemplate.query(
            "SELECT COALESCE(bonus, 0) AS bonus FROM clients WHERE client_id = ? FOR UPDATE",
            (rs, rowNum) -> MinorUnits.fromColumn(rs.getBigDecimal("bonus")),
            clientId
        );
        if (balances.isEmpty()) {
            throw new ClientNotFoundException(clientId);
        }
        return balances.get(0);
    }

    public void updateBonusBalance(Long clientId, long balance) {
        int updated = jdbcTemplate.update(
            "UPDATE clients SET bonus = ?, updated_at = NOW() WHERE client_id = ?",
            balance, clientId
        );
        if (updated == 0) {
            throw new ClientNotFoundException(clientId);
        }
    }

    /**
     * Sets every client's balance to zero. Used only when the ledger is rebuilt.
     */
    public int resetAllBonusBalances() {
        int updated = jdbcTemplate.update("UPDATE clients SET bonus = 0, updated_at = NOW()");
        log.info("Reset bonus balance of {} clients", updated);
        return updated;
    }

    private RowMapper<Client> clientRowMapper() {
        return (rs, rowNum) -> new Client(
            rs.getLong("client_id"),
            rs.getString("firstname"),
            rs.getString("lastname"),
            rs.getString("phone"),
            MinorUnits.fromColumn(rs.getBigDecimal("bonus")),
            rs.getTimestamp("created_at").toLocalDateTime(),
            rs.getTimestamp("updated_at").toLocalDateTime()
        );
    }
}
