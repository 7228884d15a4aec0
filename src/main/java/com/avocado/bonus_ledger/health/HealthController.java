package com.avocado.bonus_ledger.health;

import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for the POS sync job and load balancer probes.
 * Reports the engine hook switches next to database reachability; a disabled hook
 * does not make the service unhealthy.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final EngineHookRegistry hookRegistry;

    public HealthController(DataSource dataSource, EngineHookRegistry hookRegistry) {
        this.dataSource = dataSource;
        this.hookRegistry = hookRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        Map<String, String> hooks = new LinkedHashMap<>();
        hookRegistry.statuses().forEach((hook, enabled) ->
            hooks.put(hookName(hook), enabled ? "ENABLED" : "DISABLED"));
        response.put("hooks", hooks);

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static String hookName(EngineHook hook) {
        return hook.name().toLowerCase();
    }
}
