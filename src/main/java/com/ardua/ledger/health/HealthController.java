package com.ardua.ledger.health;

import com.ardua.ledger.ledger.JournalTotals;
import com.ardua.ledger.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
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
 * Liveness and readiness probe. Besides the database connection it reports
 * whether the journal's global debit and credit totals agree.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final LedgerService ledgerService;

    public HealthController(DataSource dataSource, LedgerService ledgerService) {
        this.dataSource = dataSource;
        this.ledgerService = ledgerService;
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

        try {
            JournalTotals totals = ledgerService.journalTotals();
            response.put("ledger", totals.isBalanced() ? "BALANCED" : "UNBALANCED");
            response.put("total_debits", totals.getDebits());
            response.put("total_credits", totals.getCredits());
            if (!totals.isBalanced()) {
                log.error("Journal totals disagree: debits={}, credits={}", totals.getDebits(), totals.getCredits());
                response.put("status", "DOWN");
                return ResponseEntity.status(503).body(response);
            }
        } catch (DataAccessException e) {
            log.warn("Journal totals unavailable: {}", e.getMessage());
            response.put("ledger", "UNKNOWN");
        }

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
}
