package com.ardua.ledger.api;

import com.ardua.ledger.reporting.AgingReport;
import com.ardua.ledger.reporting.ClientBalance;
import com.ardua.ledger.reporting.IncomeStatement;
import com.ardua.ledger.reporting.ReportService;
import com.ardua.ledger.reporting.TrialBalance;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/trial-balance")
    public TrialBalance trialBalance(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.trialBalance(from, to);
    }

    @GetMapping("/income-statement")
    public IncomeStatement incomeStatement(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.incomeStatement(from, to);
    }

    @GetMapping("/client-balances")
    public List<ClientBalance> clientBalances() {
        return reportService.clientBalanceSummary();
    }

    @GetMapping("/ar-aging")
    public AgingReport arAging(
            @RequestParam(value = "as_of", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return asOf != null ? reportService.arAging(asOf) : reportService.arAging();
    }
}
