package com.ardua.ledger.reporting;

import com.ardua.ledger.billing.Client;
import com.ardua.ledger.billing.ClientService;
import com.ardua.ledger.billing.Invoice;
import com.ardua.ledger.billing.InvoiceRepository;
import com.ardua.ledger.billing.InvoiceService;
import com.ardua.ledger.billing.InvoiceStatus;
import com.ardua.ledger.ledger.AccountType;
import com.ardua.ledger.payment.PaymentApplicationRepository;
import com.ardua.ledger.payment.PaymentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger and receivables reports. Journal aggregates are read with SQL over
 * {@code journal_lines}; receivables come from invoices and payment applications.
 */
@Service
public class ReportService {

    private static final List<InvoiceStatus> BILLED = List.of(InvoiceStatus.ISSUED, InvoiceStatus.PAID);

    private final JdbcTemplate jdbcTemplate;
    private final ClientService clientService;
    private final InvoiceRepository invoiceRepository;
    private final InvoiceService invoiceService;
    private final PaymentRepository paymentRepository;
    private final PaymentApplicationRepository applicationRepository;
    private final Clock clock;

    public ReportService(JdbcTemplate jdbcTemplate, ClientService clientService,
                         InvoiceRepository invoiceRepository, InvoiceService invoiceService,
                         PaymentRepository paymentRepository, PaymentApplicationRepository applicationRepository,
                         Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clientService = clientService;
        this.invoiceRepository = invoiceRepository;
        this.invoiceService = invoiceService;
        this.paymentRepository = paymentRepository;
        this.applicationRepository = applicationRepository;
        this.clock = clock;
    }

    /**
     * Debit and credit totals per account for entries posted within the
     * optional inclusive date range. Accounts without activity show zeros.
     */
    @Transactional(readOnly = true)
    public TrialBalance trialBalance(LocalDate from, LocalDate to) {
        List<TrialBalanceRow> rows = accountTotals(from, to, null);
        BigDecimal debits = rows.stream().map(TrialBalanceRow::getDebits).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal credits = rows.stream().map(TrialBalanceRow::getCredits).reduce(BigDecimal.ZERO, BigDecimal::add);
        return new TrialBalance(from, to, rows, debits, credits);
    }

    @Transactional(readOnly = true)
    public IncomeStatement incomeStatement(LocalDate from, LocalDate to) {
        List<TrialBalanceRow> income = accountTotals(from, to, AccountType.INCOME);
        List<TrialBalanceRow> expenses = accountTotals(from, to, AccountType.EXPENSE);

        BigDecimal revenue = income.stream()
            .map(row -> row.getCredits().subtract(row.getDebits()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal expense = expenses.stream()
            .map(TrialBalanceRow::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new IncomeStatement(from, to, income, expenses, revenue, expense);
    }

    /**
     * Per client, ordered by name: billed total, applied payments, unapplied
     * credit and the outstanding balance of issued and paid invoices.
     */
    @Transactional(readOnly = true)
    public List<ClientBalance> clientBalanceSummary() {
        List<ClientBalance> summary = new ArrayList<>();
        for (Client client : clientService.listClients()) {
            BigDecimal invoiced = BigDecimal.ZERO;
            BigDecimal outstanding = BigDecimal.ZERO;
            for (Invoice invoice : invoiceRepository.findByClientIdOrderByIssueDateAscIdAsc(client.getId())) {
                if (BILLED.contains(invoice.getStatus())) {
                    invoiced = invoiced.add(invoice.getTotal());
                    outstanding = outstanding.add(invoiceService.outstandingBalance(invoice.getId()));
                }
            }
            summary.add(new ClientBalance(
                client.getId(),
                client.getName(),
                invoiced,
                applicationRepository.sumForClientInvoices(client.getId()),
                paymentRepository.sumUnappliedForClient(client.getId()),
                outstanding));
        }
        return summary;
    }

    @Transactional(readOnly = true)
    public AgingReport arAging() {
        return arAging(LocalDate.now(clock));
    }

    /**
     * Issued invoices with a positive outstanding balance, bucketed by days
     * past their due date as of {@code asOf}.
     */
    @Transactional(readOnly = true)
    public AgingReport arAging(LocalDate asOf) {
        Map<AgingBucket, List<AgingLine>> buckets = new EnumMap<>(AgingBucket.class);
        for (AgingBucket bucket : AgingBucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }

        for (Invoice invoice : invoiceRepository.findByStatusInOrderByDueDateAscIdAsc(BILLED)) {
            BigDecimal outstanding = invoiceService.outstandingBalance(invoice.getId());
            if (outstanding.signum() <= 0) {
                continue;
            }
            long daysPastDue = ChronoUnit.DAYS.between(invoice.getDueDate(), asOf);
            buckets.get(AgingBucket.forDaysPastDue(daysPastDue)).add(new AgingLine(
                invoice.getId(), invoice.getInvoiceNumber(), invoice.getClientId(),
                invoice.getDueDate(), daysPastDue, outstanding));
        }
        return new AgingReport(asOf, buckets);
    }

    private List<TrialBalanceRow> accountTotals(LocalDate from, LocalDate to, AccountType type) {
        StringBuilder entryFilter = new StringBuilder();
        List<Object> args = new ArrayList<>();
        if (from != null) {
            entryFilter.append(" AND e.posted_at >= ?");
            args.add(Timestamp.valueOf(from.atStartOfDay()));
        }
        if (to != null) {
            entryFilter.append(" AND e.posted_at < ?");
            args.add(Timestamp.valueOf(to.plusDays(1).atStartOfDay()));
        }
        String typeFilter = "";
        if (type != null) {
            typeFilter = " WHERE a.account_type = ?";
            args.add(type.name());
        }

        String sql = """
            SELECT a.id, a.code, a.name, a.account_type,
                   COALESCE(SUM(l.debit), 0) AS debits, COALESCE(SUM(l.credit), 0) AS credits
            FROM accounts a
            LEFT JOIN (
                SELECT jl.account_id, jl.debit, jl.credit
                FROM journal_lines jl JOIN journal_entries e ON e.id = jl.entry_id
                WHERE 1 = 1%s
            ) l ON l.account_id = a.id%s
            GROUP BY a.id, a.code, a.name, a.account_type
            ORDER BY a.account_type, a.code
            """.formatted(entryFilter, typeFilter);

        return jdbcTemplate.query(sql, (rs, rowNum) -> new TrialBalanceRow(
            rs.getLong("id"),
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getBigDecimal("debits"),
            rs.getBigDecimal("credits")), args.toArray());
    }
}
