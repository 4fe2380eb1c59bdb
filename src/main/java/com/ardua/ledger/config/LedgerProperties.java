package com.ardua.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Chart-of-accounts codes the posting engine resolves at runtime, and the
 * numeric code range reserved for bank account GL accounts.
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Accounts accounts = new Accounts();
    private BankAccountCodes bankAccountCodes = new BankAccountCodes();

    @Data
    public static class Accounts {
        private String cash = "1000";
        private String accountsReceivable = "1100";
        private String unappliedPayments = "2200";
        private String ownerEquity = "3000";
        private String revenue = "4000";
    }

    @Data
    public static class BankAccountCodes {
        private int floor = 1110;
        private int ceiling = 1199;
    }
}
