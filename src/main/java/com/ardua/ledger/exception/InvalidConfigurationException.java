package com.ardua.ledger.exception;

/**
 * Setup data the engine relies on is wrong: an import profile without a sign
 * rule, a non-numeric code in the bank account code range, a missing standard account.
 */
public class InvalidConfigurationException extends LedgerDomainException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }
}
