package com.ardua.ledger.ledger;

import lombok.Value;

/**
 * Chart-of-accounts entry. Codes are unique strings; accounts referenced by a
 * journal line are never deleted, only deactivated.
 */
@Value
public class Account {

    /** Wide enough for a bank account's "{institution} ({masked})" name. */
    public static final int MAX_NAME_LENGTH = 300;

    Long id;
    String code;
    String name;
    AccountType type;
    boolean active;
}
