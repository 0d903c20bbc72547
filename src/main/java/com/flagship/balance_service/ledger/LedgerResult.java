package com.flagship.balance_service.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a guarded ledger operation.
 *
 * The snapshot is the state right after the operation: the new counters when
 * applied, the untouched counters when rejected for insufficient funds.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerResult {
    boolean applied;
    LedgerSnapshot snapshot;

    public static LedgerResult applied(LedgerSnapshot snapshot) {
        return new LedgerResult(true, snapshot);
    }

    public static LedgerResult insufficientFunds(LedgerSnapshot snapshot) {
        return new LedgerResult(false, snapshot);
    }
}
