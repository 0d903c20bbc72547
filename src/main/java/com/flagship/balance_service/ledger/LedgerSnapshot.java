package com.flagship.balance_service.ledger;

import lombok.Value;

/**
 * Point-in-time view of both ledger counters, taken under the ledger lock.
 */
@Value
public class LedgerSnapshot {
    long balance;
    long bank;
}
