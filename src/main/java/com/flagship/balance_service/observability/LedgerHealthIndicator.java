package com.flagship.balance_service.observability;

import com.flagship.balance_service.ledger.Ledger;
import com.flagship.balance_service.ledger.LedgerSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the ledger.
 * Down if either counter has gone negative, which would mean the guarded update was bypassed.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final Ledger ledger;

    public LedgerHealthIndicator(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Health health() {
        LedgerSnapshot snapshot = ledger.snapshot();

        Health.Builder builder = snapshot.getBalance() >= 0 && snapshot.getBank() >= 0
                ? Health.up()
                : Health.down();

        return builder
                .withDetail("balance", snapshot.getBalance())
                .withDetail("bank", snapshot.getBank())
                .build();
    }
}
