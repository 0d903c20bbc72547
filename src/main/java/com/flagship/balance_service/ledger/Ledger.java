package com.flagship.balance_service.ledger;

/**
 * The shared balance/bank pair.
 *
 * Invariants:
 * 1. balance >= 0 and bank >= 0 at all times
 * 2. balance only decreases through debit or transfer
 * 3. bank only increases through transfer
 * 4. a transfer moves the amount from balance to bank as one unit
 * 5. balance + bank never grows, and fits in a long from construction on,
 *    so a transfer cannot overflow the bank
 *
 * Every operation runs its check and its update while holding the same
 * monitor, so no two operations interleave and no reader ever sees a
 * transfer half applied.
 */
public class Ledger {

    private final Object lock = new Object();

    private long balance;
    private long bank;

    public Ledger(long initialBalance, long initialBank) {
        if (initialBalance < 0 || initialBank < 0) {
            throw new IllegalArgumentException(
                String.format("Ledger counters must be non-negative: balance=%d, bank=%d",
                    initialBalance, initialBank));
        }
        if (initialBalance > Long.MAX_VALUE - initialBank) {
            throw new IllegalArgumentException(
                String.format("Ledger total must fit in a long: balance=%d, bank=%d",
                    initialBalance, initialBank));
        }
        this.balance = initialBalance;
        this.bank = initialBank;
    }

    /**
     * Subtracts {@code amount} from the balance if the balance covers it.
     *
     * @param amount non-negative amount; zero leaves the ledger unchanged
     * @return applied result with the new state, or an insufficient-funds result
     * @throws IllegalArgumentException if amount is negative
     */
    public LedgerResult debit(long amount) {
        requireNonNegative(amount);
        synchronized (lock) {
            if (balance < amount) {
                return LedgerResult.insufficientFunds(currentState());
            }
            balance -= amount;
            return LedgerResult.applied(currentState());
        }
    }

    /**
     * Moves {@code amount} from the balance into the bank if the balance covers it.
     *
     * @param amount non-negative amount; zero leaves the ledger unchanged
     * @return applied result with the new state, or an insufficient-funds result
     * @throws IllegalArgumentException if amount is negative
     */
    public LedgerResult transfer(long amount) {
        requireNonNegative(amount);
        synchronized (lock) {
            if (balance < amount) {
                return LedgerResult.insufficientFunds(currentState());
            }
            balance -= amount;
            bank += amount;
            return LedgerResult.applied(currentState());
        }
    }

    /**
     * Consistent read of both counters.
     */
    public LedgerSnapshot snapshot() {
        synchronized (lock) {
            return currentState();
        }
    }

    // Caller must hold the lock.
    private LedgerSnapshot currentState() {
        return new LedgerSnapshot(balance, bank);
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Ledger amount must not be negative: " + amount);
        }
    }
}
