package com.flagship.balance_service.transaction;

import com.flagship.balance_service.ledger.Ledger;
import com.flagship.balance_service.ledger.LedgerResult;
import com.flagship.balance_service.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * Turns a raw request body into a guarded ledger operation.
 *
 * The body must be a base-10 integer with nothing around it. Unparseable and
 * negative amounts are answered with "invalid amount" and never reach the
 * ledger. Zero is accepted and leaves the ledger unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final Ledger ledger;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Debits the balance (POST /pay).
     */
    public TransactionOutcome pay(String body) {
        OptionalLong amount = parseAmount(body);
        if (amount.isEmpty()) {
            return reject(TransactionOutcome.invalidAmount(TransactionType.PAY));
        }

        LedgerResult result = ledger.debit(amount.getAsLong());
        if (!result.isApplied()) {
            log.info("Low balance: tried {}, have {}", amount.getAsLong(), result.getSnapshot().getBalance());
            return reject(TransactionOutcome.insufficientFunds(TransactionType.PAY));
        }

        log.info("Payment successful: {}, new balance: {}", amount.getAsLong(), result.getSnapshot().getBalance());
        ledgerMetrics.recordOperation("pay", "success");
        return TransactionOutcome.success(TransactionType.PAY, result.getSnapshot());
    }

    /**
     * Moves funds from the balance into the bank (POST /save).
     */
    public TransactionOutcome save(String body) {
        OptionalLong amount = parseAmount(body);
        if (amount.isEmpty()) {
            return reject(TransactionOutcome.invalidAmount(TransactionType.SAVE));
        }

        LedgerResult result = ledger.transfer(amount.getAsLong());
        if (!result.isApplied()) {
            log.info("Low balance for transfer: tried {}, have {}",
                    amount.getAsLong(), result.getSnapshot().getBalance());
            return reject(TransactionOutcome.insufficientFunds(TransactionType.SAVE));
        }

        log.info("Transfer successful: {}, new balance: {}, bank: {}",
                amount.getAsLong(), result.getSnapshot().getBalance(), result.getSnapshot().getBank());
        ledgerMetrics.recordOperation("save", "success");
        return TransactionOutcome.success(TransactionType.SAVE, result.getSnapshot());
    }

    /**
     * Builds the outcome for a body that could not be read from the transport.
     */
    public TransactionOutcome readFailure(TransactionType type, Exception e) {
        log.warn("Failed to read request body: {}", e.getMessage());
        return reject(TransactionOutcome.readError(type, e.getMessage()));
    }

    /**
     * Parses the body as a non-negative base-10 long.
     *
     * @return the amount, or empty for malformed, out-of-range or negative input
     */
    static OptionalLong parseAmount(String body) {
        if (body == null) {
            return OptionalLong.empty();
        }
        long amount;
        try {
            amount = Long.parseLong(body);
        } catch (NumberFormatException e) {
            log.info("Parse error: {}", e.getMessage());
            return OptionalLong.empty();
        }
        if (amount < 0) {
            log.info("Rejected negative amount: {}", amount);
            return OptionalLong.empty();
        }
        return OptionalLong.of(amount);
    }

    private TransactionOutcome reject(TransactionOutcome outcome) {
        ledgerMetrics.recordOperation(outcome.getType().name().toLowerCase(Locale.ROOT),
                outcome.getStatus().name().toLowerCase(Locale.ROOT));
        return outcome;
    }
}
