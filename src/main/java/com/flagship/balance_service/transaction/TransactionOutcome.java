package com.flagship.balance_service.transaction;

import com.flagship.balance_service.ledger.LedgerSnapshot;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one pay or save request, rendered as plain text.
 * Not retained after the response is written.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionOutcome {

    static final String INVALID_AMOUNT_MESSAGE = "invalid amount";
    static final String READ_ERROR_PREFIX = "error read HTTP body: ";

    public enum Status {
        SUCCESS,
        INSUFFICIENT_FUNDS,
        INVALID_AMOUNT,
        READ_ERROR
    }

    TransactionType type;
    Status status;
    LedgerSnapshot snapshot;
    String detail;

    public static TransactionOutcome success(TransactionType type, LedgerSnapshot snapshot) {
        return new TransactionOutcome(type, Status.SUCCESS, snapshot, null);
    }

    public static TransactionOutcome insufficientFunds(TransactionType type) {
        return new TransactionOutcome(type, Status.INSUFFICIENT_FUNDS, null, null);
    }

    public static TransactionOutcome invalidAmount(TransactionType type) {
        return new TransactionOutcome(type, Status.INVALID_AMOUNT, null, null);
    }

    public static TransactionOutcome readError(TransactionType type, String detail) {
        return new TransactionOutcome(type, Status.READ_ERROR, null, detail);
    }

    public String render() {
        return switch (status) {
            case SUCCESS -> String.format("current balance: %d, current bank: %d",
                    snapshot.getBalance(), snapshot.getBank());
            case INSUFFICIENT_FUNDS -> type.getInsufficientFundsMessage();
            case INVALID_AMOUNT -> INVALID_AMOUNT_MESSAGE;
            case READ_ERROR -> READ_ERROR_PREFIX + detail;
        };
    }
}
