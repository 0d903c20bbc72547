package com.flagship.balance_service.transaction;

/**
 * The two ledger-mutating requests and the message each renders when the
 * balance does not cover the amount.
 */
public enum TransactionType {
    PAY("low balance"),
    SAVE("low balance for bank transfer");

    private final String insufficientFundsMessage;

    TransactionType(String insufficientFundsMessage) {
        this.insufficientFundsMessage = insufficientFundsMessage;
    }

    public String getInsufficientFundsMessage() {
        return insufficientFundsMessage;
    }
}
