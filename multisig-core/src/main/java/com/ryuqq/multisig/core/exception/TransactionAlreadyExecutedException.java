package com.ryuqq.multisig.core.exception;

/**
 * 이미 실행된 트랜잭션을 승인하거나 다시 실행하려 한 경우.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class TransactionAlreadyExecutedException extends MultiSigException {

    private final long transactionId;

    public TransactionAlreadyExecutedException(long transactionId) {
        super(ErrorCode.TRANSACTION_ALREADY_EXECUTED, "Transaction " + transactionId + " is already executed");
        this.transactionId = transactionId;
    }

    public long getTransactionId() {
        return transactionId;
    }
}
