package com.ryuqq.multisig.core.exception;

/**
 * 존재하지 않는 트랜잭션 ID를 참조한 경우 ({@code id >= transactionCount} 또는 음수).
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class InvalidTransactionNonceException extends MultiSigException {

    private final long transactionId;
    private final long transactionCount;

    public InvalidTransactionNonceException(long transactionId, long transactionCount) {
        super(ErrorCode.INVALID_TRANSACTION_NONCE,
            String.format("Transaction %d does not exist (transaction count: %d)", transactionId, transactionCount));
        this.transactionId = transactionId;
        this.transactionCount = transactionCount;
    }

    public long getTransactionId() {
        return transactionId;
    }

    public long getTransactionCount() {
        return transactionCount;
    }
}
