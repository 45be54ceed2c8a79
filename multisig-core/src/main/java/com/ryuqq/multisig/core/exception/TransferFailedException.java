package com.ryuqq.multisig.core.exception;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * 트랜잭션 실행 중 가치 이전이 실패한 경우.
 *
 * <p>풀 잔액 부족, 수신자의 수령 거부, 전송 계층 장애가 모두 여기에 해당합니다.
 * 이 예외가 보고될 때 트랜잭션의 executed 플래그는 이미 false로 롤백되어 있으며,
 * 어떤 가치도 이동하지 않았습니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class TransferFailedException extends MultiSigException {

    private final long transactionId;
    private final Address recipient;
    private final Amount value;
    private final String reason;

    public TransferFailedException(long transactionId, Address recipient, Amount value, String reason) {
        this(transactionId, recipient, value, reason, null);
    }

    public TransferFailedException(long transactionId, Address recipient, Amount value, String reason, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED,
            String.format("Transfer of %s to %s for transaction %d failed: %s", value, recipient, transactionId, reason),
            cause);
        this.transactionId = transactionId;
        this.recipient = recipient;
        this.value = value;
        this.reason = reason;
    }

    public long getTransactionId() {
        return transactionId;
    }

    public Address getRecipient() {
        return recipient;
    }

    public Amount getValue() {
        return value;
    }

    public String getReason() {
        return reason;
    }
}
