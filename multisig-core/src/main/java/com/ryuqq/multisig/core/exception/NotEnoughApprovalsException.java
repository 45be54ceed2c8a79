package com.ryuqq.multisig.core.exception;

/**
 * 승인 수가 quorum에 도달하지 않은 트랜잭션을 실행하려 한 경우.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class NotEnoughApprovalsException extends MultiSigException {

    private final long transactionId;
    private final int approvalCount;
    private final int requiredApprovals;

    public NotEnoughApprovalsException(long transactionId, int approvalCount, int requiredApprovals) {
        super(ErrorCode.NOT_ENOUGH_APPROVALS,
            String.format("Transaction %d has %d approval(s), %d required", transactionId, approvalCount, requiredApprovals));
        this.transactionId = transactionId;
        this.approvalCount = approvalCount;
        this.requiredApprovals = requiredApprovals;
    }

    public long getTransactionId() {
        return transactionId;
    }

    public int getApprovalCount() {
        return approvalCount;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }
}
