package com.ryuqq.multisig.core.exception;

/**
 * 필요 승인 수(quorum)가 {@code 1 ≤ requiredApprovals ≤ ownerCount}를 벗어난 경우.
 *
 * <p>ownerCount는 중복 제거 전 입력 목록의 길이입니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class InvalidRequiredApprovalsException extends MultiSigException {

    private final int requiredApprovals;
    private final int ownerCount;

    public InvalidRequiredApprovalsException(int requiredApprovals, int ownerCount) {
        super(ErrorCode.INVALID_REQUIRED_APPROVALS,
            String.format("requiredApprovals must be between 1 and %d (current: %d)", ownerCount, requiredApprovals));
        this.requiredApprovals = requiredApprovals;
        this.ownerCount = ownerCount;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }

    public int getOwnerCount() {
        return ownerCount;
    }
}
