package com.ryuqq.multisig.core.exception;

/**
 * 진행 중인 변경 연산(주로 execute의 가치 이전 단계) 안에서 다시 변경 연산을 호출한 경우.
 *
 * <p>트랜잭션 ID별 검증보다 먼저, 무조건 거부됩니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class ReentrantCallException extends MultiSigException {

    private final String operation;

    public ReentrantCallException(String operation) {
        super(ErrorCode.REENTRANT_CALL, "Reentrant call to " + operation + " rejected");
        this.operation = operation;
    }

    /**
     * 거부된 연산 이름 (예: execute).
     *
     * @return 연산 이름
     */
    public String getOperation() {
        return operation;
    }
}
