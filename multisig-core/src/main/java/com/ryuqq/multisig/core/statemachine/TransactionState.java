package com.ryuqq.multisig.core.statemachine;

/**
 * 트랜잭션의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PROPOSED → APPROVED (첫 승인)</li>
 *   <li>APPROVED → APPROVED (다른 Owner의 추가 승인)</li>
 *   <li>APPROVED → EXECUTED (quorum 도달 후 실행 성공)</li>
 *   <li><strong>EXECUTED에서 나가는 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PROPOSED
 *    │
 *    ▼ (approve)
 * APPROVED ◄─┐
 *    │       │ (approve, 다른 Owner)
 *    │ ──────┘
 *    ▼ (execute, approvalCount ≥ requiredApprovals)
 * EXECUTED
 *
 * 금지된 전이:
 * - EXECUTED → * ❌
 * - PROPOSED → EXECUTED ❌ (requiredApprovals ≥ 1)
 * - APPROVED → PROPOSED ❌ (승인 철회 없음)
 * </pre>
 *
 * <p>명시적인 취소 연산은 없습니다. 실행되지 않은 트랜잭션은 PROPOSED/APPROVED 상태로
 * 무기한 남습니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public enum TransactionState {

    /**
     * 제안됨 (승인 0).
     */
    PROPOSED,

    /**
     * 하나 이상의 승인이 기록됨.
     */
    APPROVED,

    /**
     * 실행 완료 (종료).
     */
    EXECUTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return EXECUTED인 경우 true
     */
    public boolean isTerminal() {
        return this == EXECUTED;
    }

    /**
     * 승인 수와 실행 여부로부터 상태 도출.
     *
     * @param approvalCount 승인 수 (0 이상)
     * @param executed 실행 여부
     * @return 도출된 상태
     * @throws IllegalArgumentException approvalCount가 음수인 경우
     */
    public static TransactionState of(int approvalCount, boolean executed) {
        if (approvalCount < 0) {
            throw new IllegalArgumentException("approvalCount cannot be negative (current: " + approvalCount + ")");
        }
        if (executed) {
            return EXECUTED;
        }
        return approvalCount == 0 ? PROPOSED : APPROVED;
    }
}
