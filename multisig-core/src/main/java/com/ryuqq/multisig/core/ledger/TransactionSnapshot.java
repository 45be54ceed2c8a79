package com.ryuqq.multisig.core.ledger;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;
import com.ryuqq.multisig.core.statemachine.TransactionState;

/**
 * 트랜잭션 조회 결과 (불변).
 *
 * @param id 트랜잭션 ID
 * @param recipient 수신자
 * @param value 이전할 가치
 * @param approvalCount 승인 수
 * @param executed 실행 여부
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record TransactionSnapshot(
    long id,
    Address recipient,
    Amount value,
    int approvalCount,
    boolean executed
) {

    public TransactionSnapshot {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public TransactionState state() {
        return TransactionState.of(approvalCount, executed);
    }
}
