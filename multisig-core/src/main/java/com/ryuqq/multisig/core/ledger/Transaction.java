package com.ryuqq.multisig.core.ledger;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;
import com.ryuqq.multisig.core.statemachine.StateTransition;
import com.ryuqq.multisig.core.statemachine.TransactionState;

import java.util.HashSet;
import java.util.Set;

/**
 * 제안된 트랜잭션 하나 (가변 내부 레코드).
 *
 * <p>이 객체는 {@link TransactionLedger} 밖으로 노출되지 않으며, 호출자에게는
 * {@link TransactionSnapshot}만 전달됩니다. 동기화는 호출 측(지갑 엔진)의 책임입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>approvalCount == approvals.size()</li>
 *   <li>EXECUTED 이후에는 어떤 필드도 변하지 않음</li>
 *   <li>revertExecution()은 진행 중인 실행을 되돌릴 때만 사용</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class Transaction {

    private final long id;
    private final Address recipient;
    private final Amount value;
    private final Set<Address> approvals;
    private boolean executed;

    Transaction(long id, Address recipient, Amount value) {
        if (id < 0) {
            throw new IllegalArgumentException("id cannot be negative (current: " + id + ")");
        }
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        this.id = id;
        this.recipient = recipient;
        this.value = value;
        this.approvals = new HashSet<>();
        this.executed = false;
    }

    /**
     * 승인 기록.
     *
     * @param approver 승인한 Owner
     * @return 새로 기록되었으면 true, 이미 승인한 Owner면 false
     * @throws IllegalStateException 이미 실행된 트랜잭션인 경우
     */
    public boolean approve(Address approver) {
        if (approver == null) {
            throw new IllegalArgumentException("approver cannot be null");
        }
        if (approvals.contains(approver)) {
            return false;
        }
        StateTransition.validate(state(), TransactionState.APPROVED);
        approvals.add(approver);
        return true;
    }

    /**
     * 실행 확정 (가치 이전 전에 먼저 기록).
     *
     * @throws IllegalStateException 승인이 없거나 이미 실행된 경우
     */
    public void markExecuted() {
        StateTransition.validate(state(), TransactionState.EXECUTED);
        this.executed = true;
    }

    /**
     * 가치 이전 실패 시 executed 플래그 롤백.
     *
     * @throws IllegalStateException executed가 아닌 상태에서 호출한 경우
     */
    public void revertExecution() {
        if (!executed) {
            throw new IllegalStateException("Transaction " + id + " is not marked executed");
        }
        this.executed = false;
    }

    public boolean hasApproved(Address principal) {
        return principal != null && approvals.contains(principal);
    }

    public long getId() {
        return id;
    }

    public Address getRecipient() {
        return recipient;
    }

    public Amount getValue() {
        return value;
    }

    public int getApprovalCount() {
        return approvals.size();
    }

    public boolean isExecuted() {
        return executed;
    }

    public TransactionState state() {
        return TransactionState.of(approvals.size(), executed);
    }

    /**
     * 현재 상태의 불변 스냅샷.
     *
     * @return TransactionSnapshot
     */
    public TransactionSnapshot snapshot() {
        return new TransactionSnapshot(id, recipient, value, approvals.size(), executed);
    }
}
