package com.ryuqq.multisig.core.event;

import com.ryuqq.multisig.core.model.Address;

/**
 * 이미 승인한 Owner가 같은 트랜잭션을 다시 승인함.
 *
 * <p>오류가 아니라 멱등 처리이며, approvalCount는 변하지 않습니다.</p>
 *
 * @param transactionId 트랜잭션 ID
 * @param approver 재승인을 시도한 Owner
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record AlreadyApprovedTransaction(long transactionId, Address approver) implements WalletEvent {
}
