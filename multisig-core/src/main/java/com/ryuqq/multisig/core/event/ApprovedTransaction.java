package com.ryuqq.multisig.core.event;

import com.ryuqq.multisig.core.model.Address;

/**
 * Owner가 트랜잭션을 처음 승인함 (approvalCount 1 증가).
 *
 * @param transactionId 트랜잭션 ID
 * @param approver 승인한 Owner
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record ApprovedTransaction(long transactionId, Address approver) implements WalletEvent {
}
