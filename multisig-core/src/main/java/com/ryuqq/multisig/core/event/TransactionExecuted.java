package com.ryuqq.multisig.core.event;

import com.ryuqq.multisig.core.model.Address;

/**
 * 트랜잭션 실행 성공 (가치 이전 완료).
 *
 * @param transactionId 트랜잭션 ID
 * @param executor 실행한 Owner
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record TransactionExecuted(long transactionId, Address executor) implements WalletEvent {
}
