package com.ryuqq.multisig.core.event;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * 새 트랜잭션이 제안됨.
 *
 * @param transactionId 할당된 트랜잭션 ID
 * @param proposer 제안한 Owner
 * @param recipient 수신자
 * @param value 이전할 가치
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record ProposedTransaction(
    long transactionId,
    Address proposer,
    Address recipient,
    Amount value
) implements WalletEvent {
}
