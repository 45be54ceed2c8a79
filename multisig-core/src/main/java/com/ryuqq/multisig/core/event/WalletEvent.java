package com.ryuqq.multisig.core.event;

/**
 * 외부 관찰자에게 전달되는 지갑 알림.
 *
 * <p>각 알림은 트리거가 된 사건마다 정확히 한 번, 발생 순서대로 발행됩니다.
 * 실패한 연산은 알림을 남기지 않습니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 알림 종류가 컴파일 타임에 고정됩니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public sealed interface WalletEvent
    permits OwnerAdded, Deposit, ProposedTransaction, ApprovedTransaction,
            AlreadyApprovedTransaction, TransactionExecuted {

    /**
     * 알림 이름 (예: OwnerAdded).
     *
     * @return 알림 이름
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
