package com.ryuqq.multisig.core.event;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * 풀에 가치가 들어옴.
 *
 * <p>deposit 호출, 다른 지갑의 지급, 원장에서의 직접 이전 등 경로와 무관하게
 * 확정된 입금마다 한 번 발행됩니다.</p>
 *
 * @param sender 입금자
 * @param amount 입금액
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record Deposit(Address sender, Amount amount) implements WalletEvent {

    public Deposit {
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
    }
}
