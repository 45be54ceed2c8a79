package com.ryuqq.multisig.adapter.inmemory.ledger;

import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.model.Amount;

/**
 * 가치를 받을 때 실행되는 수신자 코드 (contract 계정 시뮬레이션).
 *
 * <p>{@link InMemoryValueLedger}는 잔액을 옮긴 직후 이 콜백을 호출합니다.
 * 콜백 안에서는 지갑을 다시 호출하는 등 임의의 코드가 실행될 수 있습니다.</p>
 *
 * <ul>
 *   <li>true 반환 → 수령</li>
 *   <li>false 반환 또는 예외 → 수령 거부, 이전 전체가 되돌려짐</li>
 * </ul>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Receiver {

    /**
     * 가치 수령 콜백.
     *
     * @param from 송신 계정
     * @param amount 수령액
     * @return 수령하면 true
     */
    boolean onReceive(Address from, Amount amount);
}
