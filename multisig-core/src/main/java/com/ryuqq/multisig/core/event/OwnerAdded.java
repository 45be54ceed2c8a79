package com.ryuqq.multisig.core.event;

import com.ryuqq.multisig.core.model.Address;

/**
 * 지갑 생성 시 Owner 한 명이 등록됨.
 *
 * @param owner 등록된 Owner
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public record OwnerAdded(Address owner) implements WalletEvent {

    public OwnerAdded {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }
}
