package com.ryuqq.multisig.engine;

import com.ryuqq.multisig.core.model.Address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 지갑 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>address: 가치 원장에서 풀을 식별하는 Address (Zero Address 불가)</li>
 *   <li>owners: Owner 목록 (순서 유지)</li>
 *   <li>requiredApprovals: 실행에 필요한 최소 승인 수</li>
 * </ul>
 *
 * <p>owners와 requiredApprovals의 의미 검증(빈 목록, 범위, 중복, Zero Address)은
 * 지갑 생성 시 OwnerRegistry가 수행하므로, 이 record는 null만 검사합니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 * @param address 풀 Address
 * @param owners Owner 목록 (null 요소는 생성 시 ZeroAddressOwner로 거부됨)
 * @param requiredApprovals 필요 승인 수
 */
public record WalletConfig(Address address, List<Address> owners, int requiredApprovals) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException address가 null/Zero Address이거나 owners가 null인 경우
     */
    public WalletConfig {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (address.isZero()) {
            throw new IllegalArgumentException("address cannot be the zero address");
        }
        if (owners == null) {
            throw new IllegalArgumentException("owners cannot be null");
        }
        // List.copyOf는 null 요소를 거부하므로 사용하지 않음
        owners = Collections.unmodifiableList(new ArrayList<>(owners));
    }

    /**
     * owners만 변경한 새 인스턴스 생성.
     *
     * @param owners 새 Owner 목록
     * @return 새 WalletConfig 인스턴스
     */
    public WalletConfig withOwners(List<Address> owners) {
        return new WalletConfig(this.address, owners, this.requiredApprovals);
    }

    /**
     * requiredApprovals만 변경한 새 인스턴스 생성.
     *
     * @param requiredApprovals 새 필요 승인 수
     * @return 새 WalletConfig 인스턴스
     */
    public WalletConfig withRequiredApprovals(int requiredApprovals) {
        return new WalletConfig(this.address, this.owners, requiredApprovals);
    }
}
