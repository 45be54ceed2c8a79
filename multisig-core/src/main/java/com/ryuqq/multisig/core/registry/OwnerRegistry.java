package com.ryuqq.multisig.core.registry;

import com.ryuqq.multisig.core.event.OwnerAdded;
import com.ryuqq.multisig.core.exception.InvalidRequiredApprovalsException;
import com.ryuqq.multisig.core.exception.NoOwnersException;
import com.ryuqq.multisig.core.exception.OwnerAlreadyExistsException;
import com.ryuqq.multisig.core.exception.ZeroAddressOwnerException;
import com.ryuqq.multisig.core.model.Address;
import com.ryuqq.multisig.core.spi.EventPublisher;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Owner 레지스트리.
 *
 * <p>승인 권한을 가진 주체 집합과 quorum(requiredApprovals)을 생성 시점에 한 번 확정하며,
 * 이후 절대 변경되지 않습니다.</p>
 *
 * <p><strong>생성 검증 순서:</strong></p>
 * <ol>
 *   <li>빈 목록 → {@link NoOwnersException}</li>
 *   <li>requiredApprovals가 1 미만이거나 목록 길이(중복 제거 전) 초과 → {@link InvalidRequiredApprovalsException}</li>
 *   <li>목록을 순서대로 순회하며:
 *     <ul>
 *       <li>null 또는 Zero Address → {@link ZeroAddressOwnerException}</li>
 *       <li>앞서 수락된 Owner의 반복 → {@link OwnerAlreadyExistsException}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>모든 검증을 통과한 뒤에만 Owner별 {@link OwnerAdded} 알림을 입력 순서대로 발행합니다.
 * 생성이 실패하면 알림도, 인스턴스도 남지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> Owner 추가/삭제/교체 연산 없음. thread-safe.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class OwnerRegistry {

    private final List<Address> owners;
    private final Set<Address> ownerSet;
    private final int requiredApprovals;

    private OwnerRegistry(Set<Address> accepted, int requiredApprovals) {
        this.owners = List.copyOf(accepted);
        this.ownerSet = Collections.unmodifiableSet(accepted);
        this.requiredApprovals = requiredApprovals;
    }

    /**
     * OwnerRegistry 생성.
     *
     * @param owners Owner 목록 (입력 순서가 열거 순서가 됨)
     * @param requiredApprovals 실행에 필요한 최소 승인 수
     * @param publisher OwnerAdded 알림을 받을 publisher
     * @return OwnerRegistry 인스턴스
     * @throws IllegalArgumentException owners 또는 publisher가 null인 경우
     * @throws NoOwnersException owners가 비어 있는 경우
     * @throws InvalidRequiredApprovalsException requiredApprovals가 범위를 벗어난 경우
     * @throws ZeroAddressOwnerException null 또는 Zero Address가 포함된 경우
     * @throws OwnerAlreadyExistsException 같은 Owner가 중복된 경우
     */
    public static OwnerRegistry create(List<Address> owners, int requiredApprovals, EventPublisher publisher) {
        if (owners == null) {
            throw new IllegalArgumentException("owners cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (owners.isEmpty()) {
            throw new NoOwnersException();
        }
        if (requiredApprovals < 1 || requiredApprovals > owners.size()) {
            throw new InvalidRequiredApprovalsException(requiredApprovals, owners.size());
        }

        Set<Address> accepted = new LinkedHashSet<>();
        for (int i = 0; i < owners.size(); i++) {
            Address owner = owners.get(i);
            if (owner == null || owner.isZero()) {
                throw new ZeroAddressOwnerException(i);
            }
            if (!accepted.add(owner)) {
                throw new OwnerAlreadyExistsException(owner);
            }
        }

        OwnerRegistry registry = new OwnerRegistry(accepted, requiredApprovals);
        for (Address owner : registry.owners) {
            publisher.publish(new OwnerAdded(owner));
        }
        return registry;
    }

    /**
     * Owner 여부 확인 (O(1)).
     *
     * @param principal 확인할 주체 (null 허용)
     * @return Owner이면 true, null이면 false
     */
    public boolean isOwner(Address principal) {
        return principal != null && ownerSet.contains(principal);
    }

    /**
     * 전체 Owner 목록 (입력 순서).
     *
     * @return 변경 불가 목록
     */
    public List<Address> listOwners() {
        return owners;
    }

    public int requiredApprovals() {
        return requiredApprovals;
    }

    public int ownerCount() {
        return owners.size();
    }

    @Override
    public String toString() {
        return "OwnerRegistry{owners=" + owners.size() + ", requiredApprovals=" + requiredApprovals + "}";
    }
}
