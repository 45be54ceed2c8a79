package com.ryuqq.multisig.core.exception;

import com.ryuqq.multisig.core.model.Address;

/**
 * Owner 목록에 같은 주체가 두 번 이상 나타난 경우.
 *
 * <p>중복은 조용히 제거하지 않고 생성 오류로 처리합니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public class OwnerAlreadyExistsException extends MultiSigException {

    private final Address owner;

    public OwnerAlreadyExistsException(Address owner) {
        super(ErrorCode.OWNER_ALREADY_EXISTS, "Owner already exists: " + owner);
        this.owner = owner;
    }

    public Address getOwner() {
        return owner;
    }
}
